package com.example.todo_authz.service.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/**
 * expand API のノード。
 *
 * <p>旧形式はノード直下に subject_id / subject_set を持ち、新形式は tuple の中に持つ。
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SubjectTreeDto(
    String type,
    String subjectId,
    SubjectSetDto subjectSet,
    RelationTupleDto tuple,
    List<SubjectTreeDto> children) {

  public SubjectTreeDto {
    children = children == null ? List.of() : children;
  }
}
