package com.example.todo_authz.service.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RelationTuplesResponse(List<RelationTupleDto> relationTuples, String nextPageToken) {

  public RelationTuplesResponse {
    relationTuples = relationTuples == null ? List.of() : relationTuples;
  }
}
