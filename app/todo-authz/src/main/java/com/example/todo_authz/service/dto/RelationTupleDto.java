/*
 * どこで: todo-authz 下流 DTO
 * 何を: タプルストアの relation tuple 1件を表現する
 * なぜ: subject_id / subject_set のどちらで返っても境界で一度だけ解釈するため
 */
package com.example.todo_authz.service.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RelationTupleDto(
    String namespace, String object, String relation, String subjectId, SubjectSetDto subjectSet) {}
