package com.example.todo_authz.service.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CheckRequestBody(
    String namespace,
    String object,
    String relation,
    String subjectId,
    SubjectSetDto subjectSet,
    Integer maxDepth) {}
