package com.example.todo_authz.service.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WriteRelationTupleRequest(
    String namespace, String object, String relation, String subjectId) {}
