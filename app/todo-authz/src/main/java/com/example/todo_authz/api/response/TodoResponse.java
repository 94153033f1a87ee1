package com.example.todo_authz.api.response;

import com.example.todo_authz.model.Todo;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TodoResponse(long id, String title, boolean completed, String createdAt) {

  public static TodoResponse from(Todo todo) {
    return new TodoResponse(todo.id(), todo.title(), todo.completed(), todo.createdAt());
  }
}
