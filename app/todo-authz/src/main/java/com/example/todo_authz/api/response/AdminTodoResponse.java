package com.example.todo_authz.api.response;

import com.example.todo_authz.model.OwnedTodo;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** 管理者一覧の 1 行。所有者が特定できない場合 owner_id/owner_email は null。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AdminTodoResponse(
    long id,
    String title,
    boolean completed,
    String createdAt,
    String ownerId,
    String ownerEmail) {

  public static AdminTodoResponse from(OwnedTodo owned) {
    return new AdminTodoResponse(
        owned.todo().id(),
        owned.todo().title(),
        owned.todo().completed(),
        owned.todo().createdAt(),
        owned.ownerId(),
        owned.ownerEmail());
  }
}
