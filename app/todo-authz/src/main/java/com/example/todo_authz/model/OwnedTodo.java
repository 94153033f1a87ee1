package com.example.todo_authz.model;

/** 管理者一覧用の todo。ownerId/ownerEmail はタプルや identity が無ければ null。 */
public record OwnedTodo(Todo todo, String ownerId, String ownerEmail) {

  public OwnedTodo withOwnerEmail(String email) {
    return new OwnedTodo(todo, ownerId, email);
  }
}
