package com.example.todo_authz.service;

public class TodoNotFoundException extends RuntimeException {

  private final long todoId;

  public TodoNotFoundException(long todoId) {
    super("todo not found: " + todoId);
    this.todoId = todoId;
  }

  public long todoId() {
    return todoId;
  }
}
