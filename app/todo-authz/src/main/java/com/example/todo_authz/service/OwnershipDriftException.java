/*
 * どこで: todo-authz サービス層
 * 何を: 行の作成は成功したが所有タプルの書き込みに失敗した状態を表現する
 * なぜ: 所有者不在の行が残ったことを呼び出し側へ失敗として返すため
 */
package com.example.todo_authz.service;

import com.example.todo_authz.model.Todo;

public class OwnershipDriftException extends RuntimeException {

  private final transient Todo createdTodo;

  public OwnershipDriftException(Todo createdTodo, String message, Throwable cause) {
    super(message, cause);
    this.createdTodo = createdTodo;
  }

  public Todo createdTodo() {
    return createdTodo;
  }
}
