/*
 * どこで: todo-authz サービス層
 * 何を: 所有タプルの check が false だった操作の拒否を表現する
 * なぜ: 認可拒否を 403 へ、タプルストア障害を 500 へ分けて正規化するため
 */
package com.example.todo_authz.service;

public class TodoAccessDeniedException extends RuntimeException {

  public TodoAccessDeniedException(String message) {
    super(message);
  }
}
