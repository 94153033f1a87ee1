/*
 * どこで: todo-authz API DTO
 * 何を: todo の部分更新入力を定義する
 * なぜ: 省略された項目を「変更しない」として行ストアへ渡すため
 */
package com.example.todo_authz.api.request;

import com.example.todo_authz.model.TodoPatch;

public record UpdateTodoRequest(String title, Boolean completed) {

  public TodoPatch toPatch() {
    return new TodoPatch(title, completed);
  }
}
