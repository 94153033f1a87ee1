/*
 * どこで: todo-authz 下流 DTO
 * 何を: check API の応答 {"allowed": bool} を表現する
 * なぜ: allowed 欠落や非 boolean を例外にせず false として扱う既定値を一箇所に固定するため
 */
package com.example.todo_authz.service.dto;

import com.fasterxml.jackson.databind.JsonNode;

public record CheckResponse(JsonNode allowed) {

  /** allowed が boolean の true のときだけ true。欠落・null・文字列などは false。 */
  public boolean isAllowed() {
    return allowed != null && allowed.isBoolean() && allowed.booleanValue();
  }
}
