/*
 * どこで: todo-authz サービス層
 * 何を: 候補エンドポイントへの応答ステータスを 成功/次候補/致命的 に分類する
 * なぜ: 404 を「この形式は未提供」と解釈する規則を check と identity 取得で共有するため
 */
package com.example.todo_authz.service;

import org.springframework.http.HttpStatusCode;

enum EndpointOutcome {
  SUCCESS,
  TRY_NEXT,
  FATAL;

  static EndpointOutcome classify(HttpStatusCode status) {
    if (status.is2xxSuccessful()) {
      return SUCCESS;
    }
    if (status.value() == 404) {
      return TRY_NEXT;
    }
    return FATAL;
  }
}
