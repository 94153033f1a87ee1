/*
 * どこで: todo-authz サービス層
 * 何を: タプルストア呼び出し失敗を表現する
 * なぜ: 認可判断の失敗を Forbidden と区別し、API 層で内部エラーへ一貫変換するため
 */
package com.example.todo_authz.service;

public class TupleStoreIntegrationException extends RuntimeException {

  public enum Reason {
    BAD_GATEWAY,
    TIMEOUT,
    INVALID_RESPONSE,
    NO_CHECK_ENDPOINT
  }

  private final Reason reason;

  public TupleStoreIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public TupleStoreIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
