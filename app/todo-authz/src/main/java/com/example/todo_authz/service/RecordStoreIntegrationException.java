package com.example.todo_authz.service;

public class RecordStoreIntegrationException extends RuntimeException {

  public enum Reason {
    BAD_GATEWAY,
    TIMEOUT,
    INVALID_RESPONSE
  }

  private final Reason reason;

  public RecordStoreIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public RecordStoreIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
