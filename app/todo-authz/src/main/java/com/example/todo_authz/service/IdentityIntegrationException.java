package com.example.todo_authz.service;

public class IdentityIntegrationException extends RuntimeException {

  public enum Reason {
    NOT_FOUND,
    BAD_GATEWAY,
    TIMEOUT,
    INVALID_RESPONSE
  }

  private final Reason reason;

  public IdentityIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public IdentityIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
