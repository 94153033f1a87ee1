package com.example.todo_authz.service;

import java.net.SocketTimeoutException;
import org.springframework.web.client.ResourceAccessException;

final class RestClientFailures {

  private RestClientFailures() {}

  static boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
