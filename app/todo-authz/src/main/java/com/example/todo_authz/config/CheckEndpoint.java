/*
 * どこで: todo-authz 設定
 * 何を: check API の候補エンドポイント1件(HTTP メソッドとパス)を表現する
 * なぜ: タプルストアのバージョン差異を設定の追加だけで吸収するため
 */
package com.example.todo_authz.config;

import java.util.Locale;
import org.springframework.http.HttpMethod;

public record CheckEndpoint(String method, String path) {

  public CheckEndpoint {
    method = method == null || method.isBlank() ? "POST" : method.trim().toUpperCase(Locale.ROOT);
    if (!"POST".equals(method) && !"GET".equals(method)) {
      throw new IllegalArgumentException("check endpoint method must be GET or POST: " + method);
    }
    if (path == null || path.isBlank()) {
      throw new IllegalArgumentException("check endpoint path is required");
    }
  }

  public static CheckEndpoint post(String path) {
    return new CheckEndpoint("POST", path);
  }

  public HttpMethod httpMethod() {
    return HttpMethod.valueOf(method);
  }
}
