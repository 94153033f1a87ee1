/*
 * どこで: todo-authz 設定
 * 何を: タプルストア(read/write API)の接続先と各パスを保持する
 * なぜ: read と write でネットワーク上の配置が異なるデプロイに対応するため
 */
package com.example.todo_authz.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "tuple-store")
public record TupleStoreClientProperties(
    String readUrl,
    String writeUrl,
    List<CheckEndpoint> checkEndpoints,
    String listPath,
    String expandPath,
    String writePath) {

  public static final List<CheckEndpoint> DEFAULT_CHECK_ENDPOINTS =
      List.of(
          CheckEndpoint.post("/relation-tuples/check/openapi"),
          CheckEndpoint.post("/relation-tuples/check"),
          CheckEndpoint.post("/v1/relation-tuples/check/openapi"),
          CheckEndpoint.post("/v1/relation-tuples/check"));

  public TupleStoreClientProperties {
    readUrl = readUrl == null || readUrl.isBlank() ? "http://keto:4466" : readUrl;
    writeUrl = writeUrl == null || writeUrl.isBlank() ? "http://keto:4467" : writeUrl;
    checkEndpoints =
        checkEndpoints == null || checkEndpoints.isEmpty()
            ? DEFAULT_CHECK_ENDPOINTS
            : List.copyOf(checkEndpoints);
    listPath = listPath == null || listPath.isBlank() ? "/relation-tuples" : listPath;
    expandPath =
        expandPath == null || expandPath.isBlank() ? "/relation-tuples/expand" : expandPath;
    writePath = writePath == null || writePath.isBlank() ? "/relation-tuples" : writePath;
  }
}
