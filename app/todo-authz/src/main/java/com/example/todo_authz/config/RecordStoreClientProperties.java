package com.example.todo_authz.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "record-store")
public record RecordStoreClientProperties(String baseUrl, String apiKey, String table) {

  public RecordStoreClientProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "http://postgrest:3000" : baseUrl;
    apiKey = apiKey == null ? "" : apiKey;
    table = table == null || table.isBlank() ? "todos" : table;
  }

  public String tablePath() {
    return "/rest/v1/" + table;
  }
}
