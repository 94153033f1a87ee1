/*
 * どこで: todo-authz 設定
 * 何を: レコードストア(REST 形式の行 API)呼び出し専用 RestClient を提供する
 * なぜ: API キーのヘッダ付与を呼び出し側から切り離すため
 */
package com.example.todo_authz.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(RecordStoreClientProperties.class)
public class RecordStoreClientConfig {

  @Bean
  RestClient recordStoreRestClient(
      RestClient.Builder builder, RecordStoreClientProperties properties) {
    final RestClient.Builder configured = builder.baseUrl(properties.baseUrl());
    if (!properties.apiKey().isBlank()) {
      configured
          .defaultHeader("apikey", properties.apiKey())
          .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.apiKey());
    }
    return configured.build();
  }
}
