/*
 * どこで: todo-authz 設定
 * 何を: タプルストアの read/write それぞれに専用 RestClient を提供する
 * なぜ: read API と write API のポート/ホストを独立に設定するため
 */
package com.example.todo_authz.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(TupleStoreClientProperties.class)
public class TupleStoreClientConfig {

  @Bean
  RestClient tupleStoreReadRestClient(
      RestClient.Builder builder, TupleStoreClientProperties properties) {
    return builder
        .baseUrl(properties.readUrl())
        .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
        .build();
  }

  @Bean
  RestClient tupleStoreWriteRestClient(
      RestClient.Builder builder, TupleStoreClientProperties properties) {
    return builder
        .baseUrl(properties.writeUrl())
        .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
        .build();
  }
}
