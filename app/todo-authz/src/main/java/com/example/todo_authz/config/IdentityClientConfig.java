package com.example.todo_authz.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(IdentityClientProperties.class)
public class IdentityClientConfig {

  @Bean
  RestClient identityRestClient(RestClient.Builder builder, IdentityClientProperties properties) {
    // identity 管理 API 呼び出し専用 RestClient。
    return builder.baseUrl(properties.adminUrl()).build();
  }
}
