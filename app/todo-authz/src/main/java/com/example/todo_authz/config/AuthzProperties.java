package com.example.todo_authz.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "authz")
public record AuthzProperties(String userIdHeaderName, List<String> allowedOrigins) {

  public AuthzProperties {
    userIdHeaderName =
        userIdHeaderName == null || userIdHeaderName.isBlank() ? "X-User-Id" : userIdHeaderName;
    allowedOrigins =
        allowedOrigins == null || allowedOrigins.isEmpty()
            ? List.of("*")
            : List.copyOf(allowedOrigins);
  }
}
