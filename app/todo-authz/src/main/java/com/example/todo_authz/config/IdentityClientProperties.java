package com.example.todo_authz.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "identity")
public record IdentityClientProperties(String adminUrl, List<String> identityPaths) {

  public IdentityClientProperties {
    adminUrl = adminUrl == null || adminUrl.isBlank() ? "http://kratos:4434" : adminUrl;
    // 管理者向けパスを先に試し、404 のときだけ次の候補へ進む
    identityPaths =
        identityPaths == null || identityPaths.isEmpty()
            ? List.of("/admin/identities/{id}", "/identities/{id}")
            : List.copyOf(identityPaths);
  }
}
