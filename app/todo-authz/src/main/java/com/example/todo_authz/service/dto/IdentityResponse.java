/*
 * どこで: todo-authz 下流 DTO
 * 何を: identity サービスのプロフィール応答のうち参照する項目を表現する
 * なぜ: traits はスキーマがデプロイごとに異なるため JsonNode のまま受けるため
 */
package com.example.todo_authz.service.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IdentityResponse(
    String id,
    JsonNode traits,
    List<VerifiableAddressDto> verifiableAddresses,
    JsonNode metadataPublic) {

  public IdentityResponse {
    verifiableAddresses = verifiableAddresses == null ? List.of() : verifiableAddresses;
  }
}
