/*
 * どこで: todo-authz サービス層
 * 何を: identity サービスからユーザーのプロフィール(role, email)を取得する
 * なぜ: 管理者判定と管理者一覧のメール表示に使うため
 */
package com.example.todo_authz.service;

import com.example.todo_authz.config.IdentityClientProperties;
import com.example.todo_authz.model.Identity;
import com.example.todo_authz.service.dto.IdentityResponse;
import com.example.todo_authz.service.dto.VerifiableAddressDto;
import com.fasterxml.jackson.databind.JsonNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

@Service
public class IdentityClient {

  private static final Logger logger = LoggerFactory.getLogger(IdentityClient.class);

  private final RestClient identityRestClient;
  private final IdentityClientProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public IdentityClient(RestClient identityRestClient, IdentityClientProperties properties) {
    this.identityRestClient = identityRestClient;
    this.properties = properties;
  }

  /** 候補パスを順に試し、すべて 404 なら NOT_FOUND とする。 */
  public Identity getIdentity(String identityId) {
    if (identityId == null || identityId.isBlank()) {
      throw new IllegalArgumentException("identityId is required");
    }
    for (String path : properties.identityPaths()) {
      final Optional<Identity> identity = attemptGet(path, identityId);
      if (identity.isPresent()) {
        return identity.get();
      }
    }
    logger.warn("identity not found on any candidate path id={}", identityId);
    throw new IdentityIntegrationException(
        IdentityIntegrationException.Reason.NOT_FOUND, "identity not found");
  }

  private Optional<Identity> attemptGet(String path, String identityId) {
    try {
      return identityRestClient
          .get()
          .uri(path, identityId)
          .exchange(
              (request, response) -> {
                final EndpointOutcome outcome = EndpointOutcome.classify(response.getStatusCode());
                if (outcome == EndpointOutcome.TRY_NEXT) {
                  return Optional.<Identity>empty();
                }
                if (outcome == EndpointOutcome.FATAL) {
                  logger.warn(
                      "identity getIdentity failed with http status={} path={}",
                      response.getStatusCode().value(),
                      path);
                  throw new IdentityIntegrationException(
                      IdentityIntegrationException.Reason.BAD_GATEWAY,
                      response.getStatusCode().is5xxServerError()
                          ? "identity server error"
                          : "identity request failed");
                }
                return Optional.of(toIdentity(response.bodyTo(IdentityResponse.class)));
              });
    } catch (ResourceAccessException ex) {
      if (RestClientFailures.isTimeout(ex)) {
        logger.warn("identity getIdentity timed out");
        throw new IdentityIntegrationException(
            IdentityIntegrationException.Reason.TIMEOUT, "identity request timeout", ex);
      }
      logger.warn("identity getIdentity connection failed", ex);
      throw new IdentityIntegrationException(
          IdentityIntegrationException.Reason.BAD_GATEWAY, "identity connection failed", ex);
    } catch (IdentityIntegrationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("identity response parse failed", ex);
      throw new IdentityIntegrationException(
          IdentityIntegrationException.Reason.INVALID_RESPONSE, "identity response parse failed", ex);
    }
  }

  private Identity toIdentity(IdentityResponse response) {
    if (response == null || response.id() == null || response.id().isBlank()) {
      throw new IdentityIntegrationException(
          IdentityIntegrationException.Reason.INVALID_RESPONSE, "identity response is invalid");
    }
    return new Identity(response.id(), resolveEmail(response), resolveRole(response));
  }

  // traits.email を優先し、無ければ検証対象アドレスの先頭を使う
  private String resolveEmail(IdentityResponse response) {
    final String traitsEmail = textOrNull(response.traits(), "email");
    if (traitsEmail != null) {
      return traitsEmail;
    }
    return response.verifiableAddresses().stream()
        .map(VerifiableAddressDto::value)
        .filter(value -> value != null && !value.isBlank())
        .findFirst()
        .orElse(null);
  }

  private String resolveRole(IdentityResponse response) {
    return textOrNull(response.metadataPublic(), "role");
  }

  private String textOrNull(JsonNode node, String field) {
    if (node == null) {
      return null;
    }
    final JsonNode value = node.get(field);
    if (value == null || !value.isTextual() || value.asText().isBlank()) {
      return null;
    }
    return value.asText();
  }
}
