/*
 * どこで: todo-authz サービス層
 * 何を: ユーザーが管理者かどうかを identity の role とタプルストアのロール所属から判定する
 * なぜ: 管理者 API の入口で一箇所にまとめて判定するため
 */
package com.example.todo_authz.service;

import com.example.todo_authz.config.OwnershipProperties;
import com.example.todo_authz.model.CheckQuery;
import com.example.todo_authz.model.Identity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class AdminAuthorizationService {

  private static final Logger logger = LoggerFactory.getLogger(AdminAuthorizationService.class);

  private final IdentityClient identityClient;
  private final TupleStoreClient tupleStoreClient;
  private final OwnershipProperties properties;
  private final OwnershipMetrics metrics;

  public AdminAuthorizationService(
      IdentityClient identityClient,
      TupleStoreClient tupleStoreClient,
      OwnershipProperties properties,
      OwnershipMetrics metrics) {
    this.identityClient = identityClient;
    this.tupleStoreClient = tupleStoreClient;
    this.properties = properties;
    this.metrics = metrics;
  }

  /**
   * identity の role が管理者なら即 true。次にロール所属タプルを check する。
   *
   * <p>どちらの連携失敗もログに残して false 側へ倒す。
   */
  public boolean isAdmin(String userId) {
    try {
      final Identity identity = identityClient.getIdentity(userId);
      if (identity.hasRole(properties.adminRole())) {
        return true;
      }
    } catch (IdentityIntegrationException ex) {
      if (ex.reason() == IdentityIntegrationException.Reason.NOT_FOUND) {
        logger.debug("identity not found during admin check userId={}", userId);
      } else {
        logger.warn(
            "identity lookup failed during admin check userId={} reason={}",
            userId,
            ex.reason());
        metrics.recordIntegrationError("identity", ex.reason().name());
      }
    }
    try {
      return tupleStoreClient.check(
          CheckQuery.of(
              properties.adminNamespace(),
              properties.adminObject(),
              properties.adminRelation(),
              properties.subjectIdFor(userId)));
    } catch (TupleStoreIntegrationException ex) {
      logger.warn("admin role check failed userId={} reason={}", userId, ex.reason());
      metrics.recordIntegrationError("tuple_store", ex.reason().name());
      return false;
    }
  }

  public void requireAdmin(String userId) {
    if (!isAdmin(userId)) {
      logger.info("admin access denied userId={}", userId);
      throw new TodoAccessDeniedException("admin only");
    }
  }
}
