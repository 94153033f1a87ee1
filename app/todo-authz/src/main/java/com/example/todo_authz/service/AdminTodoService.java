/*
 * どこで: todo-authz サービス層
 * 何を: 管理者向けの一覧・削除・所有者展開を、管理者判定とメール補完つきで提供する
 * なぜ: 所有者 ID だけでは運用画面で誰の todo か分からないため
 */
package com.example.todo_authz.service;

import com.example.todo_authz.model.Identity;
import com.example.todo_authz.model.OwnedTodo;
import com.example.todo_authz.model.SubjectTree;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class AdminTodoService {

  private static final Logger logger = LoggerFactory.getLogger(AdminTodoService.class);

  private final AdminAuthorizationService adminAuthorizationService;
  private final OwnershipOrchestrator ownershipOrchestrator;
  private final IdentityClient identityClient;

  public AdminTodoService(
      AdminAuthorizationService adminAuthorizationService,
      OwnershipOrchestrator ownershipOrchestrator,
      IdentityClient identityClient) {
    this.adminAuthorizationService = adminAuthorizationService;
    this.ownershipOrchestrator = ownershipOrchestrator;
    this.identityClient = identityClient;
  }

  /** 所有者メールは同じ所有者につき 1 リクエスト 1 回だけ引く。失敗時は null。 */
  public List<OwnedTodo> listAllWithOwners(String actingUserId) {
    adminAuthorizationService.requireAdmin(actingUserId);
    final List<OwnedTodo> owned = ownershipOrchestrator.adminListAllWithOwners();
    final Map<String, Optional<String>> emailByOwner = new HashMap<>();
    final List<OwnedTodo> enriched = new ArrayList<>(owned.size());
    for (OwnedTodo todo : owned) {
      if (todo.ownerId() == null) {
        enriched.add(todo);
        continue;
      }
      final Optional<String> email =
          emailByOwner.computeIfAbsent(todo.ownerId(), this::lookupEmail);
      enriched.add(todo.withOwnerEmail(email.orElse(null)));
    }
    return enriched;
  }

  public void deleteTodo(String actingUserId, long todoId) {
    adminAuthorizationService.requireAdmin(actingUserId);
    ownershipOrchestrator.adminDelete(todoId);
  }

  public SubjectTree expandOwners(String actingUserId, long todoId) {
    adminAuthorizationService.requireAdmin(actingUserId);
    return ownershipOrchestrator.ownerTree(todoId);
  }

  private Optional<String> lookupEmail(String ownerId) {
    try {
      final Identity identity = identityClient.getIdentity(ownerId);
      return Optional.ofNullable(identity.email());
    } catch (IdentityIntegrationException ex) {
      logger.warn("owner email lookup failed ownerId={} reason={}", ownerId, ex.reason());
      return Optional.empty();
    }
  }
}
