/*
 * どこで: todo-authz サービス層
 * 何を: 所有タプルの check と行の変更を順番に組み立てる
 * なぜ: タプルストアと行ストアの間にトランザクションが無い前提で、各操作をタプルの事実に紐づけるため
 */
package com.example.todo_authz.service;

import com.example.todo_authz.config.OwnershipProperties;
import com.example.todo_authz.model.CheckQuery;
import com.example.todo_authz.model.ListPage;
import com.example.todo_authz.model.ListQuery;
import com.example.todo_authz.model.OwnedTodo;
import com.example.todo_authz.model.RelationTuple;
import com.example.todo_authz.model.SubjectTree;
import com.example.todo_authz.model.Todo;
import com.example.todo_authz.model.TodoPatch;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * 所有者ベースの CRUD と管理者向けの所有者一覧を提供する。
 *
 * <p>update/delete は check の後に行を変更するが、その間に権限が取り消されても再検証しない(TOCTOU)。
 * 行とタプルの一時的な不整合は {@link OwnershipWarning} としてログとメトリクスへ流し、自動修復はしない。
 */
@Service
public class OwnershipOrchestrator {

  private static final Logger logger = LoggerFactory.getLogger(OwnershipOrchestrator.class);

  private final TupleStoreClient tupleStoreClient;
  private final TodoRecordStore todoRecordStore;
  private final OwnershipProperties properties;
  private final OwnershipMetrics metrics;

  public OwnershipOrchestrator(
      TupleStoreClient tupleStoreClient,
      TodoRecordStore todoRecordStore,
      OwnershipProperties properties,
      OwnershipMetrics metrics) {
    this.tupleStoreClient = tupleStoreClient;
    this.todoRecordStore = todoRecordStore;
    this.properties = properties;
    this.metrics = metrics;
  }

  /** ユーザーが所有する todo を作成日時の降順で返す。所有が無ければ行ストアは呼ばない。 */
  public List<Todo> list(String userId) {
    final ListPage page =
        tupleStoreClient.list(
            ListQuery.builder()
                .namespace(properties.namespace())
                .relation(properties.relation())
                .subjectId(properties.subjectIdFor(userId))
                .pageSize(properties.listPageSize())
                .build());
    final Set<Long> ids = new LinkedHashSet<>();
    for (RelationTuple tuple : page.tuples()) {
      final Long id = parseObjectId(tuple.object());
      if (id != null) {
        ids.add(id);
      }
    }
    if (ids.isEmpty()) {
      return List.of();
    }
    return todoRecordStore.findByIds(ids);
  }

  /**
   * 行を先に作成し、その後に所有タプルを書き込む。
   *
   * @throws OwnershipDriftException タプルの書き込みに失敗した場合。行は作成済みのまま残る
   */
  public Todo create(String userId, String title) {
    final Todo created = todoRecordStore.create(title);
    final String object = String.valueOf(created.id());
    final String subjectId = properties.subjectIdFor(userId);
    try {
      tupleStoreClient.createTuple(
          properties.namespace(), object, properties.relation(), subjectId);
    } catch (TupleStoreIntegrationException ex) {
      report(
          CleanupResult.of(
              List.of(
                  new OwnershipWarning(
                      OwnershipWarning.Kind.TUPLE_WRITE_FAILED,
                      properties.namespace(),
                      object,
                      properties.relation(),
                      subjectId,
                      ex.getMessage()))));
      throw new OwnershipDriftException(created, "ownership tuple write failed", ex);
    }
    return created;
  }

  public Todo update(String userId, long id, TodoPatch patch) {
    requireOwner(userId, id);
    return todoRecordStore.update(id, patch);
  }

  /** 行の削除が成功すれば、タプルの後始末が失敗しても成功として扱う。 */
  public void delete(String userId, long id) {
    requireOwner(userId, id);
    todoRecordStore.delete(id);
    report(deleteOwnerTuple(String.valueOf(id), properties.subjectIdFor(userId)));
  }

  /**
   * 全行と所有タプルを結合する。
   *
   * <p>所有タプルは先頭ページだけを読むため、件数が adminListPageSize を超えると所有者が欠ける。
   */
  public List<OwnedTodo> adminListAllWithOwners() {
    final List<Todo> todos = todoRecordStore.findAll();
    final ListPage page =
        tupleStoreClient.list(
            ListQuery.builder()
                .namespace(properties.namespace())
                .relation(properties.relation())
                .pageSize(properties.adminListPageSize())
                .build());
    if (page.hasNextPage()) {
      logger.warn(
          "owner index truncated at first page pageSize={} tuples={}",
          properties.adminListPageSize(),
          page.tuples().size());
    }
    final Map<Long, String> ownerById = new HashMap<>();
    for (RelationTuple tuple : page.tuples()) {
      final Long id = parseObjectId(tuple.object());
      if (id == null || tuple.subject().isSet()) {
        continue;
      }
      ownerById.putIfAbsent(id, properties.userIdFromSubject(tuple.subject().subjectId()));
    }
    final List<OwnedTodo> result = new ArrayList<>(todos.size());
    for (Todo todo : todos) {
      result.add(new OwnedTodo(todo, ownerById.get(todo.id()), null));
    }
    return result;
  }

  /** 所有チェックなしで行を削除し、その object の所有タプルを主体を問わず片付ける。 */
  public void adminDelete(long id) {
    todoRecordStore.delete(id);
    report(deleteAllOwnerTuples(String.valueOf(id)));
  }

  public SubjectTree ownerTree(long id) {
    return tupleStoreClient.expand(
        properties.namespace(), String.valueOf(id), properties.relation(), null);
  }

  private void requireOwner(String userId, long id) {
    final boolean allowed =
        tupleStoreClient.check(
            CheckQuery.of(
                properties.namespace(),
                String.valueOf(id),
                properties.relation(),
                properties.subjectIdFor(userId)));
    if (!allowed) {
      logger.info("ownership check denied userId={} todoId={}", userId, id);
      throw new TodoAccessDeniedException("not the owner of todo " + id);
    }
  }

  private CleanupResult deleteOwnerTuple(String object, String subjectId) {
    try {
      tupleStoreClient.deleteTuple(
          properties.namespace(), object, properties.relation(), subjectId);
      return CleanupResult.ok();
    } catch (TupleStoreIntegrationException ex) {
      return CleanupResult.of(
          List.of(
              new OwnershipWarning(
                  OwnershipWarning.Kind.TUPLE_CLEANUP_FAILED,
                  properties.namespace(),
                  object,
                  properties.relation(),
                  subjectId,
                  ex.getMessage())));
    }
  }

  private CleanupResult deleteAllOwnerTuples(String object) {
    final ListPage page;
    try {
      page =
          tupleStoreClient.list(
              ListQuery.builder()
                  .namespace(properties.namespace())
                  .object(object)
                  .relation(properties.relation())
                  .pageSize(properties.adminListPageSize())
                  .build());
    } catch (TupleStoreIntegrationException ex) {
      return CleanupResult.of(
          List.of(
              new OwnershipWarning(
                  OwnershipWarning.Kind.TUPLE_CLEANUP_FAILED,
                  properties.namespace(),
                  object,
                  properties.relation(),
                  null,
                  ex.getMessage())));
    }
    final List<OwnershipWarning> warnings = new ArrayList<>();
    for (RelationTuple tuple : page.tuples()) {
      try {
        tupleStoreClient.deleteTuple(tuple);
      } catch (TupleStoreIntegrationException ex) {
        warnings.add(
            new OwnershipWarning(
                OwnershipWarning.Kind.TUPLE_CLEANUP_FAILED,
                tuple.namespace(),
                tuple.object(),
                tuple.relation(),
                tuple.subject().isSet()
                    ? tuple.subject().subjectSet().toFilterValue()
                    : tuple.subject().subjectId(),
                ex.getMessage()));
      }
    }
    return CleanupResult.of(warnings);
  }

  private void report(CleanupResult result) {
    if (result.isClean()) {
      return;
    }
    for (OwnershipWarning warning : result.warnings()) {
      logger.warn(
          "ownership drift kind={} namespace={} object={} relation={} subjectId={} message={}",
          warning.kind(),
          warning.namespace(),
          warning.object(),
          warning.relation(),
          warning.subjectId(),
          warning.message());
      metrics.recordOwnershipDrift(warning.kind().tagValue());
    }
  }

  // object は行 ID の文字列表現。数値でないものは別用途のタプルとして無視する
  private Long parseObjectId(String object) {
    if (object == null) {
      return null;
    }
    try {
      return Long.valueOf(object);
    } catch (NumberFormatException ex) {
      logger.debug("skip non-numeric ownership object={}", object);
      return null;
    }
  }
}
