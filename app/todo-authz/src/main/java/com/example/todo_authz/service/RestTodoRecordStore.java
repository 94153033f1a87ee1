/*
 * どこで: todo-authz サービス層
 * 何を: REST 形式の行 API(PostgREST 互換)で todo 行を読み書きする
 * なぜ: 行ストアを所有タプルから独立した外部コラボレータとして扱うため
 */
package com.example.todo_authz.service;

import com.example.todo_authz.config.RecordStoreClientProperties;
import com.example.todo_authz.model.Todo;
import com.example.todo_authz.model.TodoPatch;
import com.example.todo_authz.service.dto.TodoRow;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Collection;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class RestTodoRecordStore implements TodoRecordStore {

  private static final Logger logger = LoggerFactory.getLogger(RestTodoRecordStore.class);

  private static final String SELECT_COLUMNS = "id,title,completed,created_at";
  private static final String ORDER_NEWEST_FIRST = "created_at.desc";
  private static final String PREFER_HEADER = "Prefer";
  private static final String RETURN_REPRESENTATION = "return=representation";
  private static final ParameterizedTypeReference<List<TodoRow>> ROWS =
      new ParameterizedTypeReference<>() {};

  private final RestClient recordStoreRestClient;
  private final RecordStoreClientProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public RestTodoRecordStore(
      RestClient recordStoreRestClient, RecordStoreClientProperties properties) {
    this.recordStoreRestClient = recordStoreRestClient;
    this.properties = properties;
  }

  @Override
  public List<Todo> findByIds(Collection<Long> ids) {
    if (ids == null || ids.isEmpty()) {
      return List.of();
    }
    final String idFilter =
        ids.stream().map(String::valueOf).collect(Collectors.joining(",", "in.(", ")"));
    return call(
        "findByIds",
        () ->
            toTodos(
                recordStoreRestClient
                    .get()
                    .uri(
                        builder ->
                            builder
                                .path(properties.tablePath())
                                .queryParam("select", SELECT_COLUMNS)
                                .queryParam("id", idFilter)
                                .queryParam("order", ORDER_NEWEST_FIRST)
                                .build())
                    .retrieve()
                    .body(ROWS)));
  }

  @Override
  public List<Todo> findAll() {
    return call(
        "findAll",
        () ->
            toTodos(
                recordStoreRestClient
                    .get()
                    .uri(
                        builder ->
                            builder
                                .path(properties.tablePath())
                                .queryParam("select", SELECT_COLUMNS)
                                .queryParam("order", ORDER_NEWEST_FIRST)
                                .build())
                    .retrieve()
                    .body(ROWS)));
  }

  @Override
  public Todo create(String title) {
    if (title == null || title.isBlank()) {
      throw new IllegalArgumentException("title is required");
    }
    final List<Todo> created =
        call(
            "create",
            () ->
                toTodos(
                    recordStoreRestClient
                        .post()
                        .uri(properties.tablePath())
                        .header(PREFER_HEADER, RETURN_REPRESENTATION)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body(new TodoRow(null, title, null, null))
                        .retrieve()
                        .body(ROWS)));
    if (created.isEmpty()) {
      logger.warn("record-store create returned no representation");
      throw new RecordStoreIntegrationException(
          RecordStoreIntegrationException.Reason.INVALID_RESPONSE,
          "record-store create returned no row");
    }
    return created.get(0);
  }

  @Override
  public Todo update(long id, TodoPatch patch) {
    if (patch == null) {
      throw new IllegalArgumentException("patch is required");
    }
    final List<Todo> updated =
        call(
            "update",
            () ->
                toTodos(
                    recordStoreRestClient
                        .patch()
                        .uri(
                            builder ->
                                builder
                                    .path(properties.tablePath())
                                    .queryParam("id", "eq." + id)
                                    .build())
                        .header(PREFER_HEADER, RETURN_REPRESENTATION)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body(new TodoRow(null, patch.title(), patch.completed(), null))
                        .retrieve()
                        .body(ROWS)));
    if (updated.isEmpty()) {
      throw new TodoNotFoundException(id);
    }
    return updated.get(0);
  }

  @Override
  public void delete(long id) {
    final ResponseEntity<List<TodoRow>> response =
        call(
            "delete",
            () ->
                recordStoreRestClient
                    .delete()
                    .uri(
                        builder ->
                            builder
                                .path(properties.tablePath())
                                .queryParam("id", "eq." + id)
                                .build())
                    .header(PREFER_HEADER, RETURN_REPRESENTATION)
                    .retrieve()
                    .toEntity(ROWS));
    // 204 で本文が無い場合は削除済みとみなす。空配列は対象行なし
    if (response.getBody() != null && response.getBody().isEmpty()) {
      throw new TodoNotFoundException(id);
    }
  }

  private <T> T call(String operation, Supplier<T> request) {
    try {
      return request.get();
    } catch (RestClientResponseException ex) {
      logger.warn(
          "record-store {} failed with http status={} statusText={}",
          operation,
          ex.getStatusCode().value(),
          ex.getStatusText());
      if (ex.getStatusCode().is5xxServerError()) {
        throw new RecordStoreIntegrationException(
            RecordStoreIntegrationException.Reason.BAD_GATEWAY, "record-store server error", ex);
      }
      throw new RecordStoreIntegrationException(
          RecordStoreIntegrationException.Reason.BAD_GATEWAY, "record-store request failed", ex);
    } catch (ResourceAccessException ex) {
      if (RestClientFailures.isTimeout(ex)) {
        logger.warn("record-store {} timed out", operation);
        throw new RecordStoreIntegrationException(
            RecordStoreIntegrationException.Reason.TIMEOUT, "record-store request timeout", ex);
      }
      logger.warn("record-store {} connection failed", operation, ex);
      throw new RecordStoreIntegrationException(
          RecordStoreIntegrationException.Reason.BAD_GATEWAY, "record-store connection failed", ex);
    } catch (RecordStoreIntegrationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("record-store {} response parse failed", operation, ex);
      throw new RecordStoreIntegrationException(
          RecordStoreIntegrationException.Reason.INVALID_RESPONSE,
          "record-store response parse failed",
          ex);
    }
  }

  private List<Todo> toTodos(List<TodoRow> rows) {
    if (rows == null) {
      throw new RecordStoreIntegrationException(
          RecordStoreIntegrationException.Reason.INVALID_RESPONSE,
          "record-store response is empty");
    }
    return rows.stream().map(this::toTodo).toList();
  }

  private Todo toTodo(TodoRow row) {
    if (row == null || row.id() == null) {
      throw new RecordStoreIntegrationException(
          RecordStoreIntegrationException.Reason.INVALID_RESPONSE, "record-store row has no id");
    }
    return new Todo(
        row.id(),
        row.title() == null ? "" : row.title(),
        Boolean.TRUE.equals(row.completed()),
        row.createdAt());
  }
}
