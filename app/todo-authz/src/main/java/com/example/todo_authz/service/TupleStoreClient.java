/*
 * どこで: todo-authz サービス層
 * 何を: タプルストア(ReBAC)の check/list/expand/create/delete を HTTP 呼び出しへ変換する
 * なぜ: デプロイごとに異なる check API の形式差を吸収し、呼び出し側へ一定の契約を返すため
 */
package com.example.todo_authz.service;

import com.example.todo_authz.config.CheckEndpoint;
import com.example.todo_authz.config.TupleStoreClientProperties;
import com.example.todo_authz.model.CheckQuery;
import com.example.todo_authz.model.ListPage;
import com.example.todo_authz.model.ListQuery;
import com.example.todo_authz.model.RelationTuple;
import com.example.todo_authz.model.SubjectRef;
import com.example.todo_authz.model.SubjectSet;
import com.example.todo_authz.model.SubjectTree;
import com.example.todo_authz.service.dto.CheckRequestBody;
import com.example.todo_authz.service.dto.CheckResponse;
import com.example.todo_authz.service.dto.RelationTupleDto;
import com.example.todo_authz.service.dto.RelationTuplesResponse;
import com.example.todo_authz.service.dto.SubjectSetDto;
import com.example.todo_authz.service.dto.SubjectTreeDto;
import com.example.todo_authz.service.dto.WriteRelationTupleRequest;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriBuilder;

/**
 * タプルストアのクライアント。
 *
 * <p>check は設定された候補エンドポイントを順に試す。2xx なら判定を返し、404 なら次の候補へ進み、
 * それ以外は即座に失敗とする。すべての候補が 404 の場合は同じ条件の完全一致 list で近似判定する。
 * この近似はサブジェクトセットの展開を行わないため、グループ経由の権限は false になる。
 *
 * <p>一時的な失敗に対するリトライは行わない。
 */
@Service
public class TupleStoreClient {

  private static final Logger logger = LoggerFactory.getLogger(TupleStoreClient.class);

  private static final String MODE_ENDPOINT = "endpoint";
  private static final String MODE_LIST_FALLBACK = "list_fallback";

  private final RestClient tupleStoreReadRestClient;
  private final RestClient tupleStoreWriteRestClient;
  private final TupleStoreClientProperties properties;
  private final OwnershipMetrics metrics;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public TupleStoreClient(
      RestClient tupleStoreReadRestClient,
      RestClient tupleStoreWriteRestClient,
      TupleStoreClientProperties properties,
      OwnershipMetrics metrics) {
    this.tupleStoreReadRestClient = tupleStoreReadRestClient;
    this.tupleStoreWriteRestClient = tupleStoreWriteRestClient;
    this.properties = properties;
    this.metrics = metrics;
  }

  public boolean check(CheckQuery query) {
    if (query == null) {
      throw new IllegalArgumentException("query is required");
    }
    final CheckRequestBody body = toCheckBody(query);
    for (CheckEndpoint endpoint : properties.checkEndpoints()) {
      final Optional<Boolean> allowed = attemptCheck(endpoint, body);
      if (allowed.isPresent()) {
        metrics.recordCheck(allowed.get(), MODE_ENDPOINT);
        return allowed.get();
      }
    }
    logger.info(
        "tuple-store check endpoints all answered 404, using exact-match list namespace={}"
            + " relation={}",
        query.namespace(),
        query.relation());
    final boolean allowed = checkByExactMatch(query);
    metrics.recordCheck(allowed, MODE_LIST_FALLBACK);
    return allowed;
  }

  public ListPage list(ListQuery query) {
    if (query == null) {
      throw new IllegalArgumentException("query is required");
    }
    try {
      final RelationTuplesResponse response =
          tupleStoreReadRestClient
              .get()
              .uri(builder -> listUri(builder, query))
              .retrieve()
              .body(RelationTuplesResponse.class);
      if (response == null) {
        throw new TupleStoreIntegrationException(
            TupleStoreIntegrationException.Reason.INVALID_RESPONSE,
            "tuple-store list response is empty");
      }
      return new ListPage(
          response.relationTuples().stream().map(this::toRelationTuple).toList(),
          response.nextPageToken());
    } catch (RestClientResponseException ex) {
      throw mapStatus("list", ex.getStatusCode(), ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException("list", ex);
    } catch (TupleStoreIntegrationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("tuple-store list response parse failed", ex);
      throw new TupleStoreIntegrationException(
          TupleStoreIntegrationException.Reason.INVALID_RESPONSE,
          "tuple-store list response parse failed",
          ex);
    }
  }

  public SubjectTree expand(String namespace, String object, String relation, Integer maxDepth) {
    requireText(namespace, "namespace");
    requireText(object, "object");
    requireText(relation, "relation");
    try {
      final SubjectTreeDto response =
          tupleStoreReadRestClient
              .get()
              .uri(
                  builder ->
                      new QueryTemplate(builder.path(properties.expandPath()))
                          .param("namespace", namespace)
                          .param("object", object)
                          .param("relation", relation)
                          .param("max_depth", maxDepth)
                          .build())
              .retrieve()
              .body(SubjectTreeDto.class);
      if (response == null) {
        throw new TupleStoreIntegrationException(
            TupleStoreIntegrationException.Reason.INVALID_RESPONSE,
            "tuple-store expand response is empty");
      }
      return toSubjectTree(response);
    } catch (RestClientResponseException ex) {
      throw mapStatus("expand", ex.getStatusCode(), ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException("expand", ex);
    } catch (TupleStoreIntegrationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("tuple-store expand response parse failed", ex);
      throw new TupleStoreIntegrationException(
          TupleStoreIntegrationException.Reason.INVALID_RESPONSE,
          "tuple-store expand response parse failed",
          ex);
    }
  }

  /** 既に存在するタプル(409)も成功として扱う。 */
  public void createTuple(String namespace, String object, String relation, String subjectId) {
    requireText(namespace, "namespace");
    requireText(object, "object");
    requireText(relation, "relation");
    requireText(subjectId, "subjectId");
    try {
      tupleStoreWriteRestClient
          .put()
          .uri(properties.writePath())
          .contentType(MediaType.APPLICATION_JSON)
          .body(new WriteRelationTupleRequest(namespace, object, relation, subjectId))
          .retrieve()
          .toBodilessEntity();
    } catch (RestClientResponseException ex) {
      if (ex.getStatusCode().value() == 409) {
        logger.debug(
            "tuple-store tuple already exists namespace={} object={} relation={}",
            namespace,
            object,
            relation);
        return;
      }
      throw mapStatus("createTuple", ex.getStatusCode(), ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException("createTuple", ex);
    } catch (RuntimeException ex) {
      logger.warn("tuple-store createTuple failed unexpectedly", ex);
      throw new TupleStoreIntegrationException(
          TupleStoreIntegrationException.Reason.INVALID_RESPONSE,
          "tuple-store createTuple failed",
          ex);
    }
  }

  public void deleteTuple(String namespace, String object, String relation, String subjectId) {
    requireText(object, "object");
    requireText(relation, "relation");
    requireText(subjectId, "subjectId");
    deleteTuple(new RelationTuple(namespace, object, relation, SubjectRef.id(subjectId)));
  }

  /** フィールド完全一致で削除する。既に存在しない場合(204)も成功。 */
  public void deleteTuple(RelationTuple tuple) {
    if (tuple == null) {
      throw new IllegalArgumentException("tuple is required");
    }
    try {
      tupleStoreWriteRestClient
          .delete()
          .uri(builder -> deleteUri(builder, tuple))
          .retrieve()
          .toBodilessEntity();
    } catch (RestClientResponseException ex) {
      throw mapStatus("deleteTuple", ex.getStatusCode(), ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException("deleteTuple", ex);
    } catch (RuntimeException ex) {
      logger.warn("tuple-store deleteTuple failed unexpectedly", ex);
      throw new TupleStoreIntegrationException(
          TupleStoreIntegrationException.Reason.INVALID_RESPONSE,
          "tuple-store deleteTuple failed",
          ex);
    }
  }

  private Optional<Boolean> attemptCheck(CheckEndpoint endpoint, CheckRequestBody body) {
    try {
      return checkRequest(endpoint, body)
          .exchange(
              (request, response) -> {
                final EndpointOutcome outcome = EndpointOutcome.classify(response.getStatusCode());
                if (outcome == EndpointOutcome.TRY_NEXT) {
                  logger.debug(
                      "tuple-store check variant not served method={} path={}",
                      endpoint.method(),
                      endpoint.path());
                  return Optional.<Boolean>empty();
                }
                if (outcome == EndpointOutcome.FATAL) {
                  throw mapStatus("check", response.getStatusCode(), null);
                }
                return Optional.of(readAllowed(response.bodyTo(CheckResponse.class)));
              });
    } catch (ResourceAccessException ex) {
      throw mapResourceException("check", ex);
    } catch (TupleStoreIntegrationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("tuple-store check response parse failed path={}", endpoint.path(), ex);
      throw new TupleStoreIntegrationException(
          TupleStoreIntegrationException.Reason.INVALID_RESPONSE,
          "tuple-store check response parse failed",
          ex);
    }
  }

  private RestClient.RequestHeadersSpec<?> checkRequest(
      CheckEndpoint endpoint, CheckRequestBody body) {
    if (HttpMethod.GET.equals(endpoint.httpMethod())) {
      return tupleStoreReadRestClient
          .get()
          .uri(
              builder -> {
                final QueryTemplate query = new QueryTemplate(builder.path(endpoint.path()));
                appendCheckParams(query, body);
                return query.build();
              });
    }
    return tupleStoreReadRestClient
        .post()
        .uri(endpoint.path())
        .contentType(MediaType.APPLICATION_JSON)
        .body(body);
  }

  private boolean readAllowed(CheckResponse response) {
    if (response == null) {
      throw new TupleStoreIntegrationException(
          TupleStoreIntegrationException.Reason.INVALID_RESPONSE,
          "tuple-store check response is empty");
    }
    return response.isAllowed();
  }

  private boolean checkByExactMatch(CheckQuery query) {
    final SubjectRef subject = query.subject();
    final ListQuery listQuery =
        ListQuery.builder()
            .namespace(query.namespace())
            .object(query.object())
            .relation(query.relation())
            .subjectId(subject.subjectId())
            .subjectSet(subject.isSet() ? subject.subjectSet().toFilterValue() : null)
            .pageSize(1)
            .build();
    try {
      return !list(listQuery).tuples().isEmpty();
    } catch (TupleStoreIntegrationException ex) {
      logger.warn("tuple-store list fallback failed after every check variant answered 404", ex);
      throw new TupleStoreIntegrationException(
          TupleStoreIntegrationException.Reason.NO_CHECK_ENDPOINT,
          "tuple-store check endpoint not found and list fallback failed",
          ex);
    }
  }

  private CheckRequestBody toCheckBody(CheckQuery query) {
    final SubjectRef subject = query.subject();
    final SubjectSetDto subjectSet =
        subject.isSet()
            ? new SubjectSetDto(
                subject.subjectSet().namespace(),
                subject.subjectSet().object(),
                subject.subjectSet().relation())
            : null;
    return new CheckRequestBody(
        query.namespace(),
        query.object(),
        query.relation(),
        subject.subjectId(),
        subjectSet,
        query.maxDepth());
  }

  private void appendCheckParams(QueryTemplate query, CheckRequestBody body) {
    query
        .param("namespace", body.namespace())
        .param("object", body.object())
        .param("relation", body.relation())
        .param("subject_id", body.subjectId());
    if (body.subjectSet() != null) {
      query
          .param("subject_set.namespace", body.subjectSet().namespace())
          .param("subject_set.object", body.subjectSet().object())
          .param("subject_set.relation", body.subjectSet().relation());
    }
    query.param("max_depth", body.maxDepth());
  }

  private URI listUri(UriBuilder builder, ListQuery query) {
    return new QueryTemplate(builder.path(properties.listPath()))
        .param("namespace", query.namespace())
        .paramIfPresent("object", query.object())
        .paramIfPresent("relation", query.relation())
        .paramIfPresent("subject_id", query.subjectId())
        .paramIfPresent("subject_set", query.subjectSet())
        .param("page_size", query.pageSize())
        .paramIfPresent("page_token", query.pageToken())
        .build();
  }

  private URI deleteUri(UriBuilder builder, RelationTuple tuple) {
    final QueryTemplate query =
        new QueryTemplate(builder.path(properties.writePath()))
            .param("namespace", tuple.namespace())
            .paramIfPresent("object", tuple.object())
            .paramIfPresent("relation", tuple.relation());
    final SubjectRef subject = tuple.subject();
    if (subject.isSet()) {
      query
          .param("subject_set.namespace", subject.subjectSet().namespace())
          .param("subject_set.object", subject.subjectSet().object())
          .param("subject_set.relation", subject.subjectSet().relation());
    } else {
      query.param("subject_id", subject.subjectId());
    }
    return query.build();
  }

  private RelationTuple toRelationTuple(RelationTupleDto dto) {
    final SubjectRef subject = toSubjectRef(dto.subjectId(), dto.subjectSet());
    if (subject == null) {
      throw new TupleStoreIntegrationException(
          TupleStoreIntegrationException.Reason.INVALID_RESPONSE,
          "tuple-store tuple has no subject");
    }
    return new RelationTuple(dto.namespace(), dto.object(), dto.relation(), subject);
  }

  private SubjectTree toSubjectTree(SubjectTreeDto dto) {
    SubjectRef subject = toSubjectRef(dto.subjectId(), dto.subjectSet());
    if (subject == null && dto.tuple() != null) {
      subject = toSubjectRef(dto.tuple().subjectId(), dto.tuple().subjectSet());
    }
    return new SubjectTree(
        dto.type(), subject, dto.children().stream().map(this::toSubjectTree).toList());
  }

  private SubjectRef toSubjectRef(String subjectId, SubjectSetDto subjectSet) {
    if (subjectId != null && !subjectId.isBlank()) {
      return SubjectRef.id(subjectId);
    }
    if (subjectSet != null) {
      return SubjectRef.set(
          new SubjectSet(subjectSet.namespace(), subjectSet.object(), subjectSet.relation()));
    }
    return null;
  }

  private TupleStoreIntegrationException mapStatus(
      String operation, HttpStatusCode status, Throwable cause) {
    logger.warn("tuple-store {} failed with http status={}", operation, status.value());
    if (status.is5xxServerError()) {
      return new TupleStoreIntegrationException(
          TupleStoreIntegrationException.Reason.BAD_GATEWAY,
          "tuple-store " + operation + " server error",
          cause);
    }
    return new TupleStoreIntegrationException(
        TupleStoreIntegrationException.Reason.BAD_GATEWAY,
        "tuple-store " + operation + " request failed",
        cause);
  }

  private TupleStoreIntegrationException mapResourceException(
      String operation, ResourceAccessException ex) {
    if (RestClientFailures.isTimeout(ex)) {
      logger.warn("tuple-store {} timed out", operation);
      return new TupleStoreIntegrationException(
          TupleStoreIntegrationException.Reason.TIMEOUT,
          "tuple-store " + operation + " timeout",
          ex);
    }
    logger.warn("tuple-store {} connection failed", operation, ex);
    return new TupleStoreIntegrationException(
        TupleStoreIntegrationException.Reason.BAD_GATEWAY,
        "tuple-store " + operation + " connection failed",
        ex);
  }

  private void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " is required");
    }
  }

  /** クエリ値はテンプレート変数として展開する。値の {@code +} や波括弧もエンコードされる。 */
  private static final class QueryTemplate {

    private final UriBuilder builder;
    private final Map<String, Object> variables = new LinkedHashMap<>();

    private QueryTemplate(UriBuilder builder) {
      this.builder = builder;
    }

    private QueryTemplate param(String name, Object value) {
      if (value == null) {
        return this;
      }
      final String variable = "q" + variables.size();
      builder.queryParam(name, "{" + variable + "}");
      variables.put(variable, value);
      return this;
    }

    private QueryTemplate paramIfPresent(String name, String value) {
      if (value == null || value.isBlank()) {
        return this;
      }
      return param(name, value);
    }

    private URI build() {
      return builder.build(variables);
    }
  }
}
