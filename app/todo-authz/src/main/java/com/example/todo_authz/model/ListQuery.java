package com.example.todo_authz.model;

import lombok.Builder;

/** relation-tuples 一覧の検索条件。namespace 以外は任意フィルタ。 */
@Builder
public record ListQuery(
    String namespace,
    String object,
    String relation,
    String subjectId,
    String subjectSet,
    Integer pageSize,
    String pageToken) {

  public ListQuery {
    if (namespace == null || namespace.isBlank()) {
      throw new IllegalArgumentException("namespace is required");
    }
    if (pageSize != null && pageSize <= 0) {
      throw new IllegalArgumentException("pageSize must be positive");
    }
  }
}
