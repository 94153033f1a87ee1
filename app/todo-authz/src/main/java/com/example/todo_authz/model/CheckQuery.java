package com.example.todo_authz.model;

/**
 * 権限チェック条件。
 *
 * <p>maxDepth はサブジェクトセット展開の深さ上限で、null ならタプルストア側の既定値を使う。
 */
public record CheckQuery(
    String namespace, String object, String relation, SubjectRef subject, Integer maxDepth) {

  public CheckQuery {
    if (namespace == null || namespace.isBlank()) {
      throw new IllegalArgumentException("namespace is required");
    }
    if (object == null || object.isBlank()) {
      throw new IllegalArgumentException("object is required");
    }
    if (relation == null || relation.isBlank()) {
      throw new IllegalArgumentException("relation is required");
    }
    if (subject == null) {
      throw new IllegalArgumentException("subject is required");
    }
    if (maxDepth != null && maxDepth < 0) {
      throw new IllegalArgumentException("maxDepth must not be negative");
    }
  }

  public static CheckQuery of(String namespace, String object, String relation, String subjectId) {
    return new CheckQuery(namespace, object, relation, SubjectRef.id(subjectId), null);
  }
}
