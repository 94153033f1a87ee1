package com.example.todo_authz.service;

import java.util.Locale;

/**
 * 行の変更は成功したが、所有タプルの書き込みや後始末が失敗したことを表す警告。
 *
 * <p>subjectId は対象タプルを特定できなかった場合 null。
 */
public record OwnershipWarning(
    Kind kind, String namespace, String object, String relation, String subjectId, String message) {

  public enum Kind {
    TUPLE_WRITE_FAILED,
    TUPLE_CLEANUP_FAILED;

    /** メトリクスのタグ値。 */
    public String tagValue() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  public OwnershipWarning {
    if (kind == null) {
      throw new IllegalArgumentException("kind is required");
    }
  }
}
