/*
 * どこで: 認可モデル
 * 何を: タプルのサブジェクトを直接 ID かサブジェクトセットのどちらか一方で表現する
 * なぜ: check/list/expand で同じ判定を使い回すため
 */
package com.example.todo_authz.model;

public record SubjectRef(String subjectId, SubjectSet subjectSet) {

  public SubjectRef {
    final boolean hasId = subjectId != null && !subjectId.isBlank();
    if (hasId == (subjectSet != null)) {
      throw new IllegalArgumentException("exactly one of subjectId or subjectSet is required");
    }
  }

  public static SubjectRef id(String subjectId) {
    return new SubjectRef(subjectId, null);
  }

  public static SubjectRef set(SubjectSet subjectSet) {
    return new SubjectRef(null, subjectSet);
  }

  public boolean isSet() {
    return subjectSet != null;
  }
}
