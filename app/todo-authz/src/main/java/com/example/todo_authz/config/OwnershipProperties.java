/*
 * どこで: todo-authz 設定
 * 何を: 所有タプルと管理者判定に使う namespace/relation/ページサイズを保持する
 * なぜ: タプルの命名規約をコードに埋め込まず外部化するため
 */
package com.example.todo_authz.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ownership")
public record OwnershipProperties(
    String namespace,
    String relation,
    String subjectPrefix,
    Integer listPageSize,
    Integer adminListPageSize,
    String adminNamespace,
    String adminObject,
    String adminRelation,
    String adminRole) {

  public OwnershipProperties {
    namespace = namespace == null || namespace.isBlank() ? "todos" : namespace;
    relation = relation == null || relation.isBlank() ? "owner" : relation;
    subjectPrefix = subjectPrefix == null ? "user:" : subjectPrefix;
    listPageSize = listPageSize == null || listPageSize <= 0 ? 500 : listPageSize;
    adminListPageSize =
        adminListPageSize == null || adminListPageSize <= 0 ? 1000 : adminListPageSize;
    adminNamespace = adminNamespace == null || adminNamespace.isBlank() ? "roles" : adminNamespace;
    adminObject = adminObject == null || adminObject.isBlank() ? "admin" : adminObject;
    adminRelation = adminRelation == null || adminRelation.isBlank() ? "member" : adminRelation;
    adminRole = adminRole == null || adminRole.isBlank() ? "admin" : adminRole;
  }

  public static OwnershipProperties defaults() {
    return new OwnershipProperties(null, null, null, null, null, null, null, null, null);
  }

  public String subjectIdFor(String userId) {
    return subjectPrefix + userId;
  }

  /** subject_id から規約プレフィックスを外す。プレフィックスが無ければそのまま返す。 */
  public String userIdFromSubject(String subjectId) {
    if (!subjectPrefix.isEmpty() && subjectId.startsWith(subjectPrefix)) {
      return subjectId.substring(subjectPrefix.length());
    }
    return subjectId;
  }
}
