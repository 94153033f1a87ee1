package com.example.todo_authz.model;

/** namespace:object#relation 形式の間接サブジェクト(グループ所属など)。 */
public record SubjectSet(String namespace, String object, String relation) {

  public SubjectSet {
    if (namespace == null || namespace.isBlank()) {
      throw new IllegalArgumentException("subject set namespace is required");
    }
    if (object == null || object.isBlank()) {
      throw new IllegalArgumentException("subject set object is required");
    }
    relation = relation == null ? "" : relation;
  }

  /** list API の subject_set フィルタ表記。relation が空なら "ns:obj" になる。 */
  public String toFilterValue() {
    if (relation.isEmpty()) {
      return namespace + ":" + object;
    }
    return namespace + ":" + object + "#" + relation;
  }
}
