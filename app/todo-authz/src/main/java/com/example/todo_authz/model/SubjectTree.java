package com.example.todo_authz.model;

import java.util.List;

/**
 * expand の結果ツリー。
 *
 * <p>type はタプルストアのノード種別(union, leaf など)をそのまま保持する。subject は未解決ノードで null。
 */
public record SubjectTree(String type, SubjectRef subject, List<SubjectTree> children) {

  public SubjectTree {
    children = children == null ? List.of() : List.copyOf(children);
  }
}
