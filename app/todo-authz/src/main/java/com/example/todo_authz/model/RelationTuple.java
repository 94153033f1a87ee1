package com.example.todo_authz.model;

public record RelationTuple(String namespace, String object, String relation, SubjectRef subject) {

  public RelationTuple {
    if (namespace == null || namespace.isBlank()) {
      throw new IllegalArgumentException("namespace is required");
    }
    if (subject == null) {
      throw new IllegalArgumentException("subject is required");
    }
  }
}
