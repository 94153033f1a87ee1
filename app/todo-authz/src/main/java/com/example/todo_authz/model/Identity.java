package com.example.todo_authz.model;

/** identity サービスのプロフィールのうち、このサービスが参照する属性だけを保持する。 */
public record Identity(String id, String email, String role) {

  public boolean hasRole(String expected) {
    return role != null && role.equals(expected);
  }
}
