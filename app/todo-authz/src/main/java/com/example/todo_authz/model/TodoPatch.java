package com.example.todo_authz.model;

/** todo 行の部分更新。null の項目は変更しない。 */
public record TodoPatch(String title, Boolean completed) {

  public TodoPatch {
    if (title == null && completed == null) {
      throw new IllegalArgumentException("at least one field is required");
    }
    if (title != null && title.isBlank()) {
      throw new IllegalArgumentException("title must not be blank");
    }
  }
}
