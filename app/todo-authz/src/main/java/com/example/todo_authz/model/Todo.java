package com.example.todo_authz.model;

public record Todo(long id, String title, boolean completed, String createdAt) {}
