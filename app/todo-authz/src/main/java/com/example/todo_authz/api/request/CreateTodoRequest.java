package com.example.todo_authz.api.request;

import jakarta.validation.constraints.NotBlank;

public record CreateTodoRequest(@NotBlank String title) {}
