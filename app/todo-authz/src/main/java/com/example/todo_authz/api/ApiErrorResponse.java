package com.example.todo_authz.api;

public record ApiErrorResponse(String code, String message) {}
