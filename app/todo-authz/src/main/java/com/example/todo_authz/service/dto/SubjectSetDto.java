package com.example.todo_authz.service.dto;

public record SubjectSetDto(String namespace, String object, String relation) {}
