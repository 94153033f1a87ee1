package com.example.todo_authz.service.dto;

public record VerifiableAddressDto(String value, String via) {}
