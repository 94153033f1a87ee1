/*
 * どこで: todo-authz API
 * 何を: 利用者自身の todo に対する一覧・作成・更新・削除を公開する
 * なぜ: すべての変更を所有タプルの check に通す入口を一本化するため
 */
package com.example.todo_authz.api;

import com.example.todo_authz.api.request.CreateTodoRequest;
import com.example.todo_authz.api.request.UpdateTodoRequest;
import com.example.todo_authz.api.response.TodoResponse;
import com.example.todo_authz.service.OwnershipOrchestrator;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/todos")
@RequiredArgsConstructor
public class TodoController {

  private final OwnershipOrchestrator ownershipOrchestrator;

  @GetMapping
  public ResponseEntity<List<TodoResponse>> listTodos(Authentication authentication) {
    return ResponseEntity.ok(
        ownershipOrchestrator.list(authentication.getName()).stream()
            .map(TodoResponse::from)
            .toList());
  }

  @PostMapping
  public ResponseEntity<TodoResponse> createTodo(
      @Valid @RequestBody CreateTodoRequest request, Authentication authentication) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(
            TodoResponse.from(
                ownershipOrchestrator.create(authentication.getName(), request.title())));
  }

  @PatchMapping("/{id}")
  public ResponseEntity<TodoResponse> updateTodo(
      @PathVariable("id") long id,
      @RequestBody UpdateTodoRequest request,
      Authentication authentication) {
    return ResponseEntity.ok(
        TodoResponse.from(
            ownershipOrchestrator.update(authentication.getName(), id, request.toPatch())));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<String> deleteTodo(
      @PathVariable("id") long id, Authentication authentication) {
    ownershipOrchestrator.delete(authentication.getName(), id);
    return ResponseEntity.ok("deleted");
  }
}
