package com.example.todo_authz.api;

import com.example.todo_authz.api.response.AdminTodoResponse;
import com.example.todo_authz.api.response.SubjectTreeResponse;
import com.example.todo_authz.service.AdminTodoService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin/todos")
@RequiredArgsConstructor
public class AdminTodoController {

  private final AdminTodoService adminTodoService;

  @GetMapping
  public ResponseEntity<List<AdminTodoResponse>> listAllTodos(Authentication authentication) {
    return ResponseEntity.ok(
        adminTodoService.listAllWithOwners(authentication.getName()).stream()
            .map(AdminTodoResponse::from)
            .toList());
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<String> deleteTodo(
      @PathVariable("id") long id, Authentication authentication) {
    adminTodoService.deleteTodo(authentication.getName(), id);
    return ResponseEntity.ok("deleted");
  }

  @GetMapping("/{id}/owners")
  public ResponseEntity<SubjectTreeResponse> expandOwners(
      @PathVariable("id") long id, Authentication authentication) {
    return ResponseEntity.ok(
        SubjectTreeResponse.from(adminTodoService.expandOwners(authentication.getName(), id)));
  }
}
