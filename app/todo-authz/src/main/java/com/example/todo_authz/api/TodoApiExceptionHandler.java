/*
 * どこで: todo-authz API
 * 何を: サービス層の例外を HTTP ステータスと共通エラー形式へ変換する
 * なぜ: 認可拒否と未存在を区別しつつ、下流のエラー文言を呼び出し側へ漏らさないため
 */
package com.example.todo_authz.api;

import com.example.todo_authz.service.IdentityIntegrationException;
import com.example.todo_authz.service.OwnershipDriftException;
import com.example.todo_authz.service.OwnershipMetrics;
import com.example.todo_authz.service.RecordStoreIntegrationException;
import com.example.todo_authz.service.TodoAccessDeniedException;
import com.example.todo_authz.service.TodoNotFoundException;
import com.example.todo_authz.service.TupleStoreIntegrationException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
@RequiredArgsConstructor
public class TodoApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(TodoApiExceptionHandler.class);
  private static final String INTERNAL_ERROR_MESSAGE = "Internal server error";

  private final OwnershipMetrics ownershipMetrics;

  @ExceptionHandler(TodoAccessDeniedException.class)
  public ResponseEntity<ApiErrorResponse> handleAccessDenied(TodoAccessDeniedException ex) {
    return ResponseEntity.status(HttpStatus.FORBIDDEN)
        .body(new ApiErrorResponse("FORBIDDEN", "Forbidden"));
  }

  @ExceptionHandler(TodoNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotFound(TodoNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("TODO_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    return badRequest("request validation failed");
  }

  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<ApiErrorResponse> handleUnreadable(Exception ex) {
    return badRequest("malformed request");
  }

  // TodoPatch などモデルの入力検証
  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(TupleStoreIntegrationException.class)
  public ResponseEntity<ApiErrorResponse> handleTupleStore(TupleStoreIntegrationException ex) {
    ownershipMetrics.recordIntegrationError("tuple_store", ex.reason().name());
    logger.error("tuple-store integration failed reason={}", ex.reason(), ex);
    return internalError();
  }

  @ExceptionHandler(IdentityIntegrationException.class)
  public ResponseEntity<ApiErrorResponse> handleIdentity(IdentityIntegrationException ex) {
    ownershipMetrics.recordIntegrationError("identity", ex.reason().name());
    logger.error("identity integration failed reason={}", ex.reason(), ex);
    return internalError();
  }

  @ExceptionHandler(RecordStoreIntegrationException.class)
  public ResponseEntity<ApiErrorResponse> handleRecordStore(RecordStoreIntegrationException ex) {
    ownershipMetrics.recordIntegrationError("record_store", ex.reason().name());
    logger.error("record-store integration failed reason={}", ex.reason(), ex);
    return internalError();
  }

  @ExceptionHandler(OwnershipDriftException.class)
  public ResponseEntity<ApiErrorResponse> handleOwnershipDrift(OwnershipDriftException ex) {
    logger.error("todo created without ownership tuple todoId={}", ex.createdTodo().id(), ex);
    return internalError();
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unexpected error", ex);
    return internalError();
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("BAD_REQUEST", message));
  }

  private ResponseEntity<ApiErrorResponse> internalError() {
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("INTERNAL_ERROR", INTERNAL_ERROR_MESSAGE));
  }
}
