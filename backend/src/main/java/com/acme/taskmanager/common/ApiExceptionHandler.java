package com.acme.taskmanager.common;

import com.acme.taskmanager.ratelimit.RateLimitExceededException;
import com.acme.taskmanager.task.TaskValidationException;
import jakarta.persistence.EntityNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.TransactionException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> validation(MethodArgumentNotValidException ex) {
        List<ApiError.FieldViolation> fields = ex.getBindingResult().getFieldErrors().stream()
                .map(err -> new ApiError.FieldViolation(err.getField(), err.getDefaultMessage()))
                .toList();
        String message = fields.stream().findFirst().map(ApiError.FieldViolation::message)
                .orElseGet(() -> ex.getBindingResult().getAllErrors().stream().findFirst().map(err -> err.getDefaultMessage()).orElse("Validation failed"));
        return ResponseEntity.badRequest().body(new ApiError(ApiError.VALIDATION_ERROR, message, fields));
    }

    @ExceptionHandler(TaskValidationException.class)
    ResponseEntity<ApiError> taskValidation(TaskValidationException ex) {
        return ResponseEntity.badRequest().body(new ApiError(ApiError.VALIDATION_ERROR, ex.getMessage(), ex.getViolations()));
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    ResponseEntity<ApiError> methodValidation(HandlerMethodValidationException ex) {
        String message = ex.getAllErrors().stream().findFirst().map(err -> err.getDefaultMessage()).orElse("Validation failed");
        return ResponseEntity.badRequest().body(new ApiError(ApiError.VALIDATION_ERROR, message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> unreadable(HttpMessageNotReadableException ex) {
        return ResponseEntity.badRequest().body(new ApiError(ApiError.VALIDATION_ERROR, "Malformed JSON request body"));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    ResponseEntity<ApiError> typeMismatch(MethodArgumentTypeMismatchException ex) {
        String message = "Invalid value for " + ex.getName() + ": " + ex.getValue();
        return ResponseEntity.badRequest().body(new ApiError(ApiError.VALIDATION_ERROR, message,
                List.of(new ApiError.FieldViolation(ex.getName(), message))));
    }

    @ExceptionHandler(EntityNotFoundException.class)
    ResponseEntity<ApiError> notFound(EntityNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ApiError(ApiError.NOT_FOUND, ex.getMessage()));
    }

    @ExceptionHandler(RateLimitExceededException.class)
    ResponseEntity<ApiError> rateLimited(RateLimitExceededException ex) {
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()))
                .body(new ApiError(ApiError.RATE_LIMITED, ex.getMessage()));
    }

    @ExceptionHandler({DataAccessException.class, TransactionException.class})
    ResponseEntity<ApiError> storeFailure(RuntimeException ex) {
        log.error("Durable store operation failed", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiError(ApiError.STORE_FAILURE, "The task store could not complete the request"));
    }

    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> unexpected(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            HttpStatusCode status = errorResponse.getStatusCode();
            String code = status.value() == 404 ? ApiError.NOT_FOUND : HttpStatus.valueOf(status.value()).name();
            return ResponseEntity.status(status).body(new ApiError(code, errorResponse.getBody().getDetail()));
        }
        log.error("Unhandled request failure", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiError(ApiError.INTERNAL_ERROR, "Internal server error"));
    }
}
