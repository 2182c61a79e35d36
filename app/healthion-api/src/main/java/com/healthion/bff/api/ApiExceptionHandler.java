package com.healthion.bff.api;

import com.healthion.bff.service.HealthionMetrics;
import com.healthion.bff.service.IdentityConflictException;
import com.healthion.bff.service.UpstreamIntegrationException;
import com.healthion.bff.service.UpstreamNotLinkedException;
import com.healthion.bff.service.UserPersistenceException;
import jakarta.validation.ConstraintViolationException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
@RequiredArgsConstructor
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  private final HealthionMetrics metrics;

  @ExceptionHandler({
    IllegalArgumentException.class,
    MethodArgumentNotValidException.class,
    HandlerMethodValidationException.class,
    ConstraintViolationException.class,
    MissingServletRequestParameterException.class,
    MethodArgumentTypeMismatchException.class,
    HttpMessageNotReadableException.class
  })
  public ResponseEntity<ApiErrorResponse> handleBadRequest(Exception ex) {
    return ResponseEntity.badRequest().body(new ApiErrorResponse("BAD_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler(UpstreamNotLinkedException.class)
  public ResponseEntity<ApiErrorResponse> handleNotLinked(UpstreamNotLinkedException ex) {
    return ResponseEntity.badRequest()
        .body(new ApiErrorResponse("UPSTREAM_NOT_LINKED", ex.getMessage()));
  }

  @ExceptionHandler(IdentityConflictException.class)
  public ResponseEntity<ApiErrorResponse> handleIdentityConflict(IdentityConflictException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse("IDENTITY_CONFLICT", ex.getMessage()));
  }

  @ExceptionHandler(UpstreamIntegrationException.class)
  public ResponseEntity<ApiErrorResponse> handleUpstreamIntegration(
      UpstreamIntegrationException ex) {
    final String code = ex.code();
    final HttpStatus status =
        switch (ex.reason()) {
          case NOT_CONFIGURED -> HttpStatus.SERVICE_UNAVAILABLE;
          case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
          case NOT_FOUND -> HttpStatus.NOT_FOUND;
          case UNAUTHORIZED, BAD_REQUEST, BAD_GATEWAY, INVALID_RESPONSE -> HttpStatus.BAD_GATEWAY;
        };
    metrics.recordUpstreamError(code);
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, ex.getMessage()));
  }

  @ExceptionHandler(UserPersistenceException.class)
  public ResponseEntity<ApiErrorResponse> handlePersistence(UserPersistenceException ex) {
    logger.error("user persistence failed operation={}", ex.operation(), ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ApiErrorResponse("PERSISTENCE_FAILURE", ex.getMessage()));
  }
}
