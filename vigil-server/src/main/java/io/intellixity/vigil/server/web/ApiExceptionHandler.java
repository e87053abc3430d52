package io.intellixity.vigil.server.web;

import io.intellixity.vigil.advisor.ast.InvalidAstException;
import io.intellixity.vigil.server.scenario.ScenarioStoreException;
import io.intellixity.vigil.spi.catalog.IndexCatalogException;
import io.intellixity.vigil.spi.scenario.NotFoundException;
import io.intellixity.vigil.spi.security.ForbiddenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public final class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(InvalidAstException.class)
  public ResponseEntity<Map<String, String>> invalidAst(InvalidAstException e) {
    return error(HttpStatus.UNPROCESSABLE_ENTITY, e);
  }

  @ExceptionHandler(ForbiddenException.class)
  public ResponseEntity<Map<String, String>> forbidden(ForbiddenException e) {
    return error(HttpStatus.FORBIDDEN, e);
  }

  @ExceptionHandler(NotFoundException.class)
  public ResponseEntity<Map<String, String>> notFound(NotFoundException e) {
    return error(HttpStatus.NOT_FOUND, e);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
    return error(HttpStatus.BAD_REQUEST, e);
  }

  /** Tenant or main database unreachable. */
  @ExceptionHandler({IndexCatalogException.class, ScenarioStoreException.class})
  public ResponseEntity<Map<String, String>> unavailable(RuntimeException e) {
    log.error("Storage failure while serving request", e);
    return error(HttpStatus.SERVICE_UNAVAILABLE, e);
  }

  private static ResponseEntity<Map<String, String>> error(HttpStatus status, RuntimeException e) {
    String msg = e.getMessage() == null ? status.getReasonPhrase() : e.getMessage();
    return ResponseEntity.status(status).body(Map.of("error", status.getReasonPhrase(), "message", msg));
  }
}
