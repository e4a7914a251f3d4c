package com.ospicorp.meterseries.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.net.URI;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps failures of the meter API to RFC 7807 problem details.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  private static final String PROBLEM_BASE = "https://meter-series.example.com/problems/";

  enum ProblemType {
    INVALID_PARAMETER(HttpStatus.BAD_REQUEST, "invalid-parameter"),
    METER_NOT_FOUND(HttpStatus.NOT_FOUND, "meter-not-found"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "internal-error");

    private final HttpStatus status;
    private final String slug;

    ProblemType(HttpStatus status, String slug) {
      this.status = status;
      this.slug = slug;
    }

    URI uri() {
      return URI.create(PROBLEM_BASE + slug);
    }
  }

  @ExceptionHandler({ConstraintViolationException.class, MethodArgumentNotValidException.class,
      MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class,
      HandlerMethodValidationException.class, IllegalArgumentException.class})
  public ResponseEntity<ProblemDetail> handleInvalidParameter(Exception ex,
      HttpServletRequest request) {
    return problem(ProblemType.INVALID_PARAMETER, ex, request);
  }

  @ExceptionHandler(NoSuchElementException.class)
  public ResponseEntity<ProblemDetail> handleUnknownMeter(NoSuchElementException ex,
      HttpServletRequest request) {
    return problem(ProblemType.METER_NOT_FOUND, ex, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleUnexpected(Exception ex, HttpServletRequest request) {
    return problem(ProblemType.INTERNAL_ERROR, ex, request);
  }

  private ResponseEntity<ProblemDetail> problem(ProblemType type, Exception ex,
      HttpServletRequest request) {
    String message = ex.getMessage() == null || ex.getMessage().isBlank()
        ? ex.getClass().getName() : ex.getMessage();
    String uri = RequestLoggingFilter.uriWithQuery(request);
    if (type.status.is5xxServerError()) {
      log.error("{} {} failed with {}: {}", request.getMethod(), uri, type.status.value(),
          message, ex);
    } else {
      log.warn("{} {} rejected with {}: {}", request.getMethod(), uri, type.status.value(),
          message);
    }

    ProblemDetail body = ProblemDetail.forStatusAndDetail(type.status, message);
    body.setType(type.uri());
    body.setTitle(type.status.getReasonPhrase());
    body.setInstance(URI.create(request.getRequestURI()));
    body.setProperty("path", request.getRequestURI());
    return ResponseEntity.status(type.status).body(body);
  }
}
