package com.ospicorp.weatherapi.config;

import com.ospicorp.weatherapi.error.ErrorKind;
import com.ospicorp.weatherapi.error.WeatherLookupException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.net.URI;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  private static final String PROBLEM_TYPE_BASE = "https://docs.weather-api.dev/problems/";

  private static final Map<ErrorKind, HttpStatus> STATUS_BY_KIND = new EnumMap<>(ErrorKind.class);

  static {
    STATUS_BY_KIND.put(ErrorKind.NOT_FOUND, HttpStatus.NOT_FOUND);
    STATUS_BY_KIND.put(ErrorKind.UPSTREAM_UNAVAILABLE, HttpStatus.BAD_GATEWAY);
    STATUS_BY_KIND.put(ErrorKind.READ_ERROR, HttpStatus.BAD_GATEWAY);
    STATUS_BY_KIND.put(ErrorKind.MALFORMED_RESPONSE, HttpStatus.BAD_GATEWAY);
    STATUS_BY_KIND.put(ErrorKind.TIME_PARSE_ERROR, HttpStatus.BAD_GATEWAY);
    STATUS_BY_KIND.put(ErrorKind.STORE_READ_ERROR, HttpStatus.SERVICE_UNAVAILABLE);
    STATUS_BY_KIND.put(ErrorKind.STORE_WRITE_ERROR, HttpStatus.SERVICE_UNAVAILABLE);
    STATUS_BY_KIND.put(ErrorKind.DEADLINE_EXCEEDED, HttpStatus.GATEWAY_TIMEOUT);
    STATUS_BY_KIND.put(ErrorKind.QUERY_REJECTED, HttpStatus.SERVICE_UNAVAILABLE);
  }

  @ExceptionHandler(WeatherLookupException.class)
  public ResponseEntity<ProblemDetail> handleLookupFailure(WeatherLookupException ex,
      HttpServletRequest request) {
    HttpStatus status = statusFor(ex.kind());
    ResponseEntity<ProblemDetail> response = buildProblem(status, ex.kind().slug(), ex, request);
    ProblemDetail body = response.getBody();
    if (body != null) {
      body.setProperty("errorKind", ex.kind().name());
    }
    return response;
  }

  @ExceptionHandler({ConstraintViolationException.class, HandlerMethodValidationException.class,
      MissingServletRequestParameterException.class, IllegalArgumentException.class})
  public ResponseEntity<ProblemDetail> handleBadRequest(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.BAD_REQUEST, "invalid-parameter", ex, request);
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ResponseEntity<ProblemDetail> handleNoResource(NoResourceFoundException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.NOT_FOUND, "not-found", ex, request);
  }

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<ProblemDetail> handleResponseStatus(ResponseStatusException ex,
      HttpServletRequest request) {
    HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
    if (status == null) {
      status = HttpStatus.INTERNAL_SERVER_ERROR;
    }
    return buildProblem(status, status.is5xxServerError() ? "internal-error" : "request-error", ex, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleServerError(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.INTERNAL_SERVER_ERROR, "internal-error", ex, request);
  }

  static HttpStatus statusFor(ErrorKind kind) {
    return STATUS_BY_KIND.getOrDefault(kind, HttpStatus.INTERNAL_SERVER_ERROR);
  }

  private ResponseEntity<ProblemDetail> buildProblem(HttpStatus status, String typeSlug, Exception ex,
      HttpServletRequest request) {
    logException(status, ex, request);
    ProblemDetail detail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
    detail.setTitle(status.getReasonPhrase());
    detail.setInstance(URI.create(request.getRequestURI()));
    detail.setType(URI.create(PROBLEM_TYPE_BASE + typeSlug));
    detail.setProperty("path", request.getRequestURI());
    return ResponseEntity.status(status).body(detail);
  }

  private void logException(HttpStatus status, Exception ex, HttpServletRequest request) {
    String errorMessage = ex.getMessage();
    if (errorMessage == null || errorMessage.isBlank()) {
      errorMessage = ex.getClass().getName();
    }

    if (status.is5xxServerError()) {
      log.error("Request {} {} from {} failed with status {}: {}",
          request.getMethod(),
          RequestLogging.uriWithQuery(request),
          RequestLogging.clientIp(request),
          status.value(),
          errorMessage,
          ex);
    } else {
      log.warn("Request {} {} from {} returned status {}: {}",
          request.getMethod(),
          RequestLogging.uriWithQuery(request),
          RequestLogging.clientIp(request),
          status.value(),
          errorMessage);
    }
  }
}
