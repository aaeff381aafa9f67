package io.intellixity.polystore.examples.web;

import io.intellixity.polystore.result.ErrorCategory;
import io.intellixity.polystore.result.ResultEnvelope;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/** Maps error categories onto HTTP status codes. */
final class ErrorStatus {
  private ErrorStatus() {}

  static HttpStatus of(ErrorCategory category) {
    if (category == null) return HttpStatus.OK;
    switch (category) {
      case INVALID_INPUT: return HttpStatus.BAD_REQUEST;
      case NOT_FOUND: return HttpStatus.NOT_FOUND;
      case CONFLICT: return HttpStatus.CONFLICT;
      case TIMEOUT: return HttpStatus.GATEWAY_TIMEOUT;
      case BACKEND_UNAVAILABLE: return HttpStatus.SERVICE_UNAVAILABLE;
      default: return HttpStatus.INTERNAL_SERVER_ERROR;
    }
  }

  static ResponseEntity<ResultEnvelope> respond(ResultEnvelope r) {
    return ResponseEntity.status(r.ok() ? HttpStatus.OK : of(r.category())).body(r);
  }
}
