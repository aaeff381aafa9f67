package io.intellixity.polystore.examples.web;

import io.intellixity.polystore.result.ErrorCategory;
import io.intellixity.polystore.result.ErrorInfo;
import io.intellixity.polystore.result.ResultEnvelope;
import io.intellixity.polystore.result.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Renders request-level failures (unreadable bodies, bad paradigm names) as failed envelopes so HTTP
 * callers see one response shape.
 */
@RestControllerAdvice
public final class GatewayExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(GatewayExceptionHandler.class);

  @ExceptionHandler(StoreException.class)
  public ResponseEntity<ResultEnvelope> onStoreException(StoreException e) {
    return ErrorStatus.respond(ResultEnvelope.failure(null, null, e.toErrorInfo(), 0));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ResultEnvelope> onUnreadable(HttpMessageNotReadableException e) {
    StoreException cause = storeCause(e);
    ErrorInfo info = (cause != null)
        ? cause.toErrorInfo()
        : ErrorInfo.of(ErrorCategory.INVALID_INPUT, "Request body is not a valid operation");
    if (log.isDebugEnabled()) log.debug("polystore.http rejected category={}", info.category());
    return ErrorStatus.respond(ResultEnvelope.failure(null, null, info, 0));
  }

  private static StoreException storeCause(Throwable t) {
    for (Throwable c = t; c != null; c = (c.getCause() == c) ? null : c.getCause()) {
      if (c instanceof StoreException se) return se;
    }
    return null;
  }
}
