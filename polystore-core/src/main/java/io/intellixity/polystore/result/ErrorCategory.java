package io.intellixity.polystore.result;

import com.fasterxml.jackson.annotation.JsonValue;

/** Closed error taxonomy. Everything crossing the gateway boundary is one of these. */
public enum ErrorCategory {
  NOT_FOUND("NotFound", false),
  INVALID_INPUT("InvalidInput", false),
  BACKEND_UNAVAILABLE("BackendUnavailable", true),
  TIMEOUT("Timeout", true),
  CONFLICT("Conflict", false),
  INTERNAL("Internal", false);

  private final String wireName;
  private final boolean retryableByDefault;

  ErrorCategory(String wireName, boolean retryableByDefault) {
    this.wireName = wireName;
    this.retryableByDefault = retryableByDefault;
  }

  @JsonValue
  public String wireName() { return wireName; }

  public boolean retryableByDefault() { return retryableByDefault; }

  /** Caller or data errors; the gateway never retries these on its own. */
  public boolean isCallerError() {
    return this == NOT_FOUND || this == INVALID_INPUT || this == CONFLICT;
  }
}
