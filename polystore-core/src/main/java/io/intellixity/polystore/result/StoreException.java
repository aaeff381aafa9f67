package io.intellixity.polystore.result;

import java.util.Map;
import java.util.Objects;

/**
 * Failure already classified into the gateway taxonomy.\n
 *
 * Adapters throw this for conditions they detect themselves (missing key, bad dimension, unknown node).
 * Backend-native exceptions are left to propagate and are classified by the response normalizer.\n
 */
public class StoreException extends RuntimeException {
  private final ErrorCategory category;
  private final boolean retryable;
  private final Map<String, Object> details;

  public StoreException(ErrorCategory category, String message, boolean retryable, Map<String, Object> details) {
    super(message);
    this.category = Objects.requireNonNull(category, "category");
    this.retryable = retryable;
    this.details = (details == null) ? Map.of() : Map.copyOf(details);
  }

  public StoreException(ErrorCategory category, String message, boolean retryable, Map<String, Object> details,
                        Throwable cause) {
    super(message, cause);
    this.category = Objects.requireNonNull(category, "category");
    this.retryable = retryable;
    this.details = (details == null) ? Map.of() : Map.copyOf(details);
  }

  public ErrorCategory category() { return category; }
  public boolean retryable() { return retryable; }
  public Map<String, Object> details() { return details; }

  public ErrorInfo toErrorInfo() {
    return new ErrorInfo(category, getMessage(), retryable, details);
  }

  public static StoreException notFound(String message) {
    return new StoreException(ErrorCategory.NOT_FOUND, message, false, Map.of());
  }

  public static StoreException invalidInput(String message) {
    return new StoreException(ErrorCategory.INVALID_INPUT, message, false, Map.of());
  }

  public static StoreException conflict(String message) {
    return new StoreException(ErrorCategory.CONFLICT, message, false, Map.of());
  }

  public static StoreException unavailable(String message, boolean retryable) {
    return new StoreException(ErrorCategory.BACKEND_UNAVAILABLE, message, retryable, Map.of());
  }

  public static StoreException unavailable(String message, boolean retryable, Throwable cause) {
    return new StoreException(ErrorCategory.BACKEND_UNAVAILABLE, message, retryable, Map.of(), cause);
  }

  public static StoreException timeout(String message) {
    return new StoreException(ErrorCategory.TIMEOUT, message, true, Map.of());
  }
}
