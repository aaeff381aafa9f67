package io.intellixity.polystore.op;

import io.intellixity.polystore.result.ErrorCategory;
import io.intellixity.polystore.result.StoreException;

import java.util.Map;

/**
 * Raised when an Operation names an unknown kind, misses a required parameter, or carries a value of the wrong shape.
 * <p>
 * Thrown by the gateway before dispatch (and by adapters as a safety net). Always {@link ErrorCategory#INVALID_INPUT}.
 */
public final class OperationValidationException extends StoreException {
  public OperationValidationException(String message) {
    super(ErrorCategory.INVALID_INPUT, message, false, Map.of());
  }

  public OperationValidationException(String message, Map<String, Object> details) {
    super(ErrorCategory.INVALID_INPUT, message, false, details);
  }

  public OperationValidationException(String message, Throwable cause) {
    super(ErrorCategory.INVALID_INPUT, message, false, Map.of(), cause);
  }
}
