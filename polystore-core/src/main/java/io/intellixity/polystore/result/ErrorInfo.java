package io.intellixity.polystore.result;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Sanitized error description carried by a failed {@link ResultEnvelope}.
 *
 * @param details structured facts safe to expose (e.g. {@code rowIndex}); never raw backend text
 */
public record ErrorInfo(ErrorCategory category,
                        String message,
                        boolean retryable,
                        @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, Object> details) {
  public ErrorInfo {
    Objects.requireNonNull(category, "category");
    message = (message == null || message.isBlank()) ? category.wireName() : message;
    details = (details == null || details.isEmpty())
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(details));
  }

  public static ErrorInfo of(ErrorCategory category, String message) {
    return new ErrorInfo(category, message, category.retryableByDefault(), Map.of());
  }

  public static ErrorInfo of(ErrorCategory category, String message, boolean retryable) {
    return new ErrorInfo(category, message, retryable, Map.of());
  }
}
