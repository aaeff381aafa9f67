package io.intellixity.polystore.config;

import io.intellixity.polystore.result.ErrorCategory;
import io.intellixity.polystore.result.StoreException;

import java.util.Map;

/** A required adapter setting is absent or malformed. Not retryable: the configuration has to change first. */
public final class MissingSettingException extends StoreException {
  public MissingSettingException(String message) {
    super(ErrorCategory.BACKEND_UNAVAILABLE, message, false, Map.of());
  }
}
