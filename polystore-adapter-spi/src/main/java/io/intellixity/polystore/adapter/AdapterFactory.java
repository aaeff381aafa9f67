package io.intellixity.polystore.adapter;

import io.intellixity.polystore.config.AdapterSettings;
import io.intellixity.polystore.op.OperationSchema;
import io.intellixity.polystore.op.Paradigm;

/**
 * SPI entry point for one paradigm.\n
 *
 * Implementations are listed in {@code META-INF/polystore.factories} under this interface's name and must
 * have a public no-arg constructor.\n
 */
public interface AdapterFactory {
  Paradigm paradigm();

  /** Operation kinds this paradigm accepts; the gateway validates against it before dispatch. */
  OperationSchema operations();

  /** How this paradigm's backend exceptions map onto the error taxonomy. */
  ErrorMappingTable errorMappings();

  /**
   * Creates an unconnected adapter. Settings may be checked here or at connect time; a missing
   * required setting must surface as {@link io.intellixity.polystore.config.MissingSettingException}.
   */
  StoreAdapter create(AdapterSettings settings);
}
