package io.intellixity.polystore.adapter;

import io.intellixity.polystore.op.Operation;
import io.intellixity.polystore.op.Paradigm;

/**
 * Capability interface every storage adapter implements.\n
 *
 * Adapters may throw {@link io.intellixity.polystore.result.StoreException} for conditions they classify
 * themselves; any other exception (vendor driver, SQL, IO) is classified by the gateway's response
 * normalizer using the factory's {@link ErrorMappingTable}.\n
 *
 * Adapters are driven by a lifecycle supervisor: {@code connect} and {@code disconnect} are never called
 * concurrently with each other for the same instance.\n
 */
public interface StoreAdapter {
  Paradigm paradigm();

  ConcurrencyMode concurrency();

  /** Opens the backend session. Idempotent while connected. */
  void connect() throws Exception;

  /** Releases the backend session. Idempotent. */
  void disconnect() throws Exception;

  /** Cheap liveness probe against the backend; throws when the backend is unreachable. */
  void healthCheck() throws Exception;

  /**
   * Executes one operation.
   *
   * @return the paradigm-specific result value; {@code null} means acknowledged
   */
  Object execute(Operation op) throws Exception;
}
