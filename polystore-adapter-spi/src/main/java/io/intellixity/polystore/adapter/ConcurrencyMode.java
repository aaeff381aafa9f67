package io.intellixity.polystore.adapter;

/** Whether the gateway may call an adapter from several threads at once. */
public enum ConcurrencyMode {
  /** Adapter and its client are thread-safe. */
  CONCURRENT,
  /** Calls are serialized by the gateway (single-writer backends). */
  SERIALIZED
}
