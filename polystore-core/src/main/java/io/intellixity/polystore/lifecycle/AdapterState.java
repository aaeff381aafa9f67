package io.intellixity.polystore.lifecycle;

/** Connection lifecycle of an adapter handle. Only the lifecycle supervisor moves a handle between states. */
public enum AdapterState {
  DISCONNECTED,
  CONNECTING,
  READY,
  DEGRADED,
  CLOSED
}
