package io.intellixity.polystore.gateway;

import java.time.Duration;
import java.util.Objects;

/**
 * @param operationTimeout upper bound for one routed operation, including a lazy connect and lock wait
 * @param workerThreads    size of the router's worker pool
 */
public record RouterSettings(Duration operationTimeout, int workerThreads) {
  public static final Duration DEFAULT_OPERATION_TIMEOUT = Duration.ofSeconds(10);

  public RouterSettings {
    Objects.requireNonNull(operationTimeout, "operationTimeout");
    if (operationTimeout.isNegative() || operationTimeout.isZero()) {
      throw new IllegalArgumentException("operationTimeout must be > 0");
    }
    if (workerThreads < 1) throw new IllegalArgumentException("workerThreads must be >= 1");
  }

  public static RouterSettings defaults() {
    return new RouterSettings(DEFAULT_OPERATION_TIMEOUT, Math.max(4, Runtime.getRuntime().availableProcessors()));
  }

  public RouterSettings withOperationTimeout(Duration timeout) {
    return new RouterSettings(timeout, workerThreads);
  }
}
