package io.intellixity.polystore.gateway;

import io.intellixity.polystore.gateway.internal.DaemonThreads;
import io.intellixity.polystore.gateway.metrics.InMemoryOperationMetrics;
import io.intellixity.polystore.gateway.metrics.OperationMetrics;
import io.intellixity.polystore.op.Operation;
import io.intellixity.polystore.op.Paradigm;
import io.intellixity.polystore.result.ErrorCategory;
import io.intellixity.polystore.result.ResultEnvelope;
import io.intellixity.polystore.result.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.*;

/**
 * Single entry point: validates an {@link Operation}, obtains the paradigm's READY handle from the
 * {@link LifecycleSupervisor} and runs the adapter call on a worker pool under a timeout.\n
 *
 * Every outcome, including validation failures, timeouts and adapter exceptions, comes back as a
 * {@link ResultEnvelope}; nothing escapes unshaped.\n
 */
public final class GatewayRouter implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(GatewayRouter.class);

  private final LifecycleSupervisor supervisor;
  private final ResponseNormalizer normalizer;
  private final RouterSettings settings;
  private final OperationMetrics metrics;
  private final ExecutorService workers;
  private final ScheduledExecutorService timer =
      Executors.newSingleThreadScheduledExecutor(DaemonThreads.named("polystore-router-timer"));

  public GatewayRouter(LifecycleSupervisor supervisor, RouterSettings settings) {
    this(supervisor, settings, new InMemoryOperationMetrics());
  }

  public GatewayRouter(LifecycleSupervisor supervisor, RouterSettings settings, OperationMetrics metrics) {
    this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
    this.normalizer = supervisor.normalizer();
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.workers = Executors.newFixedThreadPool(settings.workerThreads(), DaemonThreads.named("polystore-router"));
  }

  public OperationMetrics metrics() { return metrics; }

  public LifecycleSupervisor supervisor() { return supervisor; }

  /** Blocking form of {@link #routeAsync(Operation)}. */
  public ResultEnvelope route(Operation op) {
    return routeAsync(op).join();
  }

  /**
   * The returned future always completes normally with an envelope, within the operation timeout.
   * Cancelling it stops the wait and interrupts the adapter call best-effort.
   */
  public CompletableFuture<ResultEnvelope> routeAsync(Operation op) {
    Objects.requireNonNull(op, "op");
    long start = System.nanoTime();
    Paradigm paradigm = op.paradigm();
    CompletableFuture<ResultEnvelope> result = new CompletableFuture<>();

    if (!supervisor.isRegistered(paradigm)) {
      fail(result, op, start, StoreException.unavailable("No adapter registered for paradigm " + paradigm.id(), false));
      return result;
    }
    try {
      supervisor.operations(paradigm).validate(op);
    } catch (StoreException e) {
      fail(result, op, start, e);
      return result;
    }

    long timeoutNanos = settings.operationTimeout().toNanos();
    long deadline = start + timeoutNanos;
    Future<?> task;
    try {
      task = workers.submit(() -> execute(op, start, deadline, result));
    } catch (RejectedExecutionException e) {
      fail(result, op, start, StoreException.unavailable("Gateway is shutting down", true));
      return result;
    }

    ScheduledFuture<?> timeout;
    try {
      timeout = timer.schedule(() -> {
        ResultEnvelope env = normalizer.failure(paradigm, op.kind(), StoreException.timeout(
            paradigm.id() + "." + op.kind() + " exceeded " + settings.operationTimeout().toMillis() + "ms"), elapsedMs(start));
        if (complete(result, op, env)) task.cancel(true);
      }, Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
    } catch (RejectedExecutionException e) {
      task.cancel(true);
      fail(result, op, start, StoreException.unavailable("Gateway is shutting down", true));
      return result;
    }

    result.whenComplete((env, err) -> {
      timeout.cancel(false);
      if (result.isCancelled()) task.cancel(true);
    });
    return result;
  }

  private void execute(Operation op, long start, long deadline, CompletableFuture<ResultEnvelope> result) {
    Paradigm paradigm = op.paradigm();
    AdapterHandle handle;
    try {
      handle = supervisor.ensureReady(paradigm);
    } catch (Exception e) {
      fail(result, op, start, e);
      return;
    }
    if (result.isDone()) return;
    try {
      Object data = handle.invoke(op, deadline);
      complete(result, op, normalizer.success(paradigm, op.kind(), data, elapsedMs(start)));
    } catch (Exception e) {
      if (result.isDone()) return;
      ResultEnvelope env = normalizer.failure(paradigm, op.kind(), e, elapsedMs(start));
      if (env.category() == ErrorCategory.BACKEND_UNAVAILABLE) supervisor.markDegraded(paradigm, env.error());
      complete(result, op, env);
    }
  }

  private void fail(CompletableFuture<ResultEnvelope> result, Operation op, long start, Throwable error) {
    complete(result, op, normalizer.failure(op.paradigm(), op.kind(), error, elapsedMs(start)));
  }

  /** Completes at most once; the winner records the sample and the log line. */
  private boolean complete(CompletableFuture<ResultEnvelope> result, Operation op, ResultEnvelope env) {
    if (!result.complete(env)) return false;
    metrics.record(op.paradigm(), op.kind(), env.latencyMs(), env.ok());
    if (log.isDebugEnabled()) {
      log.debug("polystore.route paradigm={} kind={} ok={} latencyMs={} category={}",
          op.paradigm().id(), op.kind(), env.ok(), env.latencyMs(),
          env.ok() ? null : env.error().category().wireName());
    }
    return true;
  }

  private static long elapsedMs(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000L;
  }

  /** Stops the worker pool; the supervisor is closed separately. */
  @Override
  public void close() {
    workers.shutdownNow();
    timer.shutdownNow();
  }
}
