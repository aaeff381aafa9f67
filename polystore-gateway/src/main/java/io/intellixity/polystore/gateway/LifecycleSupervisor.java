package io.intellixity.polystore.gateway;

import io.intellixity.polystore.adapter.AdapterFactories;
import io.intellixity.polystore.adapter.AdapterFactory;
import io.intellixity.polystore.adapter.StoreAdapter;
import io.intellixity.polystore.config.AdapterSettings;
import io.intellixity.polystore.gateway.internal.DaemonThreads;
import io.intellixity.polystore.gateway.internal.RetryBackoff;
import io.intellixity.polystore.lifecycle.AdapterState;
import io.intellixity.polystore.lifecycle.HealthRecord;
import io.intellixity.polystore.op.OperationSchema;
import io.intellixity.polystore.op.Paradigm;
import io.intellixity.polystore.result.ErrorCategory;
import io.intellixity.polystore.result.ErrorInfo;
import io.intellixity.polystore.result.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.function.LongSupplier;

/**
 * Owns every {@link AdapterHandle} and is the only component that changes their state.\n
 *
 * - Lazy, memoized connect per paradigm; concurrent callers share one attempt run on a supervisor thread\n
 * - One immediate retry of a retryable connect failure, then exponential backoff with fail-fast\n
 * - After {@code maxConnectAttempts} failures (or one non-retryable failure) a paradigm stays
 *   degraded until {@link #reconnect(Paradigm)}\n
 * - Failures of one paradigm never affect another\n
 */
public final class LifecycleSupervisor implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(LifecycleSupervisor.class);

  private final SupervisorSettings settings;
  private final Function<Paradigm, AdapterSettings> settingsSource;
  private final ResponseNormalizer normalizer;
  private final LongSupplier nowMillis;
  private final RetryBackoff backoff;
  private final Map<Paradigm, AdapterHandle> handles = new ConcurrentHashMap<>();
  private final ExecutorService connector = Executors.newCachedThreadPool(DaemonThreads.named("polystore-connect"));
  private final ScheduledExecutorService scheduler =
      Executors.newSingleThreadScheduledExecutor(DaemonThreads.named("polystore-health"));
  private final AtomicBoolean closed = new AtomicBoolean();
  private volatile ScheduledFuture<?> healthTask;

  public LifecycleSupervisor(SupervisorSettings settings, Function<Paradigm, AdapterSettings> settingsSource) {
    this(settings, settingsSource, new ResponseNormalizer(), System::currentTimeMillis);
  }

  public LifecycleSupervisor(SupervisorSettings settings,
                             Function<Paradigm, AdapterSettings> settingsSource,
                             ResponseNormalizer normalizer,
                             LongSupplier nowMillis) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.settingsSource = Objects.requireNonNull(settingsSource, "settingsSource");
    this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    this.nowMillis = Objects.requireNonNull(nowMillis, "nowMillis");
    this.backoff = new RetryBackoff(settings.initialBackoff(), settings.maxBackoff());
  }

  public ResponseNormalizer normalizer() { return normalizer; }

  public SupervisorSettings settings() { return settings; }

  public void registerAdapter(Paradigm paradigm, AdapterFactory factory) {
    Objects.requireNonNull(paradigm, "paradigm");
    Objects.requireNonNull(factory, "factory");
    if (factory.paradigm() != paradigm) {
      throw new IllegalArgumentException(factory.getClass().getName() + " serves " + factory.paradigm().id()
          + ", not " + paradigm.id());
    }
    if (closed.get()) throw new IllegalStateException("supervisor is shut down");
    AdapterSettings s = settingsSource.apply(paradigm);
    if (s == null) s = AdapterSettings.empty(paradigm);
    AdapterHandle h = new AdapterHandle(paradigm, factory, s);
    if (handles.putIfAbsent(paradigm, h) != null) {
      throw new IllegalStateException("Adapter already registered for " + paradigm.id());
    }
    normalizer.register(paradigm, factory.errorMappings());
    if (log.isDebugEnabled()) {
      log.debug("polystore.supervisor op=register paradigm={} factory={}", paradigm.id(), factory.getClass().getName());
    }
  }

  /**
   * Registers every factory listed in {@code META-INF/polystore.factories}; returns the paradigms added.
   *
   * @throws IllegalStateException for a broken listing or a paradigm that is already registered
   */
  public List<Paradigm> registerDiscovered() {
    List<Paradigm> added = new ArrayList<>();
    for (Map.Entry<Paradigm, AdapterFactory> e : AdapterFactories.discover().entrySet()) {
      registerAdapter(e.getKey(), e.getValue());
      added.add(e.getKey());
    }
    return added;
  }

  public boolean isRegistered(Paradigm paradigm) {
    return paradigm != null && handles.containsKey(paradigm);
  }

  public Set<Paradigm> paradigms() {
    EnumSet<Paradigm> out = EnumSet.noneOf(Paradigm.class);
    out.addAll(handles.keySet());
    return Collections.unmodifiableSet(out);
  }

  public OperationSchema operations(Paradigm paradigm) {
    return require(paradigm).factory().operations();
  }

  public Optional<AdapterHandle> handle(Paradigm paradigm) {
    return Optional.ofNullable(handles.get(paradigm));
  }

  /**
   * Returns the READY handle for {@code paradigm}, connecting first when needed.
   *
   * @throws StoreException {@code BackendUnavailable} when the paradigm cannot be served now
   */
  public AdapterHandle ensureReady(Paradigm paradigm) {
    AdapterHandle h = require(paradigm);
    CompletableFuture<AdapterHandle> attempt;
    boolean owner = false;
    synchronized (h) {
      if (closed.get() || h.state() == AdapterState.CLOSED) {
        throw StoreException.unavailable("Gateway is shutting down", true);
      }
      AdapterState state = h.state();
      if (state == AdapterState.READY) return h;
      if (state == AdapterState.CONNECTING) {
        attempt = h.pending();
      } else {
        failFastIfBackingOff(h);
        attempt = h.beginConnect();
        owner = true;
      }
    }
    if (owner) startConnect(h, attempt);
    return await(h, attempt);
  }

  /** Resets the attempt counter and backoff, then connects. */
  public AdapterHandle reconnect(Paradigm paradigm) {
    AdapterHandle h = require(paradigm);
    h.resetAttempts();
    log.info("polystore.supervisor op=reconnect paradigm={}", paradigm.id());
    return ensureReady(paradigm);
  }

  /** Router feedback: a READY handle whose backend stopped answering becomes DEGRADED. */
  public void markDegraded(Paradigm paradigm, ErrorInfo error) {
    AdapterHandle h = handles.get(paradigm);
    if (h == null) return;
    int attempts;
    synchronized (h) {
      if (h.state() != AdapterState.READY) return;
      attempts = h.failedAttempts() + 1;
      long now = nowMillis.getAsLong();
      h.markFailed(error, Instant.ofEpochMilli(now), attempts, now + backoff.delayMillis(attempts));
    }
    log.warn("polystore.supervisor op=degrade paradigm={} category={} retryInMs={}",
        paradigm.id(), (error == null) ? null : error.category().wireName(), backoff.delayMillis(attempts));
  }

  /** Probes a READY adapter; other states are reported as they are, without connecting. */
  public HealthRecord healthCheck(Paradigm paradigm) {
    AdapterHandle h = require(paradigm);
    StoreAdapter a;
    synchronized (h) {
      if (h.state() != AdapterState.READY) return h.health();
      a = h.adapter();
    }
    try {
      callWithTimeout(a::healthCheck, "health check");
      h.markChecked(Instant.ofEpochMilli(nowMillis.getAsLong()));
    } catch (Exception e) {
      markDegraded(paradigm, normalizer.classify(paradigm, e));
    }
    return h.health();
  }

  public List<HealthRecord> healthAll() {
    List<HealthRecord> out = new ArrayList<>();
    for (Paradigm p : Paradigm.values()) {
      if (handles.containsKey(p)) out.add(healthCheck(p));
    }
    return out;
  }

  /** Health records without probing. */
  public List<HealthRecord> snapshot() {
    List<HealthRecord> out = new ArrayList<>();
    for (Paradigm p : Paradigm.values()) {
      AdapterHandle h = handles.get(p);
      if (h != null) out.add(h.health());
    }
    return out;
  }

  public synchronized void startHealthChecks(Duration interval) {
    Objects.requireNonNull(interval, "interval");
    if (interval.isNegative() || interval.isZero()) throw new IllegalArgumentException("interval must be > 0");
    if (closed.get()) throw new IllegalStateException("supervisor is shut down");
    if (healthTask != null) healthTask.cancel(false);
    long ms = interval.toMillis();
    healthTask = scheduler.scheduleWithFixedDelay(() -> {
      try {
        healthAll();
      } catch (RuntimeException e) {
        log.warn("polystore.supervisor op=health_sweep failed", e);
      }
    }, ms, ms, TimeUnit.MILLISECONDS);
  }

  /** Eagerly connects every registered paradigm; a failure only degrades that paradigm. */
  public List<HealthRecord> startAll() {
    for (Paradigm p : Paradigm.values()) {
      if (!handles.containsKey(p)) continue;
      try {
        ensureReady(p);
      } catch (StoreException e) {
        log.warn("polystore.supervisor op=start paradigm={} state=DEGRADED message={}", p.id(), e.getMessage());
      }
    }
    return snapshot();
  }

  /**
   * Refuses new calls, waits up to {@code shutdownGrace} for in-flight calls, interrupts the rest, then
   * disconnects each connected adapter once and marks every handle CLOSED. Idempotent.
   */
  public void shutdownAll() {
    if (!closed.compareAndSet(false, true)) return;
    ScheduledFuture<?> ht = healthTask;
    if (ht != null) ht.cancel(false);

    long deadline = System.nanoTime() + settings.shutdownGrace().toNanos();
    awaitIdle(handles.values(), deadline);
    for (AdapterHandle h : handles.values()) {
      if (h.inFlightCount() > 0) {
        log.warn("polystore.supervisor op=shutdown paradigm={} interrupting={}", h.paradigm().id(), h.inFlightCount());
        h.interruptInFlight();
      }
    }

    for (AdapterHandle h : handles.values()) {
      StoreAdapter a = null;
      synchronized (h) {
        if (h.isConnected()) a = h.adapter();
        h.markClosed();
      }
      if (a != null) disconnectQuietly(h, a);
    }
    scheduler.shutdownNow();
    connector.shutdownNow();
    log.info("polystore.supervisor op=shutdown paradigms={}", handles.size());
  }

  @Override
  public void close() {
    shutdownAll();
  }

  /** An interrupted caller only stops waiting; the attempt itself belongs to the connector pool. */
  private void startConnect(AdapterHandle h, CompletableFuture<AdapterHandle> attempt) {
    try {
      connector.execute(() -> connect(h, attempt));
    } catch (RejectedExecutionException e) {
      attempt.completeExceptionally(StoreException.unavailable("Gateway is shutting down", true));
    }
  }

  private void connect(AdapterHandle h, CompletableFuture<AdapterHandle> attempt) {
    Paradigm p = h.paradigm();
    long start = System.nanoTime();
    try {
      StoreAdapter a = h.adapter();
      if (h.isConnected()) {
        long drainDeadline = System.nanoTime() + settings.connectTimeout().toNanos();
        if (!awaitIdle(List.of(h), drainDeadline)) {
          log.warn("polystore.supervisor op=reconnect paradigm={} inFlight={} drain timed out",
              p.id(), h.inFlightCount());
        }
        disconnectQuietly(h, a);
      }
      try {
        callWithTimeout(a::connect, "connect");
      } catch (Exception first) {
        ErrorInfo info = normalizer.classify(p, first);
        if (!info.retryable() || closed.get()) throw first;
        log.warn("polystore.supervisor op=connect paradigm={} retry=1 category={}", p.id(), info.category().wireName());
        callWithTimeout(a::connect, "connect");
      }
      if (!h.markReady(Instant.ofEpochMilli(nowMillis.getAsLong()))) {
        disconnectQuietly(h, a);
        attempt.completeExceptionally(StoreException.unavailable("Gateway is shutting down", true));
        return;
      }
      log.info("polystore.supervisor op=connect paradigm={} state=READY durationMs={}",
          p.id(), (System.nanoTime() - start) / 1_000_000L);
      attempt.complete(h);
    } catch (Exception e) {
      attempt.completeExceptionally(recordConnectFailure(h, e));
    }
  }

  private StoreException recordConnectFailure(AdapterHandle h, Exception e) {
    Paradigm p = h.paradigm();
    ErrorInfo cause = normalizer.classify(p, e);
    // a non-retryable cause (bad settings, rejected credentials) will not heal by itself
    int attempts = cause.retryable() ? h.failedAttempts() + 1 : settings.maxConnectAttempts();
    boolean exhausted = attempts >= settings.maxConnectAttempts();
    long now = nowMillis.getAsLong();
    long delay = backoff.delayMillis(attempts);
    String message = p.id() + " adapter unavailable: " + cause.message()
        + (exhausted && cause.retryable() ? "; reconnect required" : "");
    StoreException failure = new StoreException(ErrorCategory.BACKEND_UNAVAILABLE, message, cause.retryable(),
        Map.of("attempts", attempts, "reconnectRequired", exhausted), e);
    h.markFailed(failure.toErrorInfo(), Instant.ofEpochMilli(now), attempts, now + delay);
    log.warn("polystore.supervisor op=connect paradigm={} state=DEGRADED attempts={} exhausted={} retryInMs={} category={}",
        p.id(), attempts, exhausted, exhausted ? -1 : delay, cause.category().wireName());
    return failure;
  }

  private void failFastIfBackingOff(AdapterHandle h) {
    int attempts = h.failedAttempts();
    if (attempts == 0) return;
    ErrorInfo last = h.lastError();
    String why = (last == null) ? "" : " (" + last.message() + ")";
    if (attempts >= settings.maxConnectAttempts()) {
      boolean retryable = last == null || last.retryable();
      throw new StoreException(ErrorCategory.BACKEND_UNAVAILABLE, h.paradigm().id() + " adapter is degraded after "
          + attempts + " failed attempts; reconnect required" + why, retryable,
          Map.of("attempts", attempts, "reconnectRequired", true));
    }
    long wait = h.nextAttemptAtMillis() - nowMillis.getAsLong();
    if (wait > 0) {
      throw StoreException.unavailable(h.paradigm().id() + " adapter is degraded; next attempt in " + wait + "ms" + why, true);
    }
  }

  private AdapterHandle await(AdapterHandle h, CompletableFuture<AdapterHandle> attempt) {
    // drain, disconnect, connect and its single retry are each bounded by the connect timeout
    long bound = settings.connectTimeout().toMillis() * 4 + 1_000L;
    try {
      return attempt.get(bound, TimeUnit.MILLISECONDS);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof StoreException se) throw se;
      throw StoreException.unavailable(h.paradigm().id() + " adapter unavailable", true, e.getCause());
    } catch (TimeoutException e) {
      throw StoreException.timeout(h.paradigm().id() + " connect still in progress");
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw StoreException.unavailable(h.paradigm().id() + " connect wait interrupted", true);
    }
  }

  private void callWithTimeout(Task task, String what) throws Exception {
    long ms = settings.connectTimeout().toMillis();
    Future<?> f;
    try {
      f = connector.submit(() -> {
        task.run();
        return null;
      });
    } catch (RejectedExecutionException e) {
      // connector already stopped by shutdown
      task.run();
      return;
    }
    try {
      f.get(ms, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      f.cancel(true);
      throw StoreException.timeout(what + " timed out after " + ms + "ms");
    } catch (ExecutionException e) {
      if (e.getCause() instanceof Exception ex) throw ex;
      throw e;
    } catch (InterruptedException e) {
      f.cancel(true);
      Thread.currentThread().interrupt();
      throw StoreException.unavailable(what + " interrupted", true);
    }
  }

  private void disconnectQuietly(AdapterHandle h, StoreAdapter a) {
    try {
      callWithTimeout(a::disconnect, "disconnect");
    } catch (Exception e) {
      log.warn("polystore.supervisor op=disconnect paradigm={} failed", h.paradigm().id(), e);
    } finally {
      h.markDisconnected();
    }
  }

  /** @return true when every handle drained before the deadline */
  private static boolean awaitIdle(Collection<AdapterHandle> hs, long deadlineNanos) {
    for (AdapterHandle h : hs) {
      while (h.inFlightCount() > 0) {
        if (System.nanoTime() >= deadlineNanos) return false;
        try {
          Thread.sleep(10);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return false;
        }
      }
    }
    return true;
  }

  private AdapterHandle require(Paradigm paradigm) {
    AdapterHandle h = (paradigm == null) ? null : handles.get(paradigm);
    if (h == null) {
      throw StoreException.unavailable("No adapter registered for paradigm " + (paradigm == null ? null : paradigm.id()), false);
    }
    return h;
  }

  @FunctionalInterface
  private interface Task {
    void run() throws Exception;
  }
}
