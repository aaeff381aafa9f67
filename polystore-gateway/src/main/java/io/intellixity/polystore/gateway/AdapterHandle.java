package io.intellixity.polystore.gateway;

import io.intellixity.polystore.adapter.AdapterFactory;
import io.intellixity.polystore.adapter.ConcurrencyMode;
import io.intellixity.polystore.adapter.StoreAdapter;
import io.intellixity.polystore.config.AdapterSettings;
import io.intellixity.polystore.lifecycle.AdapterState;
import io.intellixity.polystore.lifecycle.HealthRecord;
import io.intellixity.polystore.op.Operation;
import io.intellixity.polystore.op.Paradigm;
import io.intellixity.polystore.result.ErrorInfo;
import io.intellixity.polystore.result.StoreException;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns one adapter for one paradigm and the state of its backend session.\n
 *
 * State changes are made by {@link LifecycleSupervisor} only, under this handle's monitor.
 * The adapter is created lazily on the first connect attempt so that missing settings only
 * affect the paradigm that is actually invoked.\n
 */
public final class AdapterHandle {
  private final Paradigm paradigm;
  private final AdapterFactory factory;
  private final AdapterSettings settings;
  private final ReentrantLock serial = new ReentrantLock(true);
  private final Set<Thread> inFlight = ConcurrentHashMap.newKeySet();

  private StoreAdapter adapter;
  private AdapterState state = AdapterState.DISCONNECTED;
  private boolean connected;
  private ErrorInfo lastError;
  private Instant lastCheckedAt;
  private int failedAttempts;
  private long nextAttemptAtMillis;
  private CompletableFuture<AdapterHandle> pending;

  AdapterHandle(Paradigm paradigm, AdapterFactory factory, AdapterSettings settings) {
    this.paradigm = Objects.requireNonNull(paradigm, "paradigm");
    this.factory = Objects.requireNonNull(factory, "factory");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  public Paradigm paradigm() { return paradigm; }

  public synchronized AdapterState state() { return state; }

  public synchronized ErrorInfo lastError() { return lastError; }

  public synchronized HealthRecord health() {
    return new HealthRecord(paradigm, state, lastCheckedAt, lastError);
  }

  AdapterFactory factory() { return factory; }

  /** Creates the adapter on first use; a missing setting surfaces here. */
  synchronized StoreAdapter adapter() {
    if (adapter == null) adapter = Objects.requireNonNull(factory.create(settings), "factory.create returned null");
    return adapter;
  }

  synchronized boolean isConnected() { return connected; }

  synchronized int failedAttempts() { return failedAttempts; }

  synchronized long nextAttemptAtMillis() { return nextAttemptAtMillis; }

  synchronized CompletableFuture<AdapterHandle> pending() { return pending; }

  synchronized CompletableFuture<AdapterHandle> beginConnect() {
    pending = new CompletableFuture<>();
    state = AdapterState.CONNECTING;
    return pending;
  }

  /** False when the handle was closed while the connect was running; the caller then releases the session. */
  synchronized boolean markReady(Instant now) {
    if (state == AdapterState.CLOSED) return false;
    state = AdapterState.READY;
    connected = true;
    lastError = null;
    lastCheckedAt = now;
    failedAttempts = 0;
    nextAttemptAtMillis = 0;
    pending = null;
    return true;
  }

  /** Records a failed attempt (connect, health check or routed call) and enters DEGRADED. */
  synchronized void markFailed(ErrorInfo error, Instant now, int attempts, long nextAttemptAtMillis) {
    if (state == AdapterState.CLOSED) return;
    this.state = AdapterState.DEGRADED;
    this.lastError = error;
    this.lastCheckedAt = now;
    this.failedAttempts = attempts;
    this.nextAttemptAtMillis = nextAttemptAtMillis;
    this.pending = null;
  }

  synchronized void markChecked(Instant now) {
    lastCheckedAt = now;
  }

  synchronized void markDisconnected() {
    connected = false;
  }

  synchronized void markClosed() {
    state = AdapterState.CLOSED;
    connected = false;
    pending = null;
  }

  synchronized void resetAttempts() {
    failedAttempts = 0;
    nextAttemptAtMillis = 0;
  }

  /**
   * Runs one operation on the adapter. {@code SERIALIZED} adapters are entered through a fair lock; the
   * wait counts against {@code deadlineNanos}.
   */
  Object invoke(Operation op, long deadlineNanos) throws Exception {
    StoreAdapter a;
    synchronized (this) {
      if (state != AdapterState.READY) {
        throw StoreException.unavailable(paradigm.id() + " adapter is " + state.name().toLowerCase(Locale.ROOT), true);
      }
      a = adapter;
    }
    Thread self = Thread.currentThread();
    inFlight.add(self);
    try {
      if (a.concurrency() != ConcurrencyMode.SERIALIZED) return a.execute(op);
      long wait = Math.max(0, deadlineNanos - System.nanoTime());
      if (!serial.tryLock(wait, TimeUnit.NANOSECONDS)) {
        throw StoreException.timeout(paradigm.id() + " adapter is busy");
      }
      try {
        return a.execute(op);
      } finally {
        serial.unlock();
      }
    } finally {
      inFlight.remove(self);
    }
  }

  int inFlightCount() { return inFlight.size(); }

  void interruptInFlight() {
    for (Thread t : inFlight) t.interrupt();
  }
}
