package io.intellixity.polystore.adapter;

import io.intellixity.polystore.op.Operation;
import io.intellixity.polystore.op.OperationSchema;
import io.intellixity.polystore.op.OperationValidationException;
import io.intellixity.polystore.op.Paradigm;
import io.intellixity.polystore.result.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Template-method base for store adapters.\n
 *
 * Responsibilities:\n
 * - Connection flag around {@link #doConnect()} / {@link #doDisconnect()}\n
 * - Schema validation of every operation (the gateway validates first; this is the adapter's own guard)\n
 * - Dispatch by operation kind to handlers registered with {@link #handle(String, OperationHandler)}\n
 */
public abstract class AbstractStoreAdapter implements StoreAdapter {
  private static final Logger log = LoggerFactory.getLogger(AbstractStoreAdapter.class);

  private final Paradigm paradigm;
  private final OperationSchema schema;
  private final ConcurrencyMode concurrency;
  private final Map<String, OperationHandler> handlers = new LinkedHashMap<>();
  private volatile boolean connected;

  protected AbstractStoreAdapter(OperationSchema schema, ConcurrencyMode concurrency) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.paradigm = schema.paradigm();
    this.concurrency = Objects.requireNonNull(concurrency, "concurrency");
  }

  /** Backend-specific session open. */
  protected abstract void doConnect() throws Exception;

  /** Backend-specific session release (paired with {@link #doConnect()}). */
  protected abstract void doDisconnect() throws Exception;

  /** Backend-specific liveness probe; only called while connected. */
  protected abstract void doHealthCheck() throws Exception;

  /** Registers the handler for one kind; call from the subclass constructor. */
  protected final void handle(String kind, OperationHandler handler) {
    Objects.requireNonNull(handler, "handler");
    if (!schema.supports(kind)) {
      throw new IllegalArgumentException("Kind " + kind + " is not declared for " + paradigm.id());
    }
    if (handlers.putIfAbsent(kind, handler) != null) {
      throw new IllegalArgumentException("Duplicate handler for " + paradigm.id() + "." + kind);
    }
  }

  @Override
  public final Paradigm paradigm() { return paradigm; }

  @Override
  public final ConcurrencyMode concurrency() { return concurrency; }

  public final OperationSchema schema() { return schema; }

  public final boolean isConnected() { return connected; }

  @Override
  public final synchronized void connect() throws Exception {
    if (connected) return;
    doConnect();
    connected = true;
    if (log.isDebugEnabled()) log.debug("polystore.adapter op=connect paradigm={} impl={}", paradigm.id(), getClass().getSimpleName());
  }

  @Override
  public final synchronized void disconnect() throws Exception {
    if (!connected) return;
    try {
      doDisconnect();
    } finally {
      connected = false;
      if (log.isDebugEnabled()) log.debug("polystore.adapter op=disconnect paradigm={}", paradigm.id());
    }
  }

  @Override
  public final void healthCheck() throws Exception {
    requireConnected();
    doHealthCheck();
  }

  @Override
  public final Object execute(Operation op) throws Exception {
    Objects.requireNonNull(op, "op");
    schema.validate(op);
    OperationHandler h = handlers.get(op.kind());
    if (h == null) {
      throw new OperationValidationException("No handler for " + paradigm.id() + "." + op.kind());
    }
    requireConnected();
    if (log.isTraceEnabled()) log.trace("polystore.adapter op=execute paradigm={} kind={}", paradigm.id(), op.kind());
    return h.handle(op.params());
  }

  private void requireConnected() {
    if (!connected) throw StoreException.unavailable(paradigm.id() + " adapter is not connected", true);
  }
}
