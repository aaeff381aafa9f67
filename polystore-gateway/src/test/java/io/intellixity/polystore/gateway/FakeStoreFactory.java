package io.intellixity.polystore.gateway;

import io.intellixity.polystore.adapter.AbstractStoreAdapter;
import io.intellixity.polystore.adapter.AdapterFactory;
import io.intellixity.polystore.adapter.ConcurrencyMode;
import io.intellixity.polystore.adapter.ErrorMappingTable;
import io.intellixity.polystore.adapter.StoreAdapter;
import io.intellixity.polystore.config.AdapterSettings;
import io.intellixity.polystore.op.OperationSchema;
import io.intellixity.polystore.op.ParamType;
import io.intellixity.polystore.op.Paradigm;
import io.intellixity.polystore.op.Params;
import io.intellixity.polystore.result.ErrorCategory;
import io.intellixity.polystore.result.StoreException;

import java.net.ConnectException;
import java.util.ConcurrentModificationException;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static io.intellixity.polystore.op.ParamSpec.optional;
import static io.intellixity.polystore.op.ParamSpec.required;

/**
 * Scriptable adapter factory for gateway tests. Public with a no-arg constructor so that it can also be
 * discovered through {@code META-INF/polystore.factories}.
 */
public final class FakeStoreFactory implements AdapterFactory {
  static final ErrorMappingTable ERRORS = ErrorMappingTable.builder()
      .on(ConnectException.class, ErrorCategory.BACKEND_UNAVAILABLE, true)
      .on(ConcurrentModificationException.class, ErrorCategory.CONFLICT, false)
      .build();

  final Paradigm paradigm;
  final OperationSchema schema;
  final ConcurrencyMode concurrency;
  final AtomicInteger creates = new AtomicInteger();
  final AtomicInteger connectCalls = new AtomicInteger();
  final AtomicInteger disconnects = new AtomicInteger();
  final AtomicInteger disconnectsWhileRunning = new AtomicInteger();
  final AtomicInteger executions = new AtomicInteger();
  final AtomicInteger interrupts = new AtomicInteger();
  final AtomicInteger running = new AtomicInteger();
  final AtomicInteger maxRunning = new AtomicInteger();

  volatile String requiredSetting;
  volatile long connectDelayMs;
  volatile int connectFailuresLeft;
  volatile boolean healthy = true;

  public FakeStoreFactory() {
    this(Paradigm.GRAPH, ConcurrencyMode.CONCURRENT);
  }

  FakeStoreFactory(Paradigm paradigm) {
    this(paradigm, ConcurrencyMode.CONCURRENT);
  }

  FakeStoreFactory(Paradigm paradigm, ConcurrencyMode concurrency) {
    this.paradigm = paradigm;
    this.concurrency = concurrency;
    this.schema = OperationSchema.builder(paradigm)
        .kind("echo", optional("value", ParamType.STRING))
        .kind("sleep", required("millis", ParamType.INTEGER))
        .kind("fail", required("error", ParamType.STRING))
        .build();
  }

  @Override
  public Paradigm paradigm() { return paradigm; }

  @Override
  public OperationSchema operations() { return schema; }

  @Override
  public ErrorMappingTable errorMappings() { return ERRORS; }

  @Override
  public StoreAdapter create(AdapterSettings settings) {
    if (requiredSetting != null) settings.require(requiredSetting);
    creates.incrementAndGet();
    return new FakeAdapter();
  }

  private final class FakeAdapter extends AbstractStoreAdapter {
    FakeAdapter() {
      super(schema, concurrency);
      handle("echo", p -> p.has("value") ? Map.of("value", p.string("value")) : null);
      handle("sleep", this::sleep);
      handle("fail", this::fail);
    }

    @Override
    protected void doConnect() throws Exception {
      connectCalls.incrementAndGet();
      if (connectDelayMs > 0) Thread.sleep(connectDelayMs);
      if (connectFailuresLeft > 0) {
        connectFailuresLeft--;
        throw new ConnectException("Connection refused");
      }
    }

    @Override
    protected void doDisconnect() {
      disconnects.incrementAndGet();
      if (running.get() > 0) disconnectsWhileRunning.incrementAndGet();
    }

    @Override
    protected void doHealthCheck() throws Exception {
      if (!healthy) throw new ConnectException("Connection reset");
    }

    private Object sleep(Params p) throws InterruptedException {
      executions.incrementAndGet();
      int now = running.incrementAndGet();
      maxRunning.accumulateAndGet(now, Math::max);
      try {
        Thread.sleep(p.integer("millis"));
        return Map.of("slept", p.integer("millis"));
      } catch (InterruptedException e) {
        interrupts.incrementAndGet();
        throw e;
      } finally {
        running.decrementAndGet();
      }
    }

    private Object fail(Params p) throws Exception {
      executions.incrementAndGet();
      switch (p.string("error")) {
        case "unavailable" -> throw new ConnectException("Connection refused by mongodb://admin:hunter2@db:27017");
        case "conflict" -> throw new ConcurrentModificationException("version clash");
        case "notfound" -> throw StoreException.notFound("No such thing");
        default -> throw new IllegalStateException("stack detail: password=hunter2");
      }
    }
  }
}
