package io.intellixity.polystore.gateway;

import io.intellixity.polystore.adapter.ConcurrencyMode;
import io.intellixity.polystore.config.AdapterSettings;
import io.intellixity.polystore.gateway.metrics.OperationSummary;
import io.intellixity.polystore.lifecycle.AdapterState;
import io.intellixity.polystore.op.Operation;
import io.intellixity.polystore.op.Paradigm;
import io.intellixity.polystore.result.ErrorCategory;
import io.intellixity.polystore.result.ResultEnvelope;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

final class GatewayRouterTest {
  private LifecycleSupervisor supervisor;
  private GatewayRouter router;

  private GatewayRouter router(Duration timeout, FakeStoreFactory... factories) {
    supervisor = new LifecycleSupervisor(SupervisorSettings.defaults(), AdapterSettings::empty);
    for (FakeStoreFactory f : factories) supervisor.registerAdapter(f.paradigm(), f);
    router = new GatewayRouter(supervisor, new RouterSettings(timeout, 4));
    return router;
  }

  @AfterEach
  void tearDown() {
    if (router != null) router.close();
    if (supervisor != null) supervisor.shutdownAll();
  }

  private static Operation op(Paradigm p, String kind, Map<String, ?> params) {
    return Operation.of(p, kind, params);
  }

  @Test
  void routesToTheParadigmAdapter() {
    GatewayRouter r = router(Duration.ofSeconds(5), new FakeStoreFactory(Paradigm.OBJECT));

    ResultEnvelope env = r.route(op(Paradigm.OBJECT, "echo", Map.of("value", "hi")));
    assertTrue(env.ok());
    assertEquals(Paradigm.OBJECT, env.paradigm());
    assertEquals("echo", env.kind());
    assertEquals(Map.of("value", "hi"), env.data());
    assertNull(env.error());

    assertEquals(ResultEnvelope.ACK, r.route(op(Paradigm.OBJECT, "echo", Map.of())).data());
  }

  @Test
  void unregisteredParadigmIsUnavailable() {
    GatewayRouter r = router(Duration.ofSeconds(5), new FakeStoreFactory(Paradigm.OBJECT));
    ResultEnvelope env = r.route(op(Paradigm.GRAPH, "echo", Map.of()));
    assertFalse(env.ok());
    assertEquals(ErrorCategory.BACKEND_UNAVAILABLE, env.category());
    assertFalse(env.error().retryable());
    assertNull(env.data());
  }

  @Test
  void invalidOperationsNeverReachTheAdapter() {
    FakeStoreFactory f = new FakeStoreFactory(Paradigm.OBJECT);
    GatewayRouter r = router(Duration.ofSeconds(5), f);

    assertEquals(ErrorCategory.INVALID_INPUT, r.route(op(Paradigm.OBJECT, "nope", Map.of())).category());
    assertEquals(ErrorCategory.INVALID_INPUT, r.route(op(Paradigm.OBJECT, "sleep", Map.of("millis", "ten"))).category());
    assertEquals(ErrorCategory.INVALID_INPUT, r.route(op(Paradigm.OBJECT, "sleep", Map.of())).category());
    assertEquals(ErrorCategory.INVALID_INPUT,
        r.route(op(Paradigm.OBJECT, "echo", Map.of("value", "x", "extra", 1))).category());

    assertEquals(0, f.creates.get());
    assertEquals(0, f.connectCalls.get());
  }

  @Test
  void slowOperationTimesOutPromptly() throws Exception {
    FakeStoreFactory f = new FakeStoreFactory(Paradigm.VECTOR);
    GatewayRouter r = router(Duration.ofMillis(300), f);

    long start = System.nanoTime();
    ResultEnvelope env = r.route(op(Paradigm.VECTOR, "sleep", Map.of("millis", 10_000)));
    long tookMs = (System.nanoTime() - start) / 1_000_000L;

    assertEquals(ErrorCategory.TIMEOUT, env.category());
    assertTrue(env.error().retryable());
    assertTrue(tookMs < 3_000, "took " + tookMs + "ms");
    for (int i = 0; i < 100 && f.interrupts.get() == 0; i++) Thread.sleep(20);
    assertEquals(1, f.interrupts.get());
    assertEquals(AdapterState.READY, supervisor.handle(Paradigm.VECTOR).orElseThrow().state());
  }

  @Test
  void failuresAreNormalized() {
    GatewayRouter r = router(Duration.ofSeconds(5), new FakeStoreFactory(Paradigm.GRAPH));

    ResultEnvelope notFound = r.route(op(Paradigm.GRAPH, "fail", Map.of("error", "notfound")));
    assertEquals(ErrorCategory.NOT_FOUND, notFound.category());
    assertEquals("No such thing", notFound.error().message());

    assertEquals(ErrorCategory.CONFLICT, r.route(op(Paradigm.GRAPH, "fail", Map.of("error", "conflict"))).category());

    ResultEnvelope internal = r.route(op(Paradigm.GRAPH, "fail", Map.of("error", "bug")));
    assertEquals(ErrorCategory.INTERNAL, internal.category());
    assertEquals("Internal error", internal.error().message());
    assertFalse(internal.error().retryable());
  }

  @Test
  void backendUnavailableDegradesTheHandle() {
    FakeStoreFactory f = new FakeStoreFactory(Paradigm.GRAPH);
    GatewayRouter r = router(Duration.ofSeconds(5), f);

    ResultEnvelope env = r.route(op(Paradigm.GRAPH, "fail", Map.of("error", "unavailable")));
    assertEquals(ErrorCategory.BACKEND_UNAVAILABLE, env.category());
    assertFalse(env.error().message().contains("hunter2"));
    assertEquals(AdapterState.DEGRADED, supervisor.handle(Paradigm.GRAPH).orElseThrow().state());

    int before = f.executions.get();
    ResultEnvelope next = r.route(op(Paradigm.GRAPH, "echo", Map.of()));
    assertEquals(ErrorCategory.BACKEND_UNAVAILABLE, next.category());
    assertTrue(next.error().retryable());
    assertEquals(before, f.executions.get());
  }

  @Test
  void missingSettingsLeaveOtherParadigmsWorking() {
    FakeStoreFactory columnar = new FakeStoreFactory(Paradigm.COLUMNAR);
    columnar.requiredSetting = "jdbcUrl";
    GatewayRouter r = router(Duration.ofSeconds(5), columnar, new FakeStoreFactory(Paradigm.OBJECT));

    ResultEnvelope broken = r.route(op(Paradigm.COLUMNAR, "echo", Map.of()));
    assertEquals(ErrorCategory.BACKEND_UNAVAILABLE, broken.category());
    assertFalse(broken.error().retryable());
    assertTrue(r.route(op(Paradigm.OBJECT, "echo", Map.of())).ok());
  }

  @Test
  void serializedAdaptersRunOneCallAtATime() {
    FakeStoreFactory f = new FakeStoreFactory(Paradigm.COLUMNAR, ConcurrencyMode.SERIALIZED);
    GatewayRouter r = router(Duration.ofSeconds(5), f);

    CompletableFuture<ResultEnvelope> a = r.routeAsync(op(Paradigm.COLUMNAR, "sleep", Map.of("millis", 150)));
    CompletableFuture<ResultEnvelope> b = r.routeAsync(op(Paradigm.COLUMNAR, "sleep", Map.of("millis", 150)));
    assertTrue(a.join().ok());
    assertTrue(b.join().ok());
    assertEquals(1, f.maxRunning.get());
  }

  @Test
  void concurrentAdaptersRunInParallel() {
    FakeStoreFactory f = new FakeStoreFactory(Paradigm.OBJECT);
    GatewayRouter r = router(Duration.ofSeconds(5), f);
    r.route(op(Paradigm.OBJECT, "echo", Map.of()));

    CompletableFuture<ResultEnvelope> a = r.routeAsync(op(Paradigm.OBJECT, "sleep", Map.of("millis", 300)));
    CompletableFuture<ResultEnvelope> b = r.routeAsync(op(Paradigm.OBJECT, "sleep", Map.of("millis", 300)));
    assertTrue(a.join().ok());
    assertTrue(b.join().ok());
    assertEquals(2, f.maxRunning.get());
  }

  @Test
  void recordsOneSamplePerRoutedOperation() {
    GatewayRouter r = router(Duration.ofSeconds(5), new FakeStoreFactory(Paradigm.OBJECT));
    r.route(op(Paradigm.OBJECT, "echo", Map.of()));
    r.route(op(Paradigm.OBJECT, "echo", Map.of("value", "v")));
    r.route(op(Paradigm.OBJECT, "fail", Map.of("error", "notfound")));

    assertEquals(3, r.metrics().samples(Paradigm.OBJECT).size());
    List<OperationSummary> summary = r.metrics().summary();
    assertEquals(2, summary.size());
    OperationSummary echo = summary.get(0);
    assertEquals("echo", echo.kind());
    assertEquals(2, echo.count());
    assertEquals(0, echo.failures());
    assertEquals(1, summary.get(1).failures());
  }

  @Test
  void closedGatewayAnswersWithEnvelopes() {
    GatewayRouter r = router(Duration.ofSeconds(5), new FakeStoreFactory(Paradigm.OBJECT));
    supervisor.shutdownAll();
    ResultEnvelope env = r.route(op(Paradigm.OBJECT, "echo", Map.of()));
    assertEquals(ErrorCategory.BACKEND_UNAVAILABLE, env.category());
  }

  @Test
  void cancelledRequestLeavesTheLazyConnectToOtherCallers() throws Exception {
    FakeStoreFactory f = new FakeStoreFactory(Paradigm.OBJECT);
    f.connectDelayMs = 300;
    GatewayRouter r = router(Duration.ofSeconds(5), f);

    CompletableFuture<ResultEnvelope> abandoned = r.routeAsync(op(Paradigm.OBJECT, "echo", Map.of("value", "a")));
    Thread.sleep(50);
    assertTrue(abandoned.cancel(true));

    ResultEnvelope env = r.route(op(Paradigm.OBJECT, "echo", Map.of("value", "b")));
    assertTrue(env.ok(), () -> String.valueOf(env.error()));
    assertEquals(Map.of("value", "b"), env.data());
    assertEquals(1, f.connectCalls.get());
    assertEquals(AdapterState.READY, supervisor.handle(Paradigm.OBJECT).orElseThrow().state());
  }
}
