package io.intellixity.polystore.examples.config;

import io.intellixity.polystore.config.AdapterSettings;
import io.intellixity.polystore.gateway.RouterSettings;
import io.intellixity.polystore.gateway.SupervisorSettings;
import io.intellixity.polystore.op.Paradigm;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "polystore")
public class PolystoreProperties {
  private final Router router = new Router();
  private final Supervisor supervisor = new Supervisor();

  /** Per paradigm id ({@code object}, {@code vector}, ...) the string settings handed to its adapter factory. */
  private final Map<String, Map<String, String>> paradigms = new HashMap<>();

  /** Connect every paradigm at startup instead of on first use. */
  private boolean eagerStart = true;

  /** Period of background health checks; zero disables them. */
  private Duration healthCheckInterval = Duration.ofSeconds(30);

  public Router getRouter() { return router; }
  public Supervisor getSupervisor() { return supervisor; }
  public Map<String, Map<String, String>> getParadigms() { return paradigms; }
  public boolean isEagerStart() { return eagerStart; }
  public void setEagerStart(boolean eagerStart) { this.eagerStart = eagerStart; }
  public Duration getHealthCheckInterval() { return healthCheckInterval; }
  public void setHealthCheckInterval(Duration healthCheckInterval) { this.healthCheckInterval = healthCheckInterval; }

  public AdapterSettings adapterSettings(Paradigm paradigm) {
    Map<String, String> values = paradigms.get(paradigm.id());
    return (values == null) ? AdapterSettings.empty(paradigm) : AdapterSettings.of(paradigm, new LinkedHashMap<>(values));
  }

  public RouterSettings routerSettings() {
    return new RouterSettings(router.getOperationTimeout(), router.getWorkerThreads());
  }

  public SupervisorSettings supervisorSettings() {
    return new SupervisorSettings(supervisor.getConnectTimeout(), supervisor.getInitialBackoff(),
        supervisor.getMaxBackoff(), supervisor.getMaxConnectAttempts(), supervisor.getShutdownGrace());
  }

  public static class Router {
    private Duration operationTimeout = RouterSettings.DEFAULT_OPERATION_TIMEOUT;
    private int workerThreads = Math.max(4, Runtime.getRuntime().availableProcessors());

    public Duration getOperationTimeout() { return operationTimeout; }
    public void setOperationTimeout(Duration operationTimeout) { this.operationTimeout = operationTimeout; }
    public int getWorkerThreads() { return workerThreads; }
    public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
  }

  public static class Supervisor {
    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration initialBackoff = Duration.ofMillis(500);
    private Duration maxBackoff = Duration.ofSeconds(30);
    private int maxConnectAttempts = 5;
    private Duration shutdownGrace = Duration.ofSeconds(5);

    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
    public Duration getInitialBackoff() { return initialBackoff; }
    public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }
    public Duration getMaxBackoff() { return maxBackoff; }
    public void setMaxBackoff(Duration maxBackoff) { this.maxBackoff = maxBackoff; }
    public int getMaxConnectAttempts() { return maxConnectAttempts; }
    public void setMaxConnectAttempts(int maxConnectAttempts) { this.maxConnectAttempts = maxConnectAttempts; }
    public Duration getShutdownGrace() { return shutdownGrace; }
    public void setShutdownGrace(Duration shutdownGrace) { this.shutdownGrace = shutdownGrace; }
  }
}
