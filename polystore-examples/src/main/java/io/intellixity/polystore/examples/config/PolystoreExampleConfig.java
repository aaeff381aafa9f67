package io.intellixity.polystore.examples.config;

import io.intellixity.polystore.gateway.GatewayRouter;
import io.intellixity.polystore.gateway.LifecycleSupervisor;
import io.intellixity.polystore.op.Paradigm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
@EnableConfigurationProperties(PolystoreProperties.class)
public class PolystoreExampleConfig {
  private static final Logger log = LoggerFactory.getLogger(PolystoreExampleConfig.class);

  @Bean(destroyMethod = "shutdownAll")
  public LifecycleSupervisor lifecycleSupervisor(PolystoreProperties props) {
    LifecycleSupervisor supervisor = new LifecycleSupervisor(props.supervisorSettings(), props::adapterSettings);
    // Adapter factories come from META-INF/polystore.factories on the classpath.
    List<Paradigm> registered = supervisor.registerDiscovered();
    log.info("polystore.examples registered={}", registered);
    if (props.isEagerStart()) supervisor.startAll();
    if (!props.getHealthCheckInterval().isZero()) supervisor.startHealthChecks(props.getHealthCheckInterval());
    return supervisor;
  }

  @Bean(destroyMethod = "close")
  public GatewayRouter gatewayRouter(LifecycleSupervisor supervisor, PolystoreProperties props) {
    return new GatewayRouter(supervisor, props.routerSettings());
  }
}
