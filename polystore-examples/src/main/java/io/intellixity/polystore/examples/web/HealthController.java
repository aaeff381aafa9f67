package io.intellixity.polystore.examples.web;

import io.intellixity.polystore.gateway.LifecycleSupervisor;
import io.intellixity.polystore.lifecycle.HealthRecord;
import io.intellixity.polystore.op.Paradigm;
import io.intellixity.polystore.result.ErrorInfo;
import io.intellixity.polystore.result.ResultEnvelope;
import io.intellixity.polystore.result.StoreException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/health")
public final class HealthController {
  private final LifecycleSupervisor supervisor;

  public HealthController(LifecycleSupervisor supervisor) {
    this.supervisor = supervisor;
  }

  @GetMapping
  public List<HealthRecord> all() {
    return supervisor.healthAll();
  }

  @GetMapping("/{paradigm}")
  public ResponseEntity<HealthRecord> one(@PathVariable("paradigm") String paradigm) {
    Paradigm p = Paradigm.parse(paradigm);
    if (!supervisor.isRegistered(p)) throw StoreException.notFound("No adapter registered for " + p.id());
    HealthRecord h = supervisor.healthCheck(p);
    return ResponseEntity.status(h.healthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(h);
  }

  @PostMapping("/{paradigm}/reconnect")
  public ResponseEntity<HealthRecord> reconnect(@PathVariable("paradigm") String paradigm) {
    Paradigm p = Paradigm.parse(paradigm);
    if (!supervisor.isRegistered(p)) throw StoreException.notFound("No adapter registered for " + p.id());
    try {
      supervisor.reconnect(p);
    } catch (StoreException e) {
      ErrorInfo info = e.toErrorInfo();
      return ResponseEntity.status(ErrorStatus.of(info.category())).body(supervisor.handle(p).orElseThrow().health());
    }
    return ResponseEntity.ok(supervisor.handle(p).orElseThrow().health());
  }
}
