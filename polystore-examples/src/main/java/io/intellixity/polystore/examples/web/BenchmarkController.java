package io.intellixity.polystore.examples.web;

import io.intellixity.polystore.gateway.GatewayRouter;
import io.intellixity.polystore.gateway.metrics.OperationSample;
import io.intellixity.polystore.gateway.metrics.OperationSummary;
import io.intellixity.polystore.op.Paradigm;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/benchmarks")
public final class BenchmarkController {
  private final GatewayRouter router;

  public BenchmarkController(GatewayRouter router) {
    this.router = router;
  }

  @GetMapping("/summary")
  public List<OperationSummary> summary() {
    return router.metrics().summary();
  }

  @GetMapping("/samples")
  public List<OperationSample> samples(@RequestParam(name = "paradigm", required = false) String paradigm) {
    return router.metrics().samples(paradigm == null ? null : Paradigm.parse(paradigm));
  }

  @DeleteMapping
  public ResponseEntity<Void> clear() {
    router.metrics().clear();
    return ResponseEntity.noContent().build();
  }
}
