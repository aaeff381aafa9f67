package io.intellixity.polystore.examples.web;

import io.intellixity.polystore.gateway.GatewayRouter;
import io.intellixity.polystore.op.Operation;
import io.intellixity.polystore.op.Paradigm;
import io.intellixity.polystore.op.ParamSpec;
import io.intellixity.polystore.result.ResultEnvelope;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.*;

@RestController
@RequestMapping("/api")
public final class GatewayController {
  private final GatewayRouter router;

  public GatewayController(GatewayRouter router) {
    this.router = router;
  }

  @PostMapping("/operations")
  public ResponseEntity<ResultEnvelope> execute(@RequestBody Operation op) {
    return ErrorStatus.respond(router.route(op));
  }

  /** Kinds and parameters each registered paradigm accepts. */
  @GetMapping("/operations")
  public Map<String, Object> catalog() {
    Map<String, Object> out = new LinkedHashMap<>();
    for (Paradigm p : router.supervisor().paradigms()) {
      var schema = router.supervisor().operations(p);
      Map<String, Object> kinds = new LinkedHashMap<>();
      for (String kind : schema.kinds()) {
        List<Map<String, Object>> params = new ArrayList<>();
        for (ParamSpec s : schema.params(kind)) {
          params.add(Map.of("name", s.name(), "type", s.type().name(), "required", s.required()));
        }
        kinds.put(kind, params);
      }
      out.put(p.id(), kinds);
    }
    return out;
  }
}
