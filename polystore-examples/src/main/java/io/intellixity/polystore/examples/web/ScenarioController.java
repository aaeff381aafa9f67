package io.intellixity.polystore.examples.web;

import io.intellixity.polystore.examples.service.EcommerceScenarioService;
import io.intellixity.polystore.examples.service.EcommerceScenarioService.ScenarioReport;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/scenarios")
public final class ScenarioController {
  private final EcommerceScenarioService ecommerce;

  public ScenarioController(EcommerceScenarioService ecommerce) {
    this.ecommerce = ecommerce;
  }

  @PostMapping("/ecommerce/run")
  public ScenarioReport runEcommerce() {
    return ecommerce.run();
  }
}
