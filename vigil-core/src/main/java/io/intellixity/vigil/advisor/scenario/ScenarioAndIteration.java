package io.intellixity.vigil.advisor.scenario;

import java.util.Objects;

public record ScenarioAndIteration(Scenario scenario, ScenarioIteration iteration) {
  public ScenarioAndIteration {
    Objects.requireNonNull(scenario, "scenario");
    Objects.requireNonNull(iteration, "iteration");
  }
}
