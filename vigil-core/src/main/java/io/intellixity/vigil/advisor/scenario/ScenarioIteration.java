package io.intellixity.vigil.advisor.scenario;

import io.intellixity.vigil.advisor.ast.AstNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public record ScenarioIteration(String id,
                                String organizationId,
                                String scenarioId,
                                AstNode triggerCondition,
                                List<ScenarioRule> rules) {
  public ScenarioIteration {
    Objects.requireNonNull(id, "id");
    rules = rules == null ? List.of() : List.copyOf(rules);
  }

  /** Trigger condition then every rule formula, skipping the ones not set. */
  public List<AstNode> expressions() {
    List<AstNode> out = new ArrayList<>();
    if (triggerCondition != null) out.add(triggerCondition);
    for (ScenarioRule r : rules) {
      if (r != null && r.formula() != null) out.add(r.formula());
    }
    return out;
  }
}
