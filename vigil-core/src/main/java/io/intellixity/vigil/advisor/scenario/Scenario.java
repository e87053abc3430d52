package io.intellixity.vigil.advisor.scenario;

import java.util.Objects;

public record Scenario(String id, String organizationId, String name) {
  public Scenario {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(organizationId, "organizationId");
  }
}
