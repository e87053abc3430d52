package io.intellixity.vigil.spi.security;

import io.intellixity.vigil.advisor.scenario.Scenario;

/** Authorization checks of the index lifecycle. Each check throws {@link ForbiddenException} when denied. */
public interface IndexSecurity {
  void publishScenario(Scenario scenario);

  void writeDataModelIndexes(String organizationId);

  void readDataModel(String organizationId);
}
