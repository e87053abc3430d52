package io.intellixity.vigil.spi.scenario;

import io.intellixity.vigil.advisor.scenario.ScenarioAndIteration;
import io.intellixity.vigil.advisor.scenario.ScenarioIteration;

import java.util.List;

/** Read access to stored scenarios. */
public interface ScenarioFetcher {

  /** @throws NotFoundException when no iteration has this id */
  ScenarioAndIteration fetchScenarioAndIteration(String iterationId);

  /** Iterations currently live (published) for an organization. */
  List<ScenarioIteration> listLiveIterations(String organizationId);
}
