package io.intellixity.vigil.governance;

import io.intellixity.vigil.advisor.scenario.Scenario;
import io.intellixity.vigil.spi.security.ForbiddenException;
import io.intellixity.vigil.spi.security.IndexSecurity;

import java.util.Objects;

/**
 * {@link IndexSecurity} backed by the thread-bound {@link GovernanceContext}.\n
 *
 * A caller only acts on its own organization. ADMIN and BUILDER may publish and write indexes; any
 * role may read. A context without a role is system work (jobs) and is trusted for its organization.\n
 */
public final class GovernedIndexSecurity implements IndexSecurity {

  @Override
  public void publishScenario(Scenario scenario) {
    Objects.requireNonNull(scenario, "scenario");
    requireWriter(scenario.organizationId(), "publish scenario " + scenario.id());
  }

  @Override
  public void writeDataModelIndexes(String organizationId) {
    requireWriter(organizationId, "write indexes");
  }

  @Override
  public void readDataModel(String organizationId) {
    requireOrganization(organizationId, "read data model");
  }

  private static void requireWriter(String organizationId, String action) {
    GovernanceContext ctx = requireOrganization(organizationId, action);
    Role role = ctx.role();
    if (role != null && !role.canWriteIndexes()) {
      throw new ForbiddenException("Role " + role + " is not allowed to " + action);
    }
  }

  private static GovernanceContext requireOrganization(String organizationId, String action) {
    GovernanceContext ctx = Governance.currentOrNull();
    if (ctx == null) throw new ForbiddenException("No caller identity to " + action);
    if (ctx.get(GovernanceContext.ORG_ID) == null || !ctx.organizationId().equals(organizationId)) {
      throw new ForbiddenException("Not allowed to " + action + " for organization " + organizationId);
    }
    return ctx;
  }
}
