package io.intellixity.vigil.governance;

import io.intellixity.vigil.advisor.scenario.Scenario;
import io.intellixity.vigil.spi.security.ForbiddenException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class GovernedIndexSecurityTest {
  private final GovernedIndexSecurity security = new GovernedIndexSecurity();
  private final Scenario scenario = new Scenario("sc-1", "org-1", "Large transfers");

  private static void as(String org, Role role, Runnable work) {
    Governance.inContext(GovernanceContext.forUser(org, "u-1", role), work);
  }

  @Test
  void adminAndBuilderMayPublishAndWrite() {
    for (Role role : new Role[]{Role.ADMIN, Role.BUILDER}) {
      as("org-1", role, () -> {
        assertDoesNotThrow(() -> security.publishScenario(scenario));
        assertDoesNotThrow(() -> security.writeDataModelIndexes("org-1"));
      });
    }
  }

  @Test
  void otherRolesMayOnlyRead() {
    for (Role role : new Role[]{Role.PUBLISHER, Role.VIEWER}) {
      as("org-1", role, () -> {
        assertThrows(ForbiddenException.class, () -> security.publishScenario(scenario));
        assertThrows(ForbiddenException.class, () -> security.writeDataModelIndexes("org-1"));
        assertDoesNotThrow(() -> security.readDataModel("org-1"));
      });
    }
  }

  @Test
  void otherOrganizationIsForbiddenForEveryRole() {
    as("org-2", Role.ADMIN, () -> {
      assertThrows(ForbiddenException.class, () -> security.publishScenario(scenario));
      assertThrows(ForbiddenException.class, () -> security.writeDataModelIndexes("org-1"));
      assertThrows(ForbiddenException.class, () -> security.readDataModel("org-1"));
    });
  }

  @Test
  void noContextIsForbidden() {
    assertThrows(ForbiddenException.class, () -> security.readDataModel("org-1"));
  }

  @Test
  void systemContextIsTrustedForItsOrganization() {
    GovernanceContext system = GovernanceContext.of(Map.of(GovernanceContext.ORG_ID, "org-1"), "system:org-1");
    Governance.inContext(system, () -> {
      assertDoesNotThrow(() -> security.writeDataModelIndexes("org-1"));
      assertThrows(ForbiddenException.class, () -> security.writeDataModelIndexes("org-2"));
    });
  }
}
