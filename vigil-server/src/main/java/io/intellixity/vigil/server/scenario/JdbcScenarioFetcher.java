package io.intellixity.vigil.server.scenario;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.vigil.advisor.ast.AstNode;
import io.intellixity.vigil.advisor.scenario.Scenario;
import io.intellixity.vigil.advisor.scenario.ScenarioAndIteration;
import io.intellixity.vigil.advisor.scenario.ScenarioIteration;
import io.intellixity.vigil.advisor.scenario.ScenarioRule;
import io.intellixity.vigil.spi.scenario.NotFoundException;
import io.intellixity.vigil.spi.scenario.ScenarioFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads scenarios from the main database; AST columns hold the editor JSON.\n
 *
 * Live iterations are the published ones, those under an active test run and those published or
 * prepared in the last 72 hours.\n
 */
public final class JdbcScenarioFetcher implements ScenarioFetcher {
  private static final Logger log = LoggerFactory.getLogger(JdbcScenarioFetcher.class);

  static final String ITERATION = """
      SELECT si.id, si.org_id, si.scenario_id, si.trigger_condition_ast_expression, s.name AS scenario_name
      FROM scenario_iterations si
      INNER JOIN scenarios s ON s.id = si.scenario_id
      WHERE si.id = ?::uuid""";

  static final String RULES = """
      SELECT id, name, formula_ast_expression
      FROM scenario_iteration_rules
      WHERE scenario_iteration_id = ?::uuid
      ORDER BY created_at, id""";

  static final String LIVE_ITERATION_IDS = """
      SELECT si.id FROM scenario_iterations si
      INNER JOIN scenarios s ON s.live_scenario_iteration_id = si.id
      WHERE si.org_id = ?::uuid
      UNION
      SELECT str.scenario_iteration_id FROM scenario_iterations si
      INNER JOIN scenario_test_run str ON str.scenario_iteration_id = si.id
      WHERE si.org_id = ?::uuid AND str.status = 'up'
      UNION
      SELECT sp.scenario_iteration_id FROM scenario_publications sp
      WHERE sp.org_id = ?::uuid
        AND sp.publication_action IN ('publish', 'prepare')
        AND sp.created_at > now() - interval '72 hour'""";

  private final DataSource ds;
  private final ObjectMapper json;

  public JdbcScenarioFetcher(DataSource ds, ObjectMapper json) {
    this.ds = Objects.requireNonNull(ds, "ds");
    this.json = Objects.requireNonNull(json, "json");
  }

  @Override
  public ScenarioAndIteration fetchScenarioAndIteration(String iterationId) {
    Objects.requireNonNull(iterationId, "iterationId");
    try (Connection c = ds.getConnection()) {
      ScenarioAndIteration si = load(c, iterationId);
      if (si == null) throw new NotFoundException("Scenario iteration " + iterationId + " not found");
      return si;
    } catch (SQLException e) {
      throw new ScenarioStoreException("Cannot read scenario iteration " + iterationId, e);
    }
  }

  @Override
  public List<ScenarioIteration> listLiveIterations(String organizationId) {
    Objects.requireNonNull(organizationId, "organizationId");
    try (Connection c = ds.getConnection()) {
      List<String> ids = new ArrayList<>();
      try (PreparedStatement ps = c.prepareStatement(LIVE_ITERATION_IDS)) {
        for (int i = 1; i <= 3; i++) ps.setString(i, organizationId);
        try (ResultSet rs = ps.executeQuery()) {
          while (rs.next()) ids.add(rs.getString(1));
        }
      }
      List<ScenarioIteration> out = new ArrayList<>(ids.size());
      for (String id : ids) {
        ScenarioAndIteration si = load(c, id);
        if (si != null) out.add(si.iteration());
      }
      log.debug("vigil.scenarios live iterations org={} count={}", organizationId, out.size());
      return out;
    } catch (SQLException e) {
      throw new ScenarioStoreException("Cannot list live iterations of organization " + organizationId, e);
    }
  }

  private ScenarioAndIteration load(Connection c, String iterationId) throws SQLException {
    String org;
    String scenarioId;
    String scenarioName;
    String trigger;
    try (PreparedStatement ps = c.prepareStatement(ITERATION)) {
      ps.setString(1, iterationId);
      try (ResultSet rs = ps.executeQuery()) {
        if (!rs.next()) return null;
        org = rs.getString("org_id");
        scenarioId = rs.getString("scenario_id");
        scenarioName = rs.getString("scenario_name");
        trigger = rs.getString("trigger_condition_ast_expression");
      }
    }

    List<ScenarioRule> rules = new ArrayList<>();
    try (PreparedStatement ps = c.prepareStatement(RULES)) {
      ps.setString(1, iterationId);
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          rules.add(new ScenarioRule(rs.getString("id"), rs.getString("name"), readAst(rs.getString("formula_ast_expression"))));
        }
      }
    }

    ScenarioIteration iteration = new ScenarioIteration(iterationId, org, scenarioId, readAst(trigger), rules);
    return new ScenarioAndIteration(new Scenario(scenarioId, org, scenarioName), iteration);
  }

  /** Null or JSON null stays null (rule not written yet). */
  AstNode readAst(String raw) {
    if (raw == null || raw.isBlank() || raw.trim().equals("null")) return null;
    try {
      return json.readValue(raw, AstNode.class);
    } catch (JsonProcessingException e) {
      throw new ScenarioStoreException("Stored rule expression is not valid JSON", e);
    }
  }
}
