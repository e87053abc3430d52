package io.intellixity.vigil.advisor;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.vigil.advisor.ast.AstFunction;
import io.intellixity.vigil.advisor.ast.AstNode;
import io.intellixity.vigil.advisor.ast.InvalidAstException;
import io.intellixity.vigil.advisor.model.ConcreteIndex;
import io.intellixity.vigil.advisor.model.IndexFamily;
import io.intellixity.vigil.advisor.model.IndexType;
import io.intellixity.vigil.advisor.scenario.ScenarioIteration;
import io.intellixity.vigil.advisor.scenario.ScenarioRule;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;

import static org.junit.jupiter.api.Assertions.*;

final class IndexAdvisorTest {
  private final IndexAdvisor advisor = new IndexAdvisor();

  private static AstNode agg(String field, AstNode... filters) {
    return AstNode.aggregator("table", field, "SUM", List.of(filters));
  }

  private static AstNode filter(String field, String op) {
    return AstNode.filter("table", field, op, 3);
  }

  private static ScenarioIteration iteration(AstNode trigger, AstNode... formulas) {
    List<ScenarioRule> rules = new ArrayList<>();
    for (int i = 0; i < formulas.length; i++) rules.add(new ScenarioRule("r" + i, "rule " + i, formulas[i]));
    return new ScenarioIteration("it-1", "org-1", "sc-1", trigger, rules);
  }

  @Test
  void emptyInput() {
    assertTrue(advisor.indexesToCreate(List.of(), null).isEmpty());
    assertTrue(advisor.indexesToCreate(iteration(null), List.of()).isEmpty());
  }

  @Test
  void oneEqualityAggregation() {
    List<ConcreteIndex> out = advisor.indexesToCreate(iteration(agg("field 0", filter("field", "="))), null);
    assertEquals(List.of(ConcreteIndex.aggregation("table", List.of("field"), List.of("field 0"))), out);
    assertEquals(IndexType.AGGREGATION, out.get(0).type());
    assertNull(out.get(0).name());
  }

  @Test
  void invalidAggregationBlocksTheIteration() {
    AstNode badFilter = AstNode.of(AstFunction.FILTER, java.util.Map.of(
        "tableName", AstNode.constant("table"),
        "operator", AstNode.constant("=")));
    assertThrows(InvalidAstException.class,
        () -> advisor.indexesToCreate(iteration(agg("field 0", badFilter)), null));
  }

  @Test
  void columnNamedWithCommaGetsItsOwnIndex() {
    List<ConcreteIndex> out = advisor.indexesToCreate(iteration(
        agg("amount", filter("a, b", "=")),
        agg("amount", filter("a", "="), filter("b", "="))), List.of());
    assertEquals(2, out.size());
    assertTrue(out.contains(ConcreteIndex.aggregation("table", List.of("a, b"), List.of("amount"))));
    assertTrue(out.contains(ConcreteIndex.aggregation("table", List.of("a", "b"), List.of("amount"))));
  }

  @Test
  void mixedCaseSpellingsOfOneColumnIndexItOnce() {
    List<ConcreteIndex> out = advisor.indexesToCreate(
        iteration(agg("amount", filter("Field", "="), filter("field", ">"))), List.of());
    assertEquals(List.of(ConcreteIndex.aggregation("table", List.of("Field"), List.of("amount"))), out);
  }

  @Test
  void twoRangeColumnsInOneAggregationGiveTwoIndexes() {
    AstNode trigger = agg("amount", filter("field", "="), filter("field2", ">"), filter("field3", ">"));
    List<ConcreteIndex> out = advisor.indexesToCreate(iteration(trigger), List.of());
    assertEquals(List.of(
        ConcreteIndex.aggregation("table", List.of("field", "field2"), List.of("amount", "field3")),
        ConcreteIndex.aggregation("table", List.of("field", "field3"), List.of("amount", "field2"))), out);
  }

  @Test
  void oneRangeColumnPerAggregation() {
    ScenarioIteration it = iteration(null,
        agg("amount", filter("field", "="), filter("field2", ">")),
        agg("amount", filter("field", "="), filter("field3", ">")));
    List<ConcreteIndex> out = advisor.indexesToCreate(it, List.of());
    assertEquals(List.of(
        ConcreteIndex.aggregation("table", List.of("field", "field2"), List.of("amount")),
        ConcreteIndex.aggregation("table", List.of("field", "field3"), List.of("amount"))), out);
  }

  @Test
  void overlappingRulesShareOneIndex() {
    ScenarioIteration it = iteration(null,
        agg("amount", filter("account_id", "=")),
        agg("amount", filter("account_id", "="), filter("counterparty_id", "=")));
    List<ConcreteIndex> out = advisor.indexesToCreate(it, List.of());
    assertEquals(1, out.size());
    assertEquals(List.of("account_id", "counterparty_id"), out.get(0).indexed());
    assertEquals(List.of("amount"), out.get(0).included());
  }

  @Test
  void existingIndexSuppressesCoveredNeed() {
    ScenarioIteration it = iteration(agg("amount", filter("account_id", "=")));
    List<ConcreteIndex> existing = List.of(
        ConcreteIndex.aggregation("TABLE", List.of("ACCOUNT_ID", "created_at"), List.of("AMOUNT")));
    assertTrue(advisor.indexesToCreate(it, existing).isEmpty());
  }

  @Test
  void existingIndexOnOtherColumnsDoesNotHelp() throws Exception {
    String json = """
        {"name": "Or", "children": [{"name": "And", "children": [{"name": ">", "children": [
          {"name": "Aggregator", "named_children": {
            "aggregator": {"constant": "COUNT_DISTINCT"},
            "fieldName": {"constant": "object_id"},
            "filters": {"name": "List", "children": [{"name": "Filter", "named_children": {
              "fieldName": {"constant": "new_field"},
              "operator": {"constant": "="},
              "tableName": {"constant": "table"},
              "value": {"constant": "dummy"}}}]},
            "label": {"constant": "test"},
            "tableName": {"constant": "table"}}},
          {"constant": 0}]}]}]}
        """;
    AstNode trigger = new ObjectMapper().readValue(json, AstNode.class);
    List<ConcreteIndex> existing = List.of(ConcreteIndex.aggregation("table", List.of("a", "b"), List.of("c", "d")));
    List<ConcreteIndex> out = advisor.indexesToCreate(iteration(trigger), existing);
    assertEquals(List.of(ConcreteIndex.aggregation("table", List.of("new_field"), List.of("object_id"))), out);
  }

  @Test
  void outputIsDeterministic() {
    List<AstNode> expressions = new ArrayList<>(List.of(
        agg("amount", filter("a", "="), filter("b", ">")),
        agg("amount", filter("a", "="), filter("c", "=")),
        agg("amount", filter("c", "="), filter("d", "<")),
        agg("count", filter("a", "=")),
        AstNode.aggregator("accounts", "balance", "MAX", List.of(AstNode.filter("accounts", "owner", "=", 1)))));
    List<ConcreteIndex> first = advisor.indexesToCreateForExpressions(expressions, List.of());
    Collections.reverse(expressions);
    List<ConcreteIndex> second = advisor.indexesToCreateForExpressions(expressions, List.of());
    assertEquals(first, second);
    assertEquals("accounts", first.get(0).tableName());
  }

  @Test
  void everyCandidateIsCoveredByTheOutput() {
    List<AstNode> expressions = List.of(
        agg("amount", filter("a", "="), filter("b", ">"), filter("c", ">")),
        agg("amount", filter("a", "="), filter("b", "=")),
        agg("amount", filter("b", "=")),
        agg("count", filter("c", "="), filter("a", "="), filter("d", "<=")));
    List<ConcreteIndex> out = advisor.indexesToCreateForExpressions(expressions, List.of());
    SortedSet<IndexFamily> candidates = advisor.candidateFamilies(expressions);
    assertTrue(out.size() < candidates.size());
    for (IndexFamily f : candidates) {
      assertTrue(out.stream().anyMatch(i -> i.covers(f)), () -> "nothing covers " + f);
    }
  }
}
