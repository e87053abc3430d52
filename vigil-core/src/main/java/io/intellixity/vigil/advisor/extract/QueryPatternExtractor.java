package io.intellixity.vigil.advisor.extract;

import io.intellixity.vigil.advisor.ast.AstFunction;
import io.intellixity.vigil.advisor.ast.AstNode;
import io.intellixity.vigil.advisor.ast.FilterOperator;
import io.intellixity.vigil.advisor.ast.InvalidAstException;
import io.intellixity.vigil.advisor.model.AggregateQueryFamily;
import io.intellixity.vigil.advisor.model.Identifiers;

import java.util.*;

/**
 * Finds every aggregator in a set of rule expressions and reduces each one to its
 * {@link AggregateQueryFamily}.\n
 *
 * Stateless.\n
 */
public final class QueryPatternExtractor {
  static final String TABLE_NAME = "tableName";
  static final String FIELD_NAME = "fieldName";
  static final String OPERATOR = "operator";
  static final String FILTERS = "filters";

  /** Deduplicated query families of all expressions, ordered by canonical key. */
  public SortedSet<AggregateQueryFamily> extract(Collection<AstNode> expressions) {
    SortedSet<AggregateQueryFamily> out = new TreeSet<>();
    if (expressions == null) return out;
    for (AstNode e : expressions) {
      if (e != null) out.addAll(extract(e));
    }
    return out;
  }

  public SortedSet<AggregateQueryFamily> extract(AstNode expression) {
    Objects.requireNonNull(expression, "expression");
    SortedSet<AggregateQueryFamily> out = new TreeSet<>();
    expression.walk(node -> {
      if (node.function() == AstFunction.AGGREGATOR) out.add(toQueryFamily(node));
    });
    return out;
  }

  /** Classify the columns of one aggregator node. */
  public static AggregateQueryFamily toQueryFamily(AstNode aggregator) {
    if (aggregator.function() != AstFunction.AGGREGATOR) {
      throw new InvalidAstException("Node '" + aggregator.name() + "' is not an aggregator");
    }
    String table = aggregator.readConstantNamedChildString(TABLE_NAME);
    String aggregatedField = aggregator.readConstantNamedChildString(FIELD_NAME);
    AggregateQueryFamily.Builder family = AggregateQueryFamily.builder(table);

    AstNode filters = aggregator.namedChild(FILTERS);
    if (filters != null) {
      for (AstNode filter : filters.children()) {
        String filterTable = filter.readConstantNamedChildString(TABLE_NAME);
        if (filterTable.isEmpty() || !Identifiers.same(filterTable, table)) {
          throw new InvalidAstException("Filter tableName '" + filterTable
              + "' is empty or differs from aggregator tableName '" + table + "'");
        }
        String field = filter.readConstantNamedChildString(FIELD_NAME);
        if (field.isEmpty()) throw new InvalidAstException("Filter fieldName is empty on table '" + table + "'");

        FilterOperator op = FilterOperator.fromSymbol(filter.readConstantNamedChildString(OPERATOR));
        switch (op.kind()) {
          case EQUALITY -> family.eq(field);
          case RANGE -> family.ineq(field);
          case OTHER -> family.other(field);
        }
      }
    }

    // The aggregated column must be readable from the index even when no filter mentions it.
    family.other(aggregatedField);
    return family.build();
  }
}
