package io.intellixity.vigil.advisor.family;

import io.intellixity.vigil.advisor.model.AggregateQueryFamily;
import io.intellixity.vigil.advisor.model.IndexFamily;

import java.util.ArrayList;
import java.util.List;

/**
 * Expands a query family into the index families able to serve it.\n
 *
 * A composite index can range-scan only the column right after its equality block, so a query
 * with n range columns yields n mutually exclusive candidates; the other range columns become
 * included columns. Example: {@code a = ?, b = ?, c > ?, d > ?} gives
 * {@code {flex {a,b}, last c, included {d}}} and {@code {flex {a,b}, last d, included {c}}}.\n
 */
public final class IndexFamilyGenerator {

  public List<IndexFamily> generate(AggregateQueryFamily query) {
    if (query.eqConditions().isEmpty() && query.ineqConditions().isEmpty()) return List.of();

    IndexFamily.Builder base = IndexFamily.builder(query.table())
        .addFlex(query.eqConditions())
        .addIncluded(query.selectOrOtherConditions());
    if (query.ineqConditions().isEmpty()) return List.of(base.build());

    List<IndexFamily> out = new ArrayList<>(query.ineqConditions().size());
    for (String rangeColumn : query.ineqConditions()) {
      IndexFamily.Builder b = base.build().toBuilder();
      for (String other : query.ineqConditions()) {
        if (!other.equals(rangeColumn)) b.addIncluded(List.of(other));
      }
      out.add(b.last(rangeColumn).build());
    }
    return out;
  }
}
