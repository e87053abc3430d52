package io.intellixity.vigil.advisor.minimize;

import io.intellixity.vigil.advisor.model.Identifiers;
import io.intellixity.vigil.advisor.model.IndexFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Reduces a set of candidate index families to a small set of families such that every candidate
 * is served by one of them.\n
 *
 * Candidates are partitioned by table, sorted by canonical key and folded one by one: a candidate
 * is merged into the first accumulated family it is compatible with (the merged family moves to
 * the end), otherwise it is appended. The greedy fold is order dependent, hence the sort.\n
 *
 * A merge keeps track of the candidates it absorbed and is only accepted when one physical key
 * order still serves all of them; that order is carried in {@link MinimizedFamily#keyOrder()}.\n
 */
public final class FamilyMinimizer {
  private static final Logger log = LoggerFactory.getLogger(FamilyMinimizer.class);

  public List<MinimizedFamily> minimize(Collection<IndexFamily> candidates) {
    Map<String, SortedSet<IndexFamily>> byTable = new TreeMap<>();
    for (IndexFamily f : candidates) {
      byTable.computeIfAbsent(Identifiers.normalize(f.tableName()), k -> new TreeSet<>()).add(f);
    }
    List<MinimizedFamily> out = new ArrayList<>();
    for (SortedSet<IndexFamily> families : byTable.values()) {
      out.addAll(minimizeOneTable(families));
    }
    return out;
  }

  /** Pairwise merge: a family serving both inputs, or empty when there is none. */
  public Optional<IndexFamily> merge(IndexFamily left, IndexFamily right) {
    if (!Identifiers.same(left.tableName(), right.tableName())) return Optional.empty();
    return refine(left, right)
        .filter(merged -> KeyOrders.solve(merged, List.of(left, right)).isPresent());
  }

  private List<MinimizedFamily> minimizeOneTable(SortedSet<IndexFamily> families) {
    List<MinimizedFamily> acc = new ArrayList<>();
    for (IndexFamily candidate : families) {
      boolean merged = false;
      for (int i = 0; i < acc.size(); i++) {
        Optional<MinimizedFamily> combined = mergeInto(acc.get(i), candidate);
        if (combined.isPresent()) {
          acc.remove(i);
          acc.add(combined.get());
          merged = true;
          break;
        }
      }
      if (!merged) {
        acc.add(new MinimizedFamily(candidate, List.of(candidate), KeyOrders.solve(candidate, List.of(candidate))
            .orElseThrow(() -> new IllegalStateException("No key order for " + candidate))));
      }
    }
    return acc;
  }

  private Optional<MinimizedFamily> mergeInto(MinimizedFamily current, IndexFamily candidate) {
    Optional<IndexFamily> refined = refine(current.family(), candidate);
    if (refined.isEmpty()) return Optional.empty();

    List<IndexFamily> sources = new ArrayList<>(current.sources());
    sources.add(candidate);
    Optional<List<String>> order = KeyOrders.solve(refined.get(), sources);
    if (order.isEmpty()) {
      log.debug("vigil.minimize rejected merge={} sources={}", refined.get(), sources);
      return Optional.empty();
    }
    return Optional.of(new MinimizedFamily(refined.get(), sources, order.get()));
  }

  static Optional<IndexFamily> refine(IndexFamily left, IndexFamily right) {
    int prefixLen = Math.min(left.fixed().size(), right.fixed().size());
    if (prefixLen > 0) {
      List<String> prefix = left.fixed().subList(0, prefixLen);
      if (!prefix.equals(right.fixed().subList(0, prefixLen))) return Optional.empty();
      return refine(withoutPrefix(left, prefixLen), withoutPrefix(right, prefixLen))
          .map(out -> withPrefix(out, prefix));
    }
    if (right.fixed().isEmpty()) return refineFirstHasNoFixed(right, left);
    return refineFirstHasNoFixed(left, right);
  }

  /** {@code a} has no fixed columns. The result always starts from {@code b}. */
  private static Optional<IndexFamily> refineFirstHasNoFixed(IndexFamily a, IndexFamily b) {
    Set<String> aAll = a.allIndexedValues();
    Set<String> bAll = b.allIndexedValues();
    IndexFamily.Builder out = b.toBuilder();

    if (a.size() > b.size()) {
      if (!aAll.containsAll(bAll)) return Optional.empty();
      if (b.hasLast()) {
        if (b.last().equals(a.last())) return Optional.empty();
        out.addFixed(b.flex()).addFixed(List.of(b.last()));
      }
      Set<String> flex = new TreeSet<>(a.flex());
      flex.removeAll(out.fixed());
      out.clearFlex().addFlex(flex).last(a.last());
      return finish(out, a);
    }

    if (a.size() == b.size()) {
      if (!aAll.equals(bAll)) return Optional.empty();
      if (b.hasLast()) {
        if (a.hasLast() && !a.last().equals(b.last())) return Optional.empty();
        return finish(out, a);
      }
      if (!a.hasLast()) return finish(out, a);
      if (b.flex().isEmpty()) {
        List<String> fixed = b.fixed();
        if (!a.last().equals(fixed.get(fixed.size() - 1))) return Optional.empty();
        return finish(out, a);
      }
      if (!b.flex().contains(a.last())) return Optional.empty();
      return finish(out.last(a.last()), a);
    }

    // a.size() < b.size()
    if (!bAll.containsAll(aAll)) return Optional.empty();
    if (a.size() <= b.fixed().size()) {
      List<String> head = b.fixed().subList(0, a.size());
      if (!a.hasLast()) {
        if (!a.flex().equals(new TreeSet<>(head))) return Optional.empty();
        return finish(out.removeFlex(head), a);
      }
      if (!head.get(head.size() - 1).equals(a.last())) return Optional.empty();
      return finish(out, a);
    }
    if (!a.flex().containsAll(b.fixed())) return Optional.empty();
    if (!a.hasLast()) return finish(out, a);
    if (!b.flex().contains(a.last())) return Optional.empty();

    Set<String> shared = new TreeSet<>(b.flex());
    shared.retainAll(a.flex());
    out.addFixed(shared).addFixed(List.of(a.last()));
    Set<String> flex = new TreeSet<>(b.flex());
    flex.removeAll(out.fixed());
    out.clearFlex().addFlex(flex);
    return finish(out, a);
  }

  private static Optional<IndexFamily> finish(IndexFamily.Builder out, IndexFamily other) {
    out.addIncluded(other.included());
    return out.isWellFormed() ? Optional.of(out.build()) : Optional.empty();
  }

  private static IndexFamily withoutPrefix(IndexFamily f, int len) {
    List<String> rest = new ArrayList<>(f.fixed().subList(len, f.fixed().size()));
    return f.toBuilder().clearFixed().addFixed(rest).build();
  }

  private static IndexFamily withPrefix(IndexFamily f, List<String> prefix) {
    List<String> fixed = new ArrayList<>(prefix);
    fixed.addAll(f.fixed());
    return f.toBuilder().clearFixed().addFixed(fixed).build();
  }
}
