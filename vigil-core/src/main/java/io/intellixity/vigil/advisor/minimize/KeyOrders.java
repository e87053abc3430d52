package io.intellixity.vigil.advisor.minimize;

import io.intellixity.vigil.advisor.model.IndexFamily;
import io.intellixity.vigil.advisor.model.Identifiers;

import java.util.*;

/**
 * Picks a physical key order for a family such that the resulting index covers each of a set of
 * served families.\n
 *
 * Every served family restricts the columns allowed at each key position (its fixed column, one
 * of its flex columns, its last column). The family's fixed and last positions are checked
 * against those restrictions; flex columns are assigned by backtracking in sorted order, so the
 * answer is the lexicographically smallest valid order and equals {@code sorted(flex)} when
 * nothing constrains it.\n
 */
final class KeyOrders {
  private KeyOrders() {}

  static Optional<List<String>> solve(IndexFamily family, Collection<IndexFamily> served) {
    int n = family.size();
    List<Set<String>> allowed = new ArrayList<>(Collections.nCopies(n, null));

    Set<String> stored = Identifiers.normalizeToSet(family.allIndexedValues());
    stored.addAll(Identifiers.normalizeToSet(family.included()));

    for (IndexFamily s : served) {
      if (!Identifiers.same(s.tableName(), family.tableName()) || s.size() > n) return Optional.empty();
      if (!stored.containsAll(Identifiers.normalizeToSet(s.included()))) return Optional.empty();
      int p = 0;
      for (String c : s.fixed()) restrict(allowed, p++, Set.of(Identifiers.normalize(c)));
      Set<String> flex = Identifiers.normalizeToSet(s.flex());
      for (int i = 0; i < flex.size(); i++) restrict(allowed, p++, flex);
      if (s.hasLast()) restrict(allowed, p, Set.of(Identifiers.normalize(s.last())));
    }

    List<String> order = new ArrayList<>(n);
    for (String c : family.fixed()) {
      if (!permits(allowed, order.size(), c)) return Optional.empty();
      order.add(c);
    }
    List<String> flex = new ArrayList<>(family.flex());
    if (!assignFlex(flex, new boolean[flex.size()], order.size() + flex.size(), allowed, order)) {
      return Optional.empty();
    }
    if (family.hasLast()) {
      if (!permits(allowed, order.size(), family.last())) return Optional.empty();
      order.add(family.last());
    }
    return Optional.of(List.copyOf(order));
  }

  private static void restrict(List<Set<String>> allowed, int pos, Set<String> columns) {
    Set<String> current = allowed.get(pos);
    if (current == null) allowed.set(pos, new HashSet<>(columns));
    else current.retainAll(columns);
  }

  private static boolean permits(List<Set<String>> allowed, int pos, String column) {
    Set<String> a = allowed.get(pos);
    return a == null || a.contains(Identifiers.normalize(column));
  }

  private static boolean assignFlex(List<String> flex, boolean[] used, int end,
                                    List<Set<String>> allowed, List<String> order) {
    if (order.size() == end) return true;
    int pos = order.size();
    for (int i = 0; i < flex.size(); i++) {
      if (used[i] || !permits(allowed, pos, flex.get(i))) continue;
      used[i] = true;
      order.add(flex.get(i));
      if (assignFlex(flex, used, end, allowed, order)) return true;
      used[i] = false;
      order.remove(order.size() - 1);
    }
    return false;
  }
}
