package io.intellixity.vigil.advisor.model;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Physical index naming.\n
 *
 * Names are {@code <prefix>_<table>_<col1-col2-...>} cut to 53 characters, then a random suffix,
 * cut again to the 63 characters Postgres keeps for an identifier. The suffix avoids clashing
 * with an invalid leftover of an earlier attempt.\n
 */
public final class IndexNames {
  public static final int MAX_IDENTIFIER_LENGTH = 63;
  public static final int MAX_LENGTH_BEFORE_SUFFIX = 53;

  private IndexNames() {}

  public static String generate(ConcreteIndex index, UUID suffix) {
    String base = index.type().namePrefix() + "_" + index.tableName() + "_" + String.join("-", index.indexed());
    base = base.substring(0, Math.min(base.length(), MAX_LENGTH_BEFORE_SUFFIX));
    String out = base + "_" + suffix;
    return out.substring(0, Math.min(out.length(), MAX_IDENTIFIER_LENGTH));
  }

  /** Name the index if it has no name yet. */
  public static ConcreteIndex ensureNamed(ConcreteIndex index, Supplier<UUID> ids) {
    if (index.name() != null) return index;
    return index.withName(generate(index, ids.get()));
  }

  /** Give the index a fresh name, replacing any previous one. */
  public static ConcreteIndex rename(ConcreteIndex index, Supplier<UUID> ids) {
    return index.withName(generate(index, ids.get()));
  }
}
