package io.intellixity.vigil.governance;

import java.util.Objects;
import java.util.function.Supplier;

/** Thread-bound governance context utilities. */
public final class Governance {
  private Governance() {}

  private static final ThreadLocal<GovernanceContext> CTX = new ThreadLocal<>();

  /** Execute work within a governance context boundary; the previous binding is restored afterwards. */
  public static <T> T inContext(GovernanceContext ctx, Supplier<T> work) {
    Objects.requireNonNull(ctx, "ctx");
    Objects.requireNonNull(work, "work");
    GovernanceContext previous = CTX.get();
    CTX.set(ctx);
    try {
      return work.get();
    } finally {
      if (previous == null) CTX.remove();
      else CTX.set(previous);
    }
  }

  public static void inContext(GovernanceContext ctx, Runnable work) {
    Objects.requireNonNull(work, "work");
    inContext(ctx, () -> {
      work.run();
      return null;
    });
  }

  public static GovernanceContext currentOrNull() {
    return CTX.get();
  }

  public static GovernanceContext currentOrThrow() {
    GovernanceContext c = currentOrNull();
    if (c == null) throw new IllegalStateException("No GovernanceContext bound to current thread");
    return c;
  }
}
