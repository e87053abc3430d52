package io.intellixity.vigil.governance;

import java.util.Locale;

public enum Role {
  ADMIN,
  BUILDER,
  PUBLISHER,
  VIEWER;

  /** Roles allowed to publish scenarios and change the data model indexes. */
  public boolean canWriteIndexes() {
    return this == ADMIN || this == BUILDER;
  }

  public static Role parse(String s) {
    if (s == null || s.isBlank()) throw new IllegalArgumentException("role is required");
    try {
      return Role.valueOf(s.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown role '" + s + "'", e);
    }
  }
}
