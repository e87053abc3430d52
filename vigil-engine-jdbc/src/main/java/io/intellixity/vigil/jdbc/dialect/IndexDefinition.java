package io.intellixity.vigil.jdbc.dialect;

import java.util.List;

/** Key and INCLUDE columns read back from a catalog index definition. */
public record IndexDefinition(List<String> indexed, List<String> included) {
  public IndexDefinition {
    indexed = indexed == null ? List.of() : List.copyOf(indexed);
    included = included == null ? List.of() : List.copyOf(included);
  }
}
