package io.intellixity.vigil.jdbc.dialect;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/** Identifier rendering shared by index dialects. */
public abstract class AbstractIndexDialect implements IndexDialect {

  protected abstract String quoteIdent(String ident);

  protected String qualified(String schema, String name) {
    Objects.requireNonNull(name, "name");
    return schema == null ? quoteIdent(name) : quoteIdent(schema) + "." + quoteIdent(name);
  }

  protected String columnList(List<String> columns, Function<String, String> render) {
    StringBuilder sb = new StringBuilder();
    for (String c : columns) {
      if (sb.length() > 0) sb.append(", ");
      sb.append(render.apply(c));
    }
    return sb.toString();
  }
}
