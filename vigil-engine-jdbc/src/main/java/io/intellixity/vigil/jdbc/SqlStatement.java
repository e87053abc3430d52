package io.intellixity.vigil.jdbc;

import java.util.List;

public record SqlStatement(String sql, List<Object> binds, ExecKind execKind) {
  public enum ExecKind {
    /** Execute via PreparedStatement.executeQuery(). */
    QUERY,
    /** Execute via Statement.execute() outside any transaction (DDL). */
    UPDATE
  }

  public SqlStatement {
    binds = binds == null ? List.of() : List.copyOf(binds);
    execKind = (execKind == null) ? ExecKind.QUERY : execKind;
  }

  public SqlStatement(String sql, List<Object> binds) {
    this(sql, binds, ExecKind.QUERY);
  }

  public static SqlStatement ddl(String sql) {
    return new SqlStatement(sql, List.of(), ExecKind.UPDATE);
  }
}
