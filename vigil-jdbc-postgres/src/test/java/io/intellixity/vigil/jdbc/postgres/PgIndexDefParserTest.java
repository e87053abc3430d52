package io.intellixity.vigil.jdbc.postgres;

import io.intellixity.vigil.jdbc.dialect.IndexDefinition;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class PgIndexDefParserTest {

  @Test
  void parsesAdvisorIndex() {
    IndexDefinition def = PgIndexDefParser.parse(
        "CREATE INDEX idx_transactions_account_id_5f2c ON org_1.transactions USING btree (account_id DESC, created_at DESC)"
            + " INCLUDE (amount, currency) WHERE (valid_until = 'infinity'::timestamp with time zone)");
    assertEquals(List.of("account_id", "created_at"), def.indexed());
    assertEquals(List.of("amount", "currency"), def.included());
  }

  @Test
  void parsesPlainUniqueIndex() {
    IndexDefinition def = PgIndexDefParser.parse("CREATE UNIQUE INDEX transactions_pkey ON public.transactions USING btree (id)");
    assertEquals(List.of("id"), def.indexed());
    assertTrue(def.included().isEmpty());
  }

  @Test
  void dropsSortOptions() {
    IndexDefinition def = PgIndexDefParser.parse("CREATE INDEX i ON s.t USING btree (a ASC NULLS FIRST, b DESC NULLS LAST, c)");
    assertEquals(List.of("a", "b", "c"), def.indexed());
  }

  @Test
  void unquotesIdentifiers() {
    IndexDefinition def = PgIndexDefParser.parse(
        "CREATE INDEX \"Odd Name\" ON s.\"T\" USING btree (\"Account Id\" DESC, \"a\"\"b\", \"x,y\") INCLUDE (\"Amount\")");
    assertEquals(List.of("Account Id", "a\"b", "x,y"), def.indexed());
    assertEquals(List.of("Amount"), def.included());
  }

  @Test
  void keepsExpressionKeysVerbatim() {
    IndexDefinition def = PgIndexDefParser.parse("CREATE INDEX i ON s.t USING btree (lower(name), (a + b) DESC)");
    assertEquals(List.of("lower(name)", "(a + b)"), def.indexed());
  }

  @Test
  void includeInsideWhereIsNotMistakenForColumns() {
    IndexDefinition def = PgIndexDefParser.parse("CREATE INDEX i ON s.t USING btree (a) WHERE (kind = 'include')");
    assertEquals(List.of("a"), def.indexed());
    assertTrue(def.included().isEmpty());
  }

  @Test
  void blankDefinitionIsEmpty() {
    IndexDefinition def = PgIndexDefParser.parse("  ");
    assertTrue(def.indexed().isEmpty());
  }

  @Test
  void malformedDefinitionFails() {
    assertThrows(IllegalArgumentException.class, () -> PgIndexDefParser.parse("CREATE INDEX i ON s.t USING btree (a, b"));
    assertThrows(IllegalArgumentException.class, () -> PgIndexDefParser.parse("CREATE INDEX i ON s.t"));
  }
}
