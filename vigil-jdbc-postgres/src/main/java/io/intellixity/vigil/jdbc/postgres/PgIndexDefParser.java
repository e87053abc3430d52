package io.intellixity.vigil.jdbc.postgres;

import io.intellixity.vigil.jdbc.dialect.IndexDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads key and INCLUDE columns out of {@code pg_get_indexdef} output, e.g.\n
 * {@code CREATE INDEX i ON s.t USING btree (a DESC, "B c") INCLUDE (d) WHERE (...)}\n
 *
 * Sort options are dropped, quoted identifiers are unquoted, expression keys are kept verbatim.\n
 */
final class PgIndexDefParser {
  private PgIndexDefParser() {}

  static IndexDefinition parse(String def) {
    if (def == null || def.isBlank()) return new IndexDefinition(List.of(), List.of());

    int using = indexOfKeyword(def, "USING", 0);
    int keysOpen = def.indexOf('(', using < 0 ? 0 : using);
    if (keysOpen < 0) throw new IllegalArgumentException("Unparseable index definition: " + def);
    int keysClose = matchingParen(def, keysOpen);
    List<String> indexed = columns(def.substring(keysOpen + 1, keysClose));

    List<String> included = List.of();
    int include = indexOfKeyword(def, "INCLUDE", keysClose + 1);
    if (include >= 0) {
      int open = def.indexOf('(', include);
      int close = matchingParen(def, open);
      included = columns(def.substring(open + 1, close));
    }
    return new IndexDefinition(indexed, included);
  }

  private static List<String> columns(String list) {
    List<String> out = new ArrayList<>();
    for (String element : splitTopLevel(list)) {
      String col = column(element.trim());
      if (!col.isEmpty()) out.add(col);
    }
    return out;
  }

  private static String column(String element) {
    if (element.startsWith("\"")) {
      StringBuilder sb = new StringBuilder();
      for (int i = 1; i < element.length(); i++) {
        char ch = element.charAt(i);
        if (ch == '"') {
          if (i + 1 < element.length() && element.charAt(i + 1) == '"') {
            sb.append('"');
            i++;
          } else {
            return sb.toString();
          }
        } else {
          sb.append(ch);
        }
      }
      throw new IllegalArgumentException("Unterminated identifier: " + element);
    }
    if (element.startsWith("(")) return element.substring(0, matchingParen(element, 0) + 1);
    int end = 0;
    int depth = 0;
    while (end < element.length()) {
      char ch = element.charAt(end);
      if (ch == '(') depth++;
      else if (ch == ')') depth--;
      else if (Character.isWhitespace(ch) && depth == 0) break;
      end++;
    }
    return element.substring(0, end);
  }

  private static List<String> splitTopLevel(String s) {
    List<String> parts = new ArrayList<>();
    int depth = 0;
    boolean quoted = false;
    int start = 0;
    for (int i = 0; i < s.length(); i++) {
      char ch = s.charAt(i);
      if (ch == '"') quoted = !quoted;
      else if (!quoted && ch == '(') depth++;
      else if (!quoted && ch == ')') depth--;
      else if (!quoted && depth == 0 && ch == ',') {
        parts.add(s.substring(start, i));
        start = i + 1;
      }
    }
    parts.add(s.substring(start));
    return parts;
  }

  private static int matchingParen(String s, int open) {
    if (open < 0) throw new IllegalArgumentException("Unparseable index definition: " + s);
    int depth = 0;
    boolean quoted = false;
    for (int i = open; i < s.length(); i++) {
      char ch = s.charAt(i);
      if (ch == '"') quoted = !quoted;
      else if (!quoted && ch == '(') depth++;
      else if (!quoted && ch == ')' && --depth == 0) return i;
    }
    throw new IllegalArgumentException("Unbalanced parentheses in index definition: " + s);
  }

  /** Position of {@code kw} as a whole word outside quotes, or -1. */
  private static int indexOfKeyword(String s, String kw, int from) {
    String upper = s.toUpperCase(Locale.ROOT);
    boolean quoted = false;
    int depth = 0;
    for (int i = 0; i < s.length(); i++) {
      char ch = s.charAt(i);
      if (ch == '"') quoted = !quoted;
      if (quoted) continue;
      if (ch == '(') depth++;
      else if (ch == ')') depth--;
      if (i >= from && depth == 0 && upper.startsWith(kw, i)
          && (i == 0 || Character.isWhitespace(s.charAt(i - 1)))
          && (i + kw.length() == s.length() || !Character.isLetterOrDigit(s.charAt(i + kw.length())))) {
        return i;
      }
    }
    return -1;
  }
}
