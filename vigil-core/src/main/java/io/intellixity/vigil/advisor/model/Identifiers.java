package io.intellixity.vigil.advisor.model;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Table and column names are case-insensitive: the catalog reports unquoted identifiers
 * lower-cased while rules may spell them differently.\n
 */
public final class Identifiers {
  private Identifiers() {}

  public static String normalize(String ident) {
    return ident == null ? null : ident.toUpperCase(Locale.ROOT);
  }

  public static List<String> normalize(List<String> idents) {
    return idents.stream().map(Identifiers::normalize).toList();
  }

  public static Set<String> normalizeToSet(Collection<String> idents) {
    Set<String> out = new TreeSet<>();
    for (String s : idents) out.add(normalize(s));
    return out;
  }

  /**
   * Key fragment for a column list, {@code [a, b]}. Commas, brackets and backslashes inside a name
   * are backslash-escaped, so one column {@code "a, b"} never reads like the two columns a and b.\n
   */
  public static String keyOf(Collection<String> idents) {
    StringBuilder sb = new StringBuilder("[");
    boolean first = true;
    for (String s : idents) {
      if (!first) sb.append(", ");
      first = false;
      appendEscaped(sb, s);
    }
    return sb.append(']').toString();
  }

  /** Key fragment for a single name; null gives an empty fragment. */
  public static String keyOf(String ident) {
    if (ident == null) return "";
    StringBuilder sb = new StringBuilder();
    appendEscaped(sb, ident);
    return sb.toString();
  }

  private static void appendEscaped(StringBuilder sb, String s) {
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == '\\' || c == ',' || c == '[' || c == ']') sb.append('\\');
      sb.append(c);
    }
  }

  public static boolean same(String a, String b) {
    if (a == null || b == null) return a == b;
    return a.equalsIgnoreCase(b);
  }
}
