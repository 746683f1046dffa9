package io.intellixity.sift.sql;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/** Literal and identifier quoting for ClickHouse SQL text. */
public final class SqlStrings {
  private static final Pattern NUMBER = Pattern.compile("-?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

  private SqlStrings() {}

  /** Single-quoted string literal with backslash escaping. */
  public static String quote(String value) {
    String v = value == null ? "" : value;
    StringBuilder sb = new StringBuilder(v.length() + 2).append('\'');
    for (int i = 0; i < v.length(); i++) {
      char c = v.charAt(i);
      switch (c) {
        case '\\' -> sb.append("\\\\");
        case '\'' -> sb.append("\\'");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        case '\0' -> sb.append("\\0");
        default -> sb.append(c);
      }
    }
    return sb.append('\'').toString();
  }

  /** Backtick-quoted identifier; the name is not split on dots. */
  public static String quoteIdentifier(String name) {
    return "`" + name.replace("`", "``") + "`";
  }

  /** Double-quoted identifier for column aliases, with backslash escaping. */
  public static String quoteAlias(String alias) {
    return "\"" + alias.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
  }

  /** Quotes every dot-separated segment: {@code a.b} becomes {@code `a`.`b`}. */
  public static String quotePath(List<String> segments) {
    List<String> out = new ArrayList<>(segments.size());
    for (String s : segments) out.add(quoteIdentifier(s));
    return String.join(".", out);
  }

  /** Numeric-looking values render bare, anything else as a quoted literal. */
  public static String numberOrQuoted(String value) {
    if (value != null && NUMBER.matcher(value.trim()).matches()) return value.trim();
    return quote(value);
  }

  /**
   * Splits a comma-separated expression list at top level, ignoring commas nested in brackets or
   * quotes. Parts are trimmed; empty parts are dropped.
   */
  public static List<String> splitTopLevel(String input) {
    List<String> out = new ArrayList<>();
    if (input == null) return out;
    StringBuilder cur = new StringBuilder();
    int depth = 0;
    char quote = 0;
    for (int i = 0; i < input.length(); i++) {
      char c = input.charAt(i);
      if (quote != 0) {
        cur.append(c);
        if (c == '\\' && i + 1 < input.length()) {
          cur.append(input.charAt(++i));
        } else if (c == quote) {
          quote = 0;
        }
        continue;
      }
      if (c == '\'' || c == '"' || c == '`') {
        quote = c;
      } else if (c == '(' || c == '[' || c == '{') {
        depth++;
      } else if (c == ')' || c == ']' || c == '}') {
        depth--;
      } else if (c == ',' && depth == 0) {
        addTrimmed(out, cur);
        cur.setLength(0);
        continue;
      }
      cur.append(c);
    }
    addTrimmed(out, cur);
    return out;
  }

  private static void addTrimmed(List<String> out, StringBuilder part) {
    String s = part.toString().trim();
    if (!s.isEmpty()) out.add(s);
  }
}
