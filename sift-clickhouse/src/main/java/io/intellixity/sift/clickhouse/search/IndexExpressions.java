package io.intellixity.sift.clickhouse.search;

/**
 * Textual matching of skip index expressions against column expressions.
 * <p>
 * Matching ignores backticks and whitespace and is otherwise exact and case-sensitive: an index over any
 * other expression, even one that reads the column, does not match.
 */
public final class IndexExpressions {
  private IndexExpressions() {}

  /** True for {@code tokens(column)} and {@code tokens(lower(column))}. */
  public static boolean isTokensIndexOn(String indexExpression, String column) {
    String c = normalize(column);
    if (c.isEmpty()) return false;
    String index = normalize(indexExpression);
    return index.equals("tokens(" + c + ")") || index.equals("tokens(lower(" + c + "))");
  }

  /** True for {@code column} and {@code lower(column)}. */
  public static boolean isTextIndexOn(String indexExpression, String column) {
    String c = normalize(column);
    if (c.isEmpty()) return false;
    String index = normalize(indexExpression);
    return index.equals(c) || index.equals("lower(" + c + ")");
  }

  public static boolean appliesLower(String indexExpression) {
    return normalize(indexExpression).contains("lower(");
  }

  static String normalize(String expression) {
    if (expression == null) return "";
    StringBuilder sb = new StringBuilder(expression.length());
    for (int i = 0; i < expression.length(); i++) {
      char c = expression.charAt(i);
      if (c != '`' && !Character.isWhitespace(c)) sb.append(c);
    }
    return sb.toString();
  }
}
