package io.intellixity.sift.clickhouse.render;

import io.intellixity.sift.chart.ChartConfigException;

import java.math.BigDecimal;

/** Aggregate call for one select item, with the {@code -If} combinator when the item has a condition. */
final class AggregateExpressions {
  private AggregateExpressions() {}

  static String render(String fn, String expr, Double level, String condition) {
    boolean conditional = condition != null && !condition.isBlank();
    boolean raw = fn.equals("any") || fn.equals("none");
    String value = raw ? expr : "toFloat64OrDefault(toString(" + expr + "))";
    String guardedCondition = condition + " AND " + value + " IS NOT NULL";

    if (fn.endsWith("Merge")) {
      String levelArg = level != null && (fn.startsWith("quantile") || fn.startsWith("histogram"))
          ? "(" + formatLevel(level) + ")" : "";
      String args = expr == null ? "" : expr;
      return conditional
          ? fn + "If" + levelArg + "(" + args + ", " + guardedCondition + ")"
          : fn + levelArg + "(" + args + ")";
    }
    if (fn.endsWith("State")) {
      if (expr == null || fn.startsWith("count")) return conditional ? fn + "(" + condition + ")" : fn + "()";
      return fn + "(" + value + (conditional ? ", " + guardedCondition : "") + ")";
    }
    if (fn.equals("count")) return conditional ? "countIf(" + condition + ")" : "count()";
    if (fn.equals("none")) return expr == null ? "" : expr;
    if (expr == null || expr.isBlank()) {
      throw new ChartConfigException("Column is required for all non-count aggregation functions");
    }
    if (fn.equals("count_distinct")) {
      return "count" + (conditional ? "If" : "") + "(DISTINCT " + expr + (conditional ? ", " + condition : "") + ")";
    }
    String suffix = conditional ? "If" : "";
    String args = "(" + value + (conditional ? ", " + guardedCondition : "") + ")";
    if (level != null) return fn + suffix + "(" + formatLevel(level) + ")" + args;
    return fn + suffix + args;
  }

  /** Non-finite levels become {@code 0}. */
  static String formatLevel(Double level) {
    if (level == null || level.isNaN() || level.isInfinite()) return "0";
    return BigDecimal.valueOf(level).stripTrailingZeros().toPlainString();
  }
}
