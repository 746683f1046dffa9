package io.intellixity.sift.chart;

import io.intellixity.sift.sql.ParameterizedSql;

import java.util.Objects;

/**
 * Named CTE backed by either prepared SQL or a nested chart config (exactly one of the two).
 * A non-subquery CTE renders as {@code (sql) AS name}, i.e. a scalar WITH expression.
 */
public record CteDefinition(String name, ParameterizedSql sql, ChartConfig chartConfig, boolean subquery) {
  public CteDefinition {
    Objects.requireNonNull(name, "name");
    if ((sql == null) == (chartConfig == null)) {
      throw new ChartConfigException("CTE '" + name + "' must define exactly one of sql or chartConfig");
    }
  }

  public static CteDefinition ofSql(String name, ParameterizedSql sql) {
    return new CteDefinition(name, sql, null, true);
  }

  public static CteDefinition ofChart(String name, ChartConfig chartConfig) {
    return new CteDefinition(name, null, chartConfig, true);
  }
}
