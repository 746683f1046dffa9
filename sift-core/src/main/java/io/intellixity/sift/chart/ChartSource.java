package io.intellixity.sift.chart;

import java.util.Objects;

/** FROM target. An empty database name refers to a CTE declared in the same statement. */
public record ChartSource(String databaseName, String tableName) {
  public ChartSource {
    databaseName = databaseName == null ? "" : databaseName;
    tableName = Objects.requireNonNull(tableName, "tableName");
  }

  public static ChartSource cte(String name) { return new ChartSource("", name); }
}
