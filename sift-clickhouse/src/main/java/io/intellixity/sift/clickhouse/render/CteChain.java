package io.intellixity.sift.clickhouse.render;

import io.intellixity.sift.chart.ChartConfigException;
import io.intellixity.sift.chart.ChartSource;
import io.intellixity.sift.chart.CteDefinition;
import io.intellixity.sift.sql.ParameterizedSql;

import java.util.*;

/** Ordered WITH clause. Names are unique; bodies render in declaration order. */
public final class CteChain {
  private final Map<String, Entry> ctes = new LinkedHashMap<>();

  private record Entry(String name, ParameterizedSql body, boolean subquery) {}

  /**
   * Rejects duplicate names and, when CTEs are declared, a database-less FROM that names none of them.
   */
  public static void validate(List<CteDefinition> with, ChartSource from) {
    Set<String> names = new HashSet<>();
    for (CteDefinition cte : with) {
      if (!names.add(cte.name())) throw new ChartConfigException("Duplicate CTE name: " + cte.name());
    }
    if (!with.isEmpty() && from.databaseName().isEmpty() && !names.contains(from.tableName())) {
      throw new ChartConfigException("FROM references undeclared CTE: " + from.tableName());
    }
  }

  public CteChain add(String name, ParameterizedSql body, boolean subquery) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(body, "body");
    if (ctes.containsKey(name)) throw new ChartConfigException("Duplicate CTE name: " + name);
    ctes.put(name, new Entry(name, body, subquery));
    return this;
  }

  public boolean declares(String name) { return ctes.containsKey(name); }

  public boolean isEmpty() { return ctes.isEmpty(); }

  /** {@code name AS (body)} for subqueries, {@code (body) AS name} for WITH expressions. */
  public ParameterizedSql render() {
    List<ParameterizedSql> parts = new ArrayList<>(ctes.size());
    for (Entry e : ctes.values()) {
      parts.add(e.subquery()
          ? ParameterizedSql.of(e.name(), " AS (", e.body(), ")")
          : ParameterizedSql.of("(", e.body(), ") AS ", e.name()));
    }
    return ParameterizedSql.join(", ", parts);
  }
}
