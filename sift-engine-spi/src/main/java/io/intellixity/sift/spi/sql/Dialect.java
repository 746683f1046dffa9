package io.intellixity.sift.spi.sql;

import io.intellixity.sift.chart.ChartConfig;
import io.intellixity.sift.metadata.MetadataSource;
import io.intellixity.sift.spi.search.SearchTarget;
import io.intellixity.sift.sql.ParameterizedSql;

import java.util.concurrent.CompletableFuture;

/** Compiles search queries and chart configs for one SQL engine. */
public interface Dialect {
  String id();

  /** WHERE fragment for {@code query}; empty when the query is blank. */
  CompletableFuture<String> renderSearch(String query, SearchTarget target, MetadataSource metadata);

  CompletableFuture<ParameterizedSql> renderChart(ChartConfig config, MetadataSource metadata);
}
