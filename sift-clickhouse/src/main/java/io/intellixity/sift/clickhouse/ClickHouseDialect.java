package io.intellixity.sift.clickhouse;

import io.intellixity.sift.chart.ChartConfig;
import io.intellixity.sift.clickhouse.render.ChartConfigRenderer;
import io.intellixity.sift.clickhouse.search.ClickHouseSearchSerializer;
import io.intellixity.sift.metadata.MetadataSource;
import io.intellixity.sift.spi.search.SearchTarget;
import io.intellixity.sift.spi.sql.Dialect;
import io.intellixity.sift.sql.ParameterizedSql;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/** ClickHouse dialect; options come from {@code sift.clickhouse.*} system properties unless given. */
public final class ClickHouseDialect implements Dialect {
  public static final String ID = "clickhouse";

  private final ClickHouseDialectOptions options;

  public ClickHouseDialect() {
    this(ClickHouseDialectOptions.fromProperties(System.getProperties()));
  }

  public ClickHouseDialect(ClickHouseDialectOptions options) {
    this.options = Objects.requireNonNull(options, "options");
  }

  public ClickHouseDialectOptions options() { return options; }

  @Override
  public String id() { return ID; }

  @Override
  public CompletableFuture<String> renderSearch(String query, SearchTarget target, MetadataSource metadata) {
    return new ClickHouseSearchSerializer(target, metadata, options).serialize(query);
  }

  @Override
  public CompletableFuture<ParameterizedSql> renderChart(ChartConfig config, MetadataSource metadata) {
    return new ChartConfigRenderer(metadata, options).render(config);
  }
}
