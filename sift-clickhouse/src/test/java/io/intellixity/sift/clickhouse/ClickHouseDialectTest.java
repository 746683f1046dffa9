package io.intellixity.sift.clickhouse;

import io.intellixity.sift.chart.ChartConfig;
import io.intellixity.sift.chart.SelectItem;
import io.intellixity.sift.metadata.TableRef;
import io.intellixity.sift.spi.exec.Futures;
import io.intellixity.sift.spi.search.SearchTarget;
import io.intellixity.sift.spi.sql.Dialect;
import io.intellixity.sift.spi.sql.Dialects;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

final class ClickHouseDialectTest {
  private final InMemoryMetadataSource metadata = new InMemoryMetadataSource()
      .column("Body", "String")
      .column("ServiceName", "LowCardinality(String)");

  @Test
  void registeredThroughFactories() {
    Dialect dialect = Dialects.byId("ClickHouse");
    assertInstanceOf(ClickHouseDialect.class, dialect);
    assertEquals(ClickHouseDialect.ID, dialect.id());
    assertThrows(IllegalArgumentException.class, () -> Dialects.byId("postgres"));
  }

  @Test
  void rendersSearchAndCharts() {
    Dialect dialect = new ClickHouseDialect(ClickHouseDialectOptions.defaults());
    SearchTarget target = new SearchTarget(new TableRef("default", "otel_logs", null), "Body");
    assertEquals("(ServiceName = 'api')",
        Futures.await(dialect.renderSearch("ServiceName:\"api\"", target, metadata)));
    assertEquals("", Futures.await(dialect.renderSearch(" ", target, metadata)));

    ChartConfig config = ChartConfig.builder()
        .from("default", "otel_logs")
        .select(SelectItem.of("count", null))
        .build();
    assertEquals("SELECT count() FROM `default`.`otel_logs`",
        Futures.await(dialect.renderChart(config, metadata)).toInlineSql());
  }

  @Test
  void optionsFromProperties() {
    Properties props = new Properties();
    props.setProperty(ClickHouseDialectOptions.MAX_TOKENS_PER_CALL, " 10 ");
    props.setProperty(ClickHouseDialectOptions.TEXT_INDEX_SETTING, "allow_text_index");
    ClickHouseDialectOptions options = ClickHouseDialectOptions.fromProperties(props);
    assertEquals(10, options.maxTokensPerCall());
    assertEquals("allow_text_index", options.textIndexSetting());
    assertEquals(60, options.autoGranularityBuckets());

    props.setProperty(ClickHouseDialectOptions.AUTO_GRANULARITY_BUCKETS, "many");
    assertThrows(IllegalArgumentException.class, () -> ClickHouseDialectOptions.fromProperties(props));
    props.setProperty(ClickHouseDialectOptions.AUTO_GRANULARITY_BUCKETS, "0");
    assertThrows(IllegalArgumentException.class, () -> ClickHouseDialectOptions.fromProperties(props));
  }
}
