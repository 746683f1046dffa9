package io.intellixity.sift.clickhouse.metrics;

import io.intellixity.sift.chart.*;
import io.intellixity.sift.clickhouse.ClickHouseDialectOptions;
import io.intellixity.sift.clickhouse.InMemoryMetadataSource;
import io.intellixity.sift.clickhouse.render.ChartConfigRenderer;
import io.intellixity.sift.spi.exec.Futures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class MetricChartTranslatorTest {
  private static final MetricTables TABLES =
      new MetricTables("otel_metrics_gauge", "otel_metrics_sum", "otel_metrics_histogram");
  private static final String BUCKET = "toStartOfInterval(toDateTime(TimeUnix), INTERVAL 1 minute) AS `__hdx_time_bucket`";
  private static final String WIDENED_RANGE =
      "(TimeUnix >= toStartOfInterval(fromUnixTimestamp64Milli(1000), INTERVAL 1 minute) - INTERVAL 1 minute"
          + " AND TimeUnix <= toStartOfInterval(fromUnixTimestamp64Milli(2000), INTERVAL 1 minute) + INTERVAL 1 minute)";

  private static ChartConfig.Builder metrics(SelectItem... items) {
    return ChartConfig.builder()
        .from("default", "")
        .metricTables(TABLES)
        .select(items)
        .granularity("1 minute")
        .dateRange(DateRange.ofEpochMillis(1000, 2000))
        .fillGaps(false);
  }

  private static String render(ChartConfig config) {
    InMemoryMetadataSource metadata = new InMemoryMetadataSource().column("TimeUnix", "DateTime64(9)");
    return Futures.await(new ChartConfigRenderer(metadata, ClickHouseDialectOptions.defaults()).render(config))
        .toInlineSql();
  }

  private static SelectItem metric(String fn, MetricType type, String name) {
    return SelectItem.of(fn, null).withMetric(type, name);
  }

  @Test
  void gaugeAggregatesValueOfTheNamedMetric() {
    assertEquals("SELECT avg(toFloat64OrDefault(toString(Value))), " + BUCKET
            + " FROM `default`.`otel_metrics_gauge`"
            + " WHERE (TimeUnix >= fromUnixTimestamp64Milli(1000) AND TimeUnix <= fromUnixTimestamp64Milli(2000))"
            + " AND ((MetricName = 'cpu'))"
            + " GROUP BY " + BUCKET
            + " ORDER BY " + BUCKET,
        render(metrics(metric("avg", MetricType.GAUGE, "cpu")).build()));
  }

  @Test
  void sumConvertsCumulativeValuesToRates() {
    String sql = render(metrics(metric("sum", MetricType.SUM, "requests")).where("ServiceName = 'api'").build());
    assertTrue(sql.startsWith("WITH RawSum AS (SELECT *, "
        + "cityHash64(mapConcat(ScopeAttributes, ResourceAttributes, Attributes)) AS AttributesHash"
        + " FROM `default`.`otel_metrics_sum` WHERE " + WIDENED_RANGE
        + " AND (ServiceName = 'api') AND ((MetricName = 'requests'))), SumRates AS (SELECT *, "), sql);
    assertTrue(sql.contains("any(Value) OVER (ORDER BY AttributesHash, TimeUnix ROWS BETWEEN 1 PRECEDING"
        + " AND 1 PRECEDING) AS PrevValue"), sql);
    assertTrue(sql.contains("IF(AttributesHash != PrevAttributesHash, 0, IF(Value < PrevValue, Value,"
        + " Value - PrevValue))) AS Rate FROM RawSum)"), sql);
    assertTrue(sql.endsWith(" SELECT sum(toFloat64OrDefault(toString(Rate))), " + BUCKET
        + " FROM SumRates"
        + " WHERE (TimeUnix >= fromUnixTimestamp64Milli(1000) AND TimeUnix <= fromUnixTimestamp64Milli(2000))"
        + " GROUP BY " + BUCKET + " ORDER BY " + BUCKET), sql);
  }

  @Test
  void histogramQuantileInterpolatesBuckets() {
    String sql = render(metrics(metric("quantile", MetricType.HISTOGRAM, "latency").withLevel(0.5))
        .groupBy("ServiceName")
        .build());
    assertTrue(sql.startsWith("WITH HistRaw AS (SELECT TimeUnix AS \"__hdx_ts\", AggregationTemporality,"
        + " ExplicitBounds, "), sql);
    assertTrue(sql.contains("CAST(BucketCounts AS Array(Int64)) AS \"Counts\", ServiceName AS \"__hdx_group_0\""
        + " FROM `default`.`otel_metrics_histogram`"), sql);
    assertTrue(sql.contains("HistPrev AS (SELECT *, "), sql);
    assertTrue(sql.contains("arrayMap((c, p) -> c - p, Counts, PrevCounts)) AS BucketRates FROM HistPrev)"), sql);
    assertTrue(sql.contains("HistBuckets AS (SELECT sumForEach(BucketRates) AS Rates, `__hdx_group_0`,"
        + " ExplicitBounds, toStartOfInterval(toDateTime(`__hdx_ts`), INTERVAL 1 minute) AS `__hdx_time_bucket`"
        + " FROM HistRates"), sql);
    assertTrue(sql.contains("0.5 * Total AS Rank"), sql);
    assertTrue(sql.contains("FROM HistBuckets WHERE Total > 0 AND length(ExplicitBounds) > 0)"), sql);
    assertTrue(sql.endsWith(" SELECT `__hdx_time_bucket`, `__hdx_group_0`, \"Value\" FROM Metrics"
        + " ORDER BY `__hdx_time_bucket` SETTINGS short_circuit_function_evaluation = 'force_enable'"), sql);
  }

  @Test
  void histogramCountSumsBucketRates() {
    String sql = render(metrics(metric("count", MetricType.HISTOGRAM, "latency").withAlias("n")).build());
    assertTrue(sql.contains("Metrics AS (SELECT `__hdx_time_bucket`, sum(arraySum(Rates)) AS \"n\""
        + " FROM HistBuckets GROUP BY `__hdx_time_bucket`)"), sql);
    assertTrue(sql.contains(" SELECT `__hdx_time_bucket`, \"n\" FROM Metrics"), sql);
  }

  @Test
  void histogramRejectsOtherAggregations() {
    ChartConfig config = metrics(SelectItem.of("avg", "Value").withMetric(MetricType.HISTOGRAM, "latency")).build();
    ChartConfigException e = assertThrows(ChartConfigException.class, () -> render(config));
    assertEquals("Aggregation 'avg' is not supported for histogram metrics", e.getMessage());
  }

  @Test
  void multipleMetricsAreCombined() {
    String sql = render(metrics(
        metric("avg", MetricType.GAUGE, "cpu"),
        metric("max", MetricType.GAUGE, "mem").withAlias("memory")).build());
    assertTrue(sql.startsWith("WITH Metric_0 AS (SELECT avg(toFloat64OrDefault(toString(Value))) AS \"Value\", "
        + BUCKET + " FROM `default`.`otel_metrics_gauge`"), sql);
    assertTrue(sql.contains("Metric_1 AS (SELECT max(toFloat64OrDefault(toString(Value))) AS \"Value\", "), sql);
    assertTrue(sql.contains("CombinedMetrics AS (SELECT \"Value\", `__hdx_time_bucket`, 'avg(cpu)' AS MetricLabel"
        + " FROM Metric_0 UNION ALL SELECT \"Value\", `__hdx_time_bucket`, 'memory' AS MetricLabel FROM Metric_1)"),
        sql);
    assertTrue(sql.endsWith(" SELECT \"Value\", `__hdx_time_bucket`, MetricLabel FROM CombinedMetrics"
        + " WHERE (MetricLabel != '') GROUP BY \"Value\", `__hdx_time_bucket`, MetricLabel"
        + " ORDER BY `__hdx_time_bucket`"), sql);
  }

  @Test
  void multipleMetricsNeedABucketing() {
    ChartConfig config = metrics(metric("avg", MetricType.GAUGE, "cpu"), metric("avg", MetricType.GAUGE, "mem"))
        .granularity(null)
        .dateRange(null)
        .build();
    ChartConfigException e = assertThrows(ChartConfigException.class, () -> render(config));
    assertEquals("Multiple metric selects require a granularity or a date range", e.getMessage());
  }

  @Test
  void invalidMetricSelects() {
    assertThrows(ChartConfigException.class, () -> render(metrics().select("Value").build()));
    assertThrows(ChartConfigException.class, () -> render(metrics(SelectItem.of("avg", "Value")).build()));
    ChartConfig noTable = metrics(metric("avg", MetricType.GAUGE, "cpu"))
        .metricTables(new MetricTables(null, "s", "h"))
        .build();
    assertThrows(ChartConfigException.class, () -> render(noTable));
  }

  @Test
  void groupColumnsGetStableAliases() {
    List<SelectItem> groups = MetricChartTranslator.groupColumns(SelectList.raw("ServiceName, Attributes['host']"));
    assertEquals(2, groups.size());
    assertEquals("__hdx_group_0", groups.get(0).alias());
    assertEquals("Attributes['host']", groups.get(1).valueExpression());
    assertEquals("__hdx_group_1", groups.get(1).alias());
    assertEquals("svc",
        MetricChartTranslator.groupColumns(SelectList.of(SelectItem.expression("ServiceName").withAlias("svc")))
            .get(0).alias());
    assertTrue(MetricChartTranslator.groupColumns(null).isEmpty());
  }
}
