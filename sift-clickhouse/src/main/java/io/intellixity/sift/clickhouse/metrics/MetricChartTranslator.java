package io.intellixity.sift.clickhouse.metrics;

import io.intellixity.sift.chart.*;
import io.intellixity.sift.clickhouse.ClickHouseDialectOptions;
import io.intellixity.sift.clickhouse.render.ChartConfigRenderer;
import io.intellixity.sift.clickhouse.render.Granularities;
import io.intellixity.sift.spi.exec.Futures;
import io.intellixity.sift.sql.ParameterizedSql;
import io.intellixity.sift.sql.SqlStrings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.CompletableFuture;

/**
 * Rewrites a chart over OpenTelemetry metric tables into a chart over CTEs that derive per-row values.
 * <p>
 * Gauges aggregate {@code Value} directly. Sums and histograms convert cumulative series to deltas by
 * comparing each row with the previous row of the same attribute set; histograms then interpolate
 * quantiles from the summed bucket rates. Several selected metrics are rendered one CTE each and
 * combined with {@code UNION ALL}.
 */
public final class MetricChartTranslator {
  private static final Logger log = LoggerFactory.getLogger(MetricChartTranslator.class);

  public static final String DEFAULT_TIMESTAMP = "TimeUnix";
  public static final String VALUE_ALIAS = "Value";
  public static final String METRIC_LABEL = "MetricLabel";

  private static final String BUCKET = "`" + ChartConfigRenderer.TIME_BUCKET_ALIAS + "`";
  private static final String ATTRIBUTES_HASH =
      "cityHash64(mapConcat(ScopeAttributes, ResourceAttributes, Attributes))";
  private static final String HIST_TS = "__hdx_ts";
  private static final String GROUP_PREFIX = "__hdx_group_";
  private static final String SHORT_CIRCUIT = "short_circuit_function_evaluation = 'force_enable'";

  private final ChartConfigRenderer renderer;
  private final ClickHouseDialectOptions options;

  public MetricChartTranslator(ChartConfigRenderer renderer, ClickHouseDialectOptions options) {
    this.renderer = Objects.requireNonNull(renderer, "renderer");
    this.options = Objects.requireNonNull(options, "options");
  }

  /** Completes exceptionally with {@link ChartConfigException} for configs that cannot target metric tables. */
  public CompletableFuture<ChartConfig> translate(ChartConfig config) {
    return CompletableFuture.completedFuture(config).thenCompose(this::translateNow);
  }

  private CompletableFuture<ChartConfig> translateNow(ChartConfig config) {
    if (!(config.select() instanceof SelectList.Items items) || items.items().isEmpty()) {
      throw new ChartConfigException("Metric charts require structured select items");
    }
    if (items.items().size() > 1) return translateMultiple(config, items.items());

    SelectItem item = items.items().get(0);
    String table = metricTable(config, item);
    log.debug("Translating metric chart type={} metric={} table={}", item.metricType(), item.metricName(), table);
    return switch (item.metricType()) {
      case GAUGE -> CompletableFuture.completedFuture(gauge(config, item, table));
      case SUM -> sum(config, item, table);
      case HISTOGRAM -> histogram(config, item, table);
    };
  }

  private static String metricTable(ChartConfig config, SelectItem item) {
    if (item.metricType() == null || item.metricName() == null || item.metricName().isBlank()) {
      throw new ChartConfigException("Metric select items require metricType and metricName");
    }
    String table = config.metricTables().tableFor(item.metricType());
    if (table == null || table.isBlank()) {
      throw new ChartConfigException("No table configured for metric type " + item.metricType());
    }
    return table;
  }

  /** The caller's config narrowed to one metric in its table, with the default timestamp column. */
  private static ChartConfig.Builder source(ChartConfig config, SelectItem item, String table) {
    return config.toBuilder()
        .from(config.from().databaseName(), table)
        .metricTables(null)
        .timestampValueExpression(timestamp(config))
        .addFilter(new Filter.SqlFilter("MetricName = " + SqlStrings.quote(item.metricName())));
  }

  private static String timestamp(ChartConfig config) {
    String ts = config.timestampValueExpression();
    return ts == null || ts.isBlank() ? DEFAULT_TIMESTAMP : ts;
  }

  /** Source config for a CTE body: no bucketing, ordering, paging or settings of its own. */
  private static ChartConfig.Builder cteBody(ChartConfig.Builder b, String includedDataInterval) {
    return b.includedDataInterval(includedDataInterval)
        .granularity(null)
        .groupBy((SelectList) null)
        .orderBy(List.of())
        .limit(null)
        .having(null)
        .settings(List.of())
        .with(List.of())
        .fillGaps(false);
  }

  private String resolvedGranularity(ChartConfig config) {
    return config.granularity() != null && !config.granularity().isBlank()
        ? Granularities.resolve(config.granularity(), config.dateRange(), options.autoGranularityBuckets())
        : null;
  }

  private static ChartConfig gauge(ChartConfig config, SelectItem item, String table) {
    return source(config, item, table)
        .select(item.withValueExpression("Value").withMetric(null, null))
        .build();
  }

  private CompletableFuture<ChartConfig> sum(ChartConfig config, SelectItem item, String table) {
    String ts = timestamp(config);
    ChartConfig raw = cteBody(source(config, item, table), resolvedGranularity(config))
        .select("*, " + ATTRIBUTES_HASH + " AS AttributesHash")
        .build();
    String window = "(ORDER BY AttributesHash, " + ts + " ROWS BETWEEN 1 PRECEDING AND 1 PRECEDING)";
    ParameterizedSql rates = ParameterizedSql.raw("SELECT *, "
        + "any(AttributesHash) OVER " + window + " AS PrevAttributesHash, "
        + "any(Value) OVER " + window + " AS PrevValue, "
        + "IF(AggregationTemporality = 1, Value, "
        + "IF(AttributesHash != PrevAttributesHash, 0, "
        + "IF(Value < PrevValue, Value, Value - PrevValue))) AS Rate "
        + "FROM RawSum");

    return renderer.render(raw).thenApply(rawSql -> {
      List<CteDefinition> with = new ArrayList<>(config.with());
      with.add(CteDefinition.ofSql("RawSum", rawSql));
      with.add(CteDefinition.ofSql("SumRates", rates));
      return config.toBuilder()
          .metricTables(null)
          .with(with)
          .from(ChartSource.cte("SumRates"))
          .select(item.withValueExpression("Rate").withMetric(null, null))
          .where(null)
          .filters(List.of())
          .timestampValueExpression(ts)
          .build();
    });
  }

  private CompletableFuture<ChartConfig> histogram(ChartConfig config, SelectItem item, String table) {
    String fn = item.aggFn();
    if (!"quantile".equals(fn) && !"count".equals(fn)) {
      throw new ChartConfigException("Aggregation '" + fn + "' is not supported for histogram metrics");
    }
    String granularity = resolvedGranularity(config);
    String valueAlias = item.alias() == null || item.alias().isBlank() ? VALUE_ALIAS : item.alias();
    List<SelectItem> groups = groupColumns(config.groupBy());
    List<String> groupRefs = new ArrayList<>();
    for (SelectItem g : groups) groupRefs.add(SqlStrings.quoteIdentifier(g.alias()));

    List<SelectItem> rawItems = new ArrayList<>(List.of(
        SelectItem.expression(timestamp(config)).withAlias(HIST_TS),
        SelectItem.expression("AggregationTemporality"),
        SelectItem.expression("ExplicitBounds"),
        SelectItem.expression(ATTRIBUTES_HASH).withAlias("AttributesHash"),
        SelectItem.expression("cityHash64(ExplicitBounds)").withAlias("BoundsHash"),
        SelectItem.expression("CAST(BucketCounts AS Array(Int64))").withAlias("Counts")));
    rawItems.addAll(groups);
    ChartConfig raw = cteBody(source(config, item, table), granularity)
        .select(SelectList.of(rawItems))
        .build();

    String window = "(ORDER BY AttributesHash, BoundsHash, `" + HIST_TS + "` ROWS BETWEEN 1 PRECEDING AND 1 PRECEDING)";
    ParameterizedSql prev = ParameterizedSql.raw("SELECT *, "
        + "any(AttributesHash) OVER " + window + " AS PrevAttributesHash, "
        + "any(BoundsHash) OVER " + window + " AS PrevBoundsHash, "
        + "any(Counts) OVER " + window + " AS PrevCounts "
        + "FROM HistRaw");
    ParameterizedSql rates = ParameterizedSql.raw("SELECT *, multiIf("
        + "AggregationTemporality = 1, Counts, "
        + "AttributesHash != PrevAttributesHash OR BoundsHash != PrevBoundsHash "
        + "OR length(Counts) != length(PrevCounts), arrayMap(c -> toInt64(0), Counts), "
        + "arrayExists((c, p) -> c < p, Counts, PrevCounts), Counts, "
        + "arrayMap((c, p) -> c - p, Counts, PrevCounts)) AS BucketRates "
        + "FROM HistPrev");

    List<String> bucketGroupBy = new ArrayList<>(groupRefs);
    bucketGroupBy.add("ExplicitBounds");
    String bucketSelect = "sumForEach(BucketRates) AS Rates";
    if (granularity == null) {
      bucketGroupBy.add("`" + HIST_TS + "`");
      bucketSelect = "`" + HIST_TS + "` AS " + BUCKET + ", " + bucketSelect;
    }
    ChartConfig buckets = ChartConfig.builder()
        .from(ChartSource.cte("HistRates"))
        .select(bucketSelect)
        .groupBy(String.join(", ", bucketGroupBy))
        .timestampValueExpression("`" + HIST_TS + "`")
        .granularity(granularity)
        .dateRange(config.dateRange())
        .dateRangeStartInclusive(config.dateRangeStartInclusive())
        .dateRangeEndInclusive(config.dateRangeEndInclusive())
        .connectionId(config.connectionId())
        .fillGaps(false)
        .build();

    String groupList = groupRefs.isEmpty() ? "" : String.join(", ", groupRefs) + ", ";
    ParameterizedSql metrics = "quantile".equals(fn)
        ? quantile(groupList, item.level(), valueAlias)
        : ParameterizedSql.raw("SELECT " + BUCKET + ", " + groupList
            + "sum(arraySum(Rates)) AS " + SqlStrings.quoteAlias(valueAlias)
            + " FROM HistBuckets GROUP BY " + groupList + BUCKET);

    return Futures.allOf(List.of(renderer.render(raw), renderer.render(buckets))).thenApply(sqls -> {
      List<CteDefinition> with = new ArrayList<>(config.with());
      with.add(CteDefinition.ofSql("HistRaw", sqls.get(0)));
      with.add(CteDefinition.ofSql("HistPrev", prev));
      with.add(CteDefinition.ofSql("HistRates", rates));
      with.add(CteDefinition.ofSql("HistBuckets", sqls.get(1)));
      with.add(CteDefinition.ofSql("Metrics", metrics));
      List<SortSpecification> orderBy = config.orderBy().isEmpty()
          ? List.of(SortSpecification.raw(BUCKET))
          : config.orderBy();
      List<String> settings = new ArrayList<>(config.settings());
      settings.add(SHORT_CIRCUIT);
      return config.toBuilder()
          .metricTables(null)
          .with(with)
          .from(ChartSource.cte("Metrics"))
          .select(BUCKET + ", " + groupList + SqlStrings.quoteAlias(valueAlias))
          .where(null)
          .filters(List.of())
          .groupBy((SelectList) null)
          .granularity(null)
          .dateRange(null)
          .timestampValueExpression(BUCKET)
          .orderBy(orderBy)
          .settings(settings)
          .build();
    });
  }

  /**
   * Interpolates within the first bucket whose cumulative rate exceeds {@code level * Total}; the open
   * last bucket yields the last explicit bound.
   */
  private static ParameterizedSql quantile(String groupList, Double level, String valueAlias) {
    double l = level == null || !Double.isFinite(level) ? 0d : level;
    return ParameterizedSql.of("SELECT ", BUCKET, ", ", groupList,
        "arrayCumSum(Rates) AS CumRates, ",
        "CumRates[length(CumRates)] AS Total, ",
        ParameterizedSql.float64(l), " * Total AS Rank, ",
        "arrayFirstIndex(x -> x > Rank, CumRates) AS BucketIdx, ",
        "multiIf(",
        "BucketIdx = 0 OR BucketIdx > length(ExplicitBounds), ExplicitBounds[length(ExplicitBounds)], ",
        "BucketIdx = 1, ExplicitBounds[1] * (Rank / CumRates[1]), ",
        "ExplicitBounds[BucketIdx - 1] + (ExplicitBounds[BucketIdx] - ExplicitBounds[BucketIdx - 1]) ",
        "* ((Rank - CumRates[BucketIdx - 1]) / (CumRates[BucketIdx] - CumRates[BucketIdx - 1]))",
        ") AS ", SqlStrings.quoteAlias(valueAlias), " ",
        "FROM HistBuckets WHERE Total > 0 AND length(ExplicitBounds) > 0");
  }

  /** Group-by entries as select items, each carrying an alias the outer query can reference. */
  static List<SelectItem> groupColumns(SelectList groupBy) {
    List<SelectItem> items = new ArrayList<>();
    if (groupBy instanceof SelectList.Raw raw) {
      if (!raw.sql().isBlank()) {
        for (String expr : SqlStrings.splitTopLevel(raw.sql())) items.add(SelectItem.expression(expr));
      }
    } else if (groupBy instanceof SelectList.Items list) {
      items.addAll(list.items());
    }
    List<SelectItem> out = new ArrayList<>(items.size());
    for (int i = 0; i < items.size(); i++) {
      SelectItem g = items.get(i);
      out.add(g.alias() == null || g.alias().isBlank() ? g.withAlias(GROUP_PREFIX + i) : g);
    }
    return out;
  }

  private CompletableFuture<ChartConfig> translateMultiple(ChartConfig config, List<SelectItem> items) {
    String granularity = config.granularity();
    if (granularity == null || granularity.isBlank()) {
      if (config.dateRange() == null) {
        throw new ChartConfigException("Multiple metric selects require a granularity or a date range");
      }
      granularity = Granularities.AUTO;
    }
    List<SelectItem> groups = groupColumns(config.groupBy());
    List<String> groupRefs = new ArrayList<>();
    for (SelectItem g : groups) groupRefs.add(SqlStrings.quoteIdentifier(g.alias()));
    String groupList = groupRefs.isEmpty() ? "" : ", " + String.join(", ", groupRefs);

    List<CompletableFuture<ParameterizedSql>> rendered = new ArrayList<>();
    List<String> labels = new ArrayList<>();
    for (SelectItem item : items) {
      ChartConfig single = config.toBuilder()
          .select(item.withAlias(VALUE_ALIAS))
          .groupBy(groups.isEmpty() ? null : SelectList.of(groups))
          .granularity(granularity)
          .fillGaps(false)
          .orderBy(List.of())
          .limit(null)
          .having(null)
          .build();
      rendered.add(renderer.render(single));
      labels.add(item.alias() != null && !item.alias().isBlank()
          ? item.alias()
          : item.aggFn() + "(" + item.metricName() + ")");
    }

    return Futures.allOf(rendered).thenApply(sqls -> {
      List<CteDefinition> with = new ArrayList<>(config.with());
      List<ParameterizedSql> unions = new ArrayList<>();
      for (int i = 0; i < sqls.size(); i++) {
        String name = "Metric_" + i;
        with.add(CteDefinition.ofSql(name, sqls.get(i)));
        unions.add(ParameterizedSql.raw("SELECT \"" + VALUE_ALIAS + "\", " + BUCKET + groupList + ", "
            + SqlStrings.quote(labels.get(i)) + " AS " + METRIC_LABEL + " FROM " + name));
      }
      with.add(CteDefinition.ofSql("CombinedMetrics", ParameterizedSql.join(" UNION ALL ", unions)));

      String columns = "\"" + VALUE_ALIAS + "\", " + BUCKET + ", " + METRIC_LABEL + groupList;
      List<SortSpecification> orderBy = new ArrayList<>();
      orderBy.add(SortSpecification.raw(BUCKET));
      orderBy.addAll(config.orderBy());
      return config.toBuilder()
          .metricTables(null)
          .with(with)
          .from(ChartSource.cte("CombinedMetrics"))
          .select(columns)
          .where(METRIC_LABEL + " != ''")
          .whereLanguage(SearchLanguage.SQL)
          .filters(List.of())
          .groupBy(columns)
          .selectGroupBy(false)
          .granularity(null)
          .dateRange(null)
          .timestampValueExpression(BUCKET)
          .orderBy(orderBy)
          .build();
    });
  }
}
