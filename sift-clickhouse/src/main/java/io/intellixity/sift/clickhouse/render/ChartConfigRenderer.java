package io.intellixity.sift.clickhouse.render;

import io.intellixity.sift.chart.*;
import io.intellixity.sift.clickhouse.ClickHouseDialectOptions;
import io.intellixity.sift.clickhouse.metrics.MetricChartTranslator;
import io.intellixity.sift.clickhouse.rewrite.MaterializedColumnRewriter;
import io.intellixity.sift.clickhouse.schema.ClickHouseTypes;
import io.intellixity.sift.clickhouse.schema.FieldType;
import io.intellixity.sift.clickhouse.search.ClickHouseSearchSerializer;
import io.intellixity.sift.metadata.ColumnMeta;
import io.intellixity.sift.metadata.MetadataSource;
import io.intellixity.sift.metadata.TableRef;
import io.intellixity.sift.spi.exec.Futures;
import io.intellixity.sift.spi.search.SearchQueryBuilder;
import io.intellixity.sift.spi.search.SearchTarget;
import io.intellixity.sift.sql.ParameterizedSql;
import io.intellixity.sift.sql.SqlStrings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.CompletableFuture;

/**
 * Renders a {@link ChartConfig} to one parameterized ClickHouse statement.
 * <p>
 * Clauses render independently and are joined in statement order: WITH, SELECT, FROM, WHERE, GROUP BY,
 * HAVING, ORDER BY (with WITH FILL on the time bucket), LIMIT, SETTINGS. Configs with metric tables are
 * first translated by {@link MetricChartTranslator}.
 */
public final class ChartConfigRenderer {
  private static final Logger log = LoggerFactory.getLogger(ChartConfigRenderer.class);

  public static final String TIME_BUCKET_ALIAS = "__hdx_time_bucket";

  private final MetadataSource metadata;
  private final ClickHouseDialectOptions options;
  private final MaterializedColumnRewriter rewriter = new MaterializedColumnRewriter();
  private final MetricChartTranslator metrics;

  public ChartConfigRenderer(MetadataSource metadata, ClickHouseDialectOptions options) {
    this.metadata = Objects.requireNonNull(metadata, "metadata");
    this.options = Objects.requireNonNull(options, "options");
    this.metrics = new MetricChartTranslator(this, options);
  }

  public CompletableFuture<ParameterizedSql> render(ChartConfig config) {
    CompletableFuture<ChartConfig> translated = config.metricTables() != null
        ? metrics.translate(config)
        : CompletableFuture.completedFuture(config);
    return translated.thenCompose(this::renderStatement).thenApply(sql -> {
      if (log.isDebugEnabled()) log.debug("Rendered chart table={} sql={}", config.from().tableName(), sql.sql());
      return sql;
    });
  }

  private CompletableFuture<ParameterizedSql> renderStatement(ChartConfig c) {
    CteChain.validate(c.with(), c.from());
    String granularity = c.usesGranularity()
        ? Granularities.resolve(c.granularity(), c.dateRange(), options.autoGranularityBuckets())
        : null;

    CompletableFuture<Map<String, String>> materialized = materializedColumns(c);
    List<CompletableFuture<ParameterizedSql>> clauses = List.of(
        renderWith(c),
        materialized.thenCompose(m -> renderSelect(c, granularity, m)),
        materialized.thenCompose(m -> renderWhere(c, m)),
        materialized.thenCompose(m -> renderGroupBy(c, granularity, m)),
        materialized.thenCompose(m -> renderCondition(c, c.having(), c.havingLanguage(), m))
            .thenApply(ParameterizedSql::raw));

    return Futures.allOf(clauses).thenApply(parts -> ParameterizedSql.join(" ", List.of(
        parts.get(0).wrapIfNotEmpty("WITH ", ""),
        ParameterizedSql.of("SELECT ", parts.get(1)),
        ParameterizedSql.of("FROM ", renderFrom(c.from())),
        parts.get(2).wrapIfNotEmpty("WHERE ", ""),
        parts.get(3).wrapIfNotEmpty("GROUP BY ", ""),
        parts.get(4).wrapIfNotEmpty("HAVING ", ""),
        renderOrderBy(c, granularity).wrapIfNotEmpty("ORDER BY ", ""),
        renderLimit(c.limit()),
        renderSettings(c.settings()))));
  }

  private CompletableFuture<Map<String, String>> materializedColumns(ChartConfig c) {
    if (!c.with().isEmpty() || c.from().databaseName().isEmpty()) {
      return CompletableFuture.completedFuture(Map.of());
    }
    return metadata.getMaterializedColumnsLookupTable(tableRef(c)).handle((m, err) -> {
      if (err != null) {
        log.debug("Materialized column lookup failed, skipping rewrite table={}", c.from().tableName(), err);
        return Map.<String, String>of();
      }
      return m == null ? Map.<String, String>of() : m;
    });
  }

  private CompletableFuture<ParameterizedSql> renderWith(ChartConfig c) {
    if (c.with().isEmpty()) return CompletableFuture.completedFuture(ParameterizedSql.EMPTY);
    List<CompletableFuture<ParameterizedSql>> bodies = new ArrayList<>();
    for (CteDefinition cte : c.with()) {
      bodies.add(cte.sql() != null ? CompletableFuture.completedFuture(cte.sql()) : render(cte.chartConfig()));
    }
    return Futures.allOf(bodies).thenApply(sqls -> {
      CteChain chain = new CteChain();
      for (int i = 0; i < sqls.size(); i++) {
        CteDefinition cte = c.with().get(i);
        chain.add(cte.name(), sqls.get(i), cte.subquery());
      }
      return chain.render();
    });
  }

  /** Select items, then projected group-by items, then the time bucket. */
  private CompletableFuture<ParameterizedSql> renderSelect(ChartConfig c, String granularity,
                                                           Map<String, String> materialized) {
    boolean ratio = c.seriesReturnType() == SeriesReturnType.RATIO
        && c.select() instanceof SelectList.Items items && items.items().size() == 2;
    CompletableFuture<ParameterizedSql> select = renderSelectList(c.select(), c, materialized, ratio);
    CompletableFuture<ParameterizedSql> groupBy = c.selectGroupBy() && usesGroupBy(c)
        ? renderSelectList(c.groupBy(), c, materialized, false)
        : CompletableFuture.completedFuture(ParameterizedSql.EMPTY);
    return select.thenCombine(groupBy, (s, g) -> ParameterizedSql.join(", ", List.of(
        s, g, granularity == null ? ParameterizedSql.EMPTY : ParameterizedSql.raw(timeBucket(c, granularity)))));
  }

  private CompletableFuture<ParameterizedSql> renderGroupBy(ChartConfig c, String granularity,
                                                            Map<String, String> materialized) {
    CompletableFuture<ParameterizedSql> groupBy = usesGroupBy(c)
        ? renderSelectList(c.groupBy(), c, materialized, false)
        : CompletableFuture.completedFuture(ParameterizedSql.EMPTY);
    return groupBy.thenApply(g -> ParameterizedSql.join(", ", List.of(
        g, granularity == null ? ParameterizedSql.EMPTY : ParameterizedSql.raw(timeBucket(c, granularity)))));
  }

  private static boolean usesGroupBy(ChartConfig c) {
    SelectList g = c.groupBy();
    if (g instanceof SelectList.Raw raw) return !raw.sql().isBlank();
    return g instanceof SelectList.Items items && !items.items().isEmpty();
  }

  private CompletableFuture<ParameterizedSql> renderSelectList(SelectList list, ChartConfig c,
                                                               Map<String, String> materialized, boolean ratio) {
    if (list instanceof SelectList.Raw raw) {
      return CompletableFuture.completedFuture(ParameterizedSql.raw(raw.sql()));
    }
    List<SelectItem> items = ((SelectList.Items) list).items();
    List<CompletableFuture<String>> rendered = new ArrayList<>(items.size());
    for (SelectItem item : items) rendered.add(renderSelectItem(item, c, materialized));
    return Futures.allOf(rendered).thenApply(parts -> ratio
        ? ParameterizedSql.raw("divide(" + parts.get(0) + ", " + parts.get(1) + ")")
        : ParameterizedSql.raw(String.join(", ", parts)));
  }

  private CompletableFuture<String> renderSelectItem(SelectItem item, ChartConfig c,
                                                     Map<String, String> materialized) {
    SearchLanguage language = item.aggConditionLanguage() == null ? SearchLanguage.SQL : item.aggConditionLanguage();
    return renderCondition(c, item.aggCondition(), language, Map.of()).thenApply(condition -> {
      String expr;
      if (item.aggFn() == null) {
        if (item.valueExpression() == null || item.valueExpression().isBlank()) {
          throw new ChartConfigException("Select item requires a valueExpression or an aggFn");
        }
        expr = item.valueExpression();
      } else {
        expr = AggregateExpressions.render(item.aggFn(), item.valueExpression(), item.level(), condition);
      }
      expr = rewriter.rewriteExpression(expr, materialized);
      if (item.alias() != null && !item.alias().isBlank()) expr = expr + " AS " + SqlStrings.quoteAlias(item.alias());
      return expr;
    });
  }

  /** Time filter, main condition, pushed-down aggregate conditions and filters, ANDed. */
  private CompletableFuture<ParameterizedSql> renderWhere(ChartConfig c, Map<String, String> materialized) {
    CompletableFuture<ParameterizedSql> time = c.dateRange() != null && notBlank(c.timestampValueExpression())
        ? timeFilter(c)
        : CompletableFuture.completedFuture(ParameterizedSql.EMPTY);

    CompletableFuture<String> where = renderCondition(c, c.where(), c.whereLanguage(), materialized);

    CompletableFuture<String> aggConditions = CompletableFuture.completedFuture("");
    if (c.select() instanceof SelectList.Items items && !items.items().isEmpty()
        && items.items().stream().allMatch(SelectItem::hasAggCondition)) {
      List<CompletableFuture<String>> conditions = new ArrayList<>();
      for (SelectItem item : items.items()) {
        SearchLanguage language =
            item.aggConditionLanguage() == null ? SearchLanguage.SQL : item.aggConditionLanguage();
        conditions.add(renderCondition(c, item.aggCondition(), language, materialized));
      }
      aggConditions = Futures.allOf(conditions).thenApply(parts -> joinNonBlank(" OR ", parts));
    }

    List<CompletableFuture<String>> filters = new ArrayList<>();
    for (Filter f : c.filters()) filters.add(renderFilter(c, f, materialized));
    String filterOp = " " + c.filtersLogicalOperator().sql() + " ";
    CompletableFuture<String> filterSql = Futures.allOf(filters).thenApply(parts -> {
      List<String> wrapped = new ArrayList<>();
      for (String p : parts) if (notBlank(p)) wrapped.add("(" + p + ")");
      return String.join(filterOp, wrapped);
    });

    return Futures.allOf(List.of(where, aggConditions, filterSql)).thenCombine(time, (parts, t) ->
        ParameterizedSql.join(" AND ", List.of(
            t,
            ParameterizedSql.raw(parts.get(0)).wrapIfNotEmpty("(", ")"),
            ParameterizedSql.raw(parts.get(1)).wrapIfNotEmpty("(", ")"),
            ParameterizedSql.raw(parts.get(2)).wrapIfNotEmpty("(", ")"))));
  }

  private CompletableFuture<String> renderFilter(ChartConfig c, Filter f, Map<String, String> materialized) {
    if (f instanceof Filter.SqlFilter sql) {
      return renderCondition(c, sql.condition(), SearchLanguage.SQL, materialized);
    }
    if (f instanceof Filter.LuceneFilter lucene) {
      return renderCondition(c, lucene.condition(), SearchLanguage.LUCENE, materialized);
    }
    if (f instanceof Filter.SqlAstFilter ast) {
      return CompletableFuture.completedFuture(ast.left() + " " + ast.operator() + " " + ast.right());
    }
    throw new UnknownFilterTypeException(f == null ? "null" : f.getClass().getSimpleName());
  }

  /** SQL passes through; search-language conditions compile against the FROM table. */
  private CompletableFuture<String> renderCondition(ChartConfig c, String condition, SearchLanguage language,
                                                    Map<String, String> materialized) {
    if (!notBlank(condition)) return CompletableFuture.completedFuture("");
    CompletableFuture<String> sql;
    if (language == SearchLanguage.LUCENE) {
      ClickHouseSearchSerializer serializer = new ClickHouseSearchSerializer(
          new SearchTarget(tableRef(c), c.implicitColumnExpression()), metadata, options);
      sql = new SearchQueryBuilder(condition, serializer).build();
    } else {
      sql = CompletableFuture.completedFuture(condition);
    }
    return sql.thenApply(s -> rewriter.rewriteCondition(s, materialized));
  }

  /** One range check per comma-separated timestamp expression. */
  private CompletableFuture<ParameterizedSql> timeFilter(ChartConfig c) {
    List<CompletableFuture<ParameterizedSql>> parts = new ArrayList<>();
    for (String column : SqlStrings.splitTopLevel(c.timestampValueExpression())) {
      parts.add(timestampColumn(c, column).thenApply(meta -> timeRange(c, column, dateOnly(meta))));
    }
    return Futures.allOf(parts).thenApply(p -> ParameterizedSql.join(" AND ", p));
  }

  private CompletableFuture<ColumnMeta> timestampColumn(ChartConfig c, String column) {
    if (!c.with().isEmpty() || c.from().databaseName().isEmpty()) return CompletableFuture.completedFuture(null);
    return metadata.getColumn(tableRef(c), column).thenApply(meta -> {
      if (meta == null) {
        log.warn("Timestamp column not found, comparing as DateTime table={} column={}",
            c.from().tableName(), column);
      }
      return meta;
    });
  }

  private static boolean dateOnly(ColumnMeta meta) {
    return meta != null && ClickHouseTypes.parse(meta.type()) instanceof FieldType.DateTimeType t && t.dateOnly();
  }

  private static ParameterizedSql timeRange(ChartConfig c, String column, boolean dateOnly) {
    ParameterizedSql start = ParameterizedSql.of(
        "fromUnixTimestamp64Milli(", ParameterizedSql.int64(c.dateRange().start().toEpochMilli()), ")");
    ParameterizedSql end = ParameterizedSql.of(
        "fromUnixTimestamp64Milli(", ParameterizedSql.int64(c.dateRange().end().toEpochMilli()), ")");
    String interval = c.includedDataInterval();
    if (notBlank(interval)) {
      start = ParameterizedSql.of("toStartOfInterval(", start, ", INTERVAL ", interval, ") - INTERVAL ", interval);
      end = ParameterizedSql.of("toStartOfInterval(", end, ", INTERVAL ", interval, ") + INTERVAL ", interval);
    }
    if (dateOnly) {
      start = ParameterizedSql.of("toDate(", start, ")");
      end = ParameterizedSql.of("toDate(", end, ")");
    }
    return ParameterizedSql.of(
        "(", column, c.dateRangeStartInclusive() ? " >= " : " > ", start,
        " AND ", column, c.dateRangeEndInclusive() ? " <= " : " < ", end, ")");
  }

  static String timeBucket(ChartConfig c, String granularity) {
    String ts = SqlStrings.splitTopLevel(c.timestampValueExpression()).get(0);
    return "toStartOfInterval(toDateTime(" + ts + "), INTERVAL " + granularity + ") AS `" + TIME_BUCKET_ALIAS + "`";
  }

  static ParameterizedSql renderFrom(ChartSource from) {
    if (from.databaseName().isEmpty()) return ParameterizedSql.raw(from.tableName());
    return ParameterizedSql.of(
        ParameterizedSql.identifier(from.databaseName()), ".", ParameterizedSql.identifier(from.tableName()));
  }

  /** Time bucket first, gap-filled for fixed granularities over a date range, then the caller's ordering. */
  private static ParameterizedSql renderOrderBy(ChartConfig c, String granularity) {
    List<ParameterizedSql> parts = new ArrayList<>();
    if (granularity != null) {
      ParameterizedSql bucket = ParameterizedSql.raw(timeBucket(c, granularity));
      if (c.fillGaps() && c.dateRange() != null && !Granularities.AUTO.equals(c.granularity())) {
        bucket = ParameterizedSql.of(bucket,
            " WITH FILL FROM ", fillBound(c.dateRange().start().toEpochMilli(), granularity),
            " TO ", fillBound(c.dateRange().end().toEpochMilli(), granularity),
            " STEP ", ParameterizedSql.int32((int) Granularities.seconds(granularity)));
      }
      parts.add(bucket);
    }
    for (SortSpecification s : c.orderBy()) {
      parts.add(ParameterizedSql.raw(
          s.valueExpression() + (s.ordering() == null ? "" : " " + s.ordering().name())));
    }
    return ParameterizedSql.join(", ", parts);
  }

  private static ParameterizedSql fillBound(long epochMillis, String granularity) {
    return ParameterizedSql.of("toStartOfInterval(toDateTime(fromUnixTimestamp64Milli(",
        ParameterizedSql.int64(epochMillis), ")), INTERVAL ", granularity, ")");
  }

  private static ParameterizedSql renderLimit(Limit limit) {
    if (limit == null || limit.limit() == null) return ParameterizedSql.EMPTY;
    return ParameterizedSql.of("LIMIT ", ParameterizedSql.int32(limit.limit()),
        limit.offset() == null ? null : ParameterizedSql.of(" OFFSET ", ParameterizedSql.int32(limit.offset())));
  }

  private static ParameterizedSql renderSettings(List<String> settings) {
    List<String> nonBlank = new ArrayList<>();
    for (String s : settings) if (notBlank(s)) nonBlank.add(s.trim());
    return ParameterizedSql.raw(String.join(", ", nonBlank)).wrapIfNotEmpty("SETTINGS ", "");
  }

  private static TableRef tableRef(ChartConfig c) {
    return new TableRef(c.from().databaseName(), c.from().tableName(), c.connectionId());
  }

  private static String joinNonBlank(String separator, List<String> parts) {
    List<String> out = new ArrayList<>();
    for (String p : parts) if (notBlank(p)) out.add(p);
    return String.join(separator, out);
  }

  private static boolean notBlank(String s) {
    return s != null && !s.isBlank();
  }
}
