package io.intellixity.sift.chart;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.intellixity.sift.query.Clause;

import java.util.*;

/**
 * Declarative chart/query description rendered to SQL. Instances are immutable; derive variants
 * through {@link #toBuilder()}.
 */
@JsonDeserialize(using = ChartConfigJsonDeserializer.class)
public final class ChartConfig {
  private final SelectList select;
  private final String where;
  private final SearchLanguage whereLanguage;
  private final List<Filter> filters;
  private final Clause filtersLogicalOperator;
  private final SelectList groupBy;
  private final List<SortSpecification> orderBy;
  private final String having;
  private final SearchLanguage havingLanguage;
  private final Limit limit;
  private final DateRange dateRange;
  private final boolean dateRangeStartInclusive;
  private final boolean dateRangeEndInclusive;
  private final String granularity;
  private final String timestampValueExpression;
  private final ChartSource from;
  private final MetricTables metricTables;
  private final String implicitColumnExpression;
  private final String connectionId;
  private final List<CteDefinition> with;
  private final SeriesReturnType seriesReturnType;
  private final String includedDataInterval;
  private final List<String> settings;
  private final boolean fillGaps;
  private final boolean selectGroupBy;

  private ChartConfig(Builder b) {
    this.select = Objects.requireNonNull(b.select, "select");
    this.where = b.where == null ? "" : b.where;
    this.whereLanguage = b.whereLanguage == null ? SearchLanguage.SQL : b.whereLanguage;
    this.filters = List.copyOf(b.filters);
    this.filtersLogicalOperator = b.filtersLogicalOperator == null ? Clause.AND : b.filtersLogicalOperator;
    this.groupBy = b.groupBy;
    this.orderBy = List.copyOf(b.orderBy);
    this.having = b.having;
    this.havingLanguage = b.havingLanguage == null ? SearchLanguage.SQL : b.havingLanguage;
    this.limit = b.limit;
    this.dateRange = b.dateRange;
    this.dateRangeStartInclusive = b.dateRangeStartInclusive;
    this.dateRangeEndInclusive = b.dateRangeEndInclusive;
    this.granularity = b.granularity;
    this.timestampValueExpression = b.timestampValueExpression;
    this.from = Objects.requireNonNull(b.from, "from");
    this.metricTables = b.metricTables;
    this.implicitColumnExpression = b.implicitColumnExpression;
    this.connectionId = b.connectionId;
    this.with = List.copyOf(b.with);
    this.seriesReturnType = b.seriesReturnType == null ? SeriesReturnType.COLUMN : b.seriesReturnType;
    this.includedDataInterval = b.includedDataInterval;
    this.settings = List.copyOf(b.settings);
    this.fillGaps = b.fillGaps;
    this.selectGroupBy = b.selectGroupBy;
  }

  public static Builder builder() { return new Builder(); }

  public Builder toBuilder() { return new Builder(this); }

  public SelectList select() { return select; }
  public String where() { return where; }
  public SearchLanguage whereLanguage() { return whereLanguage; }
  public List<Filter> filters() { return filters; }
  public Clause filtersLogicalOperator() { return filtersLogicalOperator; }
  public SelectList groupBy() { return groupBy; }
  public List<SortSpecification> orderBy() { return orderBy; }
  public String having() { return having; }
  public SearchLanguage havingLanguage() { return havingLanguage; }
  public Limit limit() { return limit; }
  public DateRange dateRange() { return dateRange; }
  public boolean dateRangeStartInclusive() { return dateRangeStartInclusive; }
  public boolean dateRangeEndInclusive() { return dateRangeEndInclusive; }
  /** Fixed interval such as {@code 1 minute}, or {@code auto}. */
  public String granularity() { return granularity; }
  public String timestampValueExpression() { return timestampValueExpression; }
  public ChartSource from() { return from; }
  public MetricTables metricTables() { return metricTables; }
  public String implicitColumnExpression() { return implicitColumnExpression; }
  public String connectionId() { return connectionId; }
  public List<CteDefinition> with() { return with; }
  public SeriesReturnType seriesReturnType() { return seriesReturnType; }
  /** Interval the date filter is widened to, used by metric rate queries that need a preceding row. */
  public String includedDataInterval() { return includedDataInterval; }
  public List<String> settings() { return settings; }
  public boolean fillGaps() { return fillGaps; }
  /** Whether group-by expressions are also projected in the SELECT list. */
  public boolean selectGroupBy() { return selectGroupBy; }

  public boolean usesGranularity() {
    return granularity != null && !granularity.isBlank()
        && timestampValueExpression != null && !timestampValueExpression.isBlank();
  }

  public static final class Builder {
    private SelectList select;
    private String where;
    private SearchLanguage whereLanguage;
    private List<Filter> filters = new ArrayList<>();
    private Clause filtersLogicalOperator;
    private SelectList groupBy;
    private List<SortSpecification> orderBy = new ArrayList<>();
    private String having;
    private SearchLanguage havingLanguage;
    private Limit limit;
    private DateRange dateRange;
    private boolean dateRangeStartInclusive = true;
    private boolean dateRangeEndInclusive = true;
    private String granularity;
    private String timestampValueExpression;
    private ChartSource from;
    private MetricTables metricTables;
    private String implicitColumnExpression;
    private String connectionId;
    private List<CteDefinition> with = new ArrayList<>();
    private SeriesReturnType seriesReturnType;
    private String includedDataInterval;
    private List<String> settings = new ArrayList<>();
    private boolean fillGaps = true;
    private boolean selectGroupBy = true;

    private Builder() {}

    private Builder(ChartConfig c) {
      this.select = c.select;
      this.where = c.where;
      this.whereLanguage = c.whereLanguage;
      this.filters = new ArrayList<>(c.filters);
      this.filtersLogicalOperator = c.filtersLogicalOperator;
      this.groupBy = c.groupBy;
      this.orderBy = new ArrayList<>(c.orderBy);
      this.having = c.having;
      this.havingLanguage = c.havingLanguage;
      this.limit = c.limit;
      this.dateRange = c.dateRange;
      this.dateRangeStartInclusive = c.dateRangeStartInclusive;
      this.dateRangeEndInclusive = c.dateRangeEndInclusive;
      this.granularity = c.granularity;
      this.timestampValueExpression = c.timestampValueExpression;
      this.from = c.from;
      this.metricTables = c.metricTables;
      this.implicitColumnExpression = c.implicitColumnExpression;
      this.connectionId = c.connectionId;
      this.with = new ArrayList<>(c.with);
      this.seriesReturnType = c.seriesReturnType;
      this.includedDataInterval = c.includedDataInterval;
      this.settings = new ArrayList<>(c.settings);
      this.fillGaps = c.fillGaps;
      this.selectGroupBy = c.selectGroupBy;
    }

    public Builder select(SelectList select) { this.select = select; return this; }
    public Builder select(SelectItem... items) { this.select = SelectList.of(items); return this; }
    public Builder select(String rawSql) { this.select = SelectList.raw(rawSql); return this; }
    public Builder where(String where) { this.where = where; return this; }
    public Builder whereLanguage(SearchLanguage whereLanguage) { this.whereLanguage = whereLanguage; return this; }
    public Builder filters(List<Filter> filters) {
      this.filters = new ArrayList<>(filters == null ? List.of() : filters);
      return this;
    }
    public Builder addFilter(Filter filter) { this.filters.add(filter); return this; }
    public Builder filtersLogicalOperator(Clause op) { this.filtersLogicalOperator = op; return this; }
    public Builder groupBy(SelectList groupBy) { this.groupBy = groupBy; return this; }
    public Builder groupBy(String rawSql) { this.groupBy = rawSql == null ? null : SelectList.raw(rawSql); return this; }
    public Builder orderBy(List<SortSpecification> orderBy) {
      this.orderBy = new ArrayList<>(orderBy == null ? List.of() : orderBy);
      return this;
    }
    public Builder having(String having) { this.having = having; return this; }
    public Builder havingLanguage(SearchLanguage havingLanguage) { this.havingLanguage = havingLanguage; return this; }
    public Builder limit(Limit limit) { this.limit = limit; return this; }
    public Builder dateRange(DateRange dateRange) { this.dateRange = dateRange; return this; }
    public Builder dateRangeStartInclusive(boolean v) { this.dateRangeStartInclusive = v; return this; }
    public Builder dateRangeEndInclusive(boolean v) { this.dateRangeEndInclusive = v; return this; }
    public Builder granularity(String granularity) { this.granularity = granularity; return this; }
    public Builder timestampValueExpression(String expr) { this.timestampValueExpression = expr; return this; }
    public Builder from(ChartSource from) { this.from = from; return this; }
    public Builder from(String databaseName, String tableName) { return from(new ChartSource(databaseName, tableName)); }
    public Builder metricTables(MetricTables metricTables) { this.metricTables = metricTables; return this; }
    public Builder implicitColumnExpression(String expr) { this.implicitColumnExpression = expr; return this; }
    public Builder connectionId(String connectionId) { this.connectionId = connectionId; return this; }
    public Builder with(List<CteDefinition> with) {
      this.with = new ArrayList<>(with == null ? List.of() : with);
      return this;
    }
    public Builder seriesReturnType(SeriesReturnType t) { this.seriesReturnType = t; return this; }
    public Builder includedDataInterval(String interval) { this.includedDataInterval = interval; return this; }
    public Builder settings(List<String> settings) {
      this.settings = new ArrayList<>(settings == null ? List.of() : settings);
      return this;
    }
    public Builder fillGaps(boolean fillGaps) { this.fillGaps = fillGaps; return this; }
    public Builder selectGroupBy(boolean selectGroupBy) { this.selectGroupBy = selectGroupBy; return this; }

    public ChartConfig build() { return new ChartConfig(this); }
  }
}
