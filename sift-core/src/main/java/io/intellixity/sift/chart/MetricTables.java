package io.intellixity.sift.chart;

/** OpenTelemetry metric tables, one per metric kind. */
public record MetricTables(String gauge, String sum, String histogram) {
  public String tableFor(MetricType type) {
    return switch (type) {
      case GAUGE -> gauge;
      case SUM -> sum;
      case HISTOGRAM -> histogram;
    };
  }
}
