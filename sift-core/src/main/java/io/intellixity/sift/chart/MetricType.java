package io.intellixity.sift.chart;

import java.util.Locale;

public enum MetricType {
  GAUGE, SUM, HISTOGRAM;

  public static MetricType of(String raw) {
    if (raw == null || raw.isBlank()) return null;
    return valueOf(raw.trim().toUpperCase(Locale.ROOT));
  }
}
