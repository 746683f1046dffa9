package io.intellixity.sift.chart;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

public record DateRange(Instant start, Instant end) {
  public DateRange {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
  }

  public static DateRange ofEpochMillis(long start, long end) {
    return new DateRange(Instant.ofEpochMilli(start), Instant.ofEpochMilli(end));
  }

  public Duration span() { return Duration.between(start, end).abs(); }
}
