package io.intellixity.sift.clickhouse.render;

import io.intellixity.sift.chart.ChartConfigException;
import io.intellixity.sift.chart.DateRange;

import java.util.List;
import java.util.Locale;

/** Interval strings such as {@code 5 minute} and the {@code auto} bucket choice. */
public final class Granularities {
  public static final String AUTO = "auto";

  private static final List<String> BUCKETS = List.of(
      "15 second", "30 second", "1 minute", "5 minute", "10 minute", "15 minute", "30 minute",
      "1 hour", "2 hour", "6 hour", "12 hour", "1 day", "2 day", "7 day", "30 day");

  private Granularities() {}

  /** The fixed granularity, or the {@code auto} choice for {@code range}. */
  public static String resolve(String granularity, DateRange range, int targetBuckets) {
    if (!AUTO.equals(granularity)) return granularity;
    if (range == null) throw new ChartConfigException("granularity 'auto' requires a dateRange");
    return auto(range, targetBuckets);
  }

  /** Smallest bucket at least {@code span / targetBuckets} wide, capped at the largest bucket. */
  public static String auto(DateRange range, int targetBuckets) {
    long spanSeconds = range.span().getSeconds();
    long perBucket = (long) Math.ceil((double) spanSeconds / targetBuckets);
    for (String b : BUCKETS) {
      if (seconds(b) >= perBucket) return b;
    }
    return BUCKETS.get(BUCKETS.size() - 1);
  }

  /** Width of an interval such as {@code 15 second} or {@code 2 hours}. */
  public static long seconds(String interval) {
    String[] parts = interval.trim().split("\\s+");
    if (parts.length != 2) throw new ChartConfigException("Invalid interval: " + interval);
    long amount;
    try {
      amount = Long.parseLong(parts[0]);
    } catch (NumberFormatException e) {
      throw new ChartConfigException("Invalid interval: " + interval, e);
    }
    String unit = parts[1].toLowerCase(Locale.ROOT);
    if (unit.endsWith("s")) unit = unit.substring(0, unit.length() - 1);
    return switch (unit) {
      case "second" -> amount;
      case "minute" -> amount * 60;
      case "hour" -> amount * 3600;
      case "day" -> amount * 86400;
      case "week" -> amount * 604800;
      default -> throw new ChartConfigException("Invalid interval unit " + parts[1] + " in interval " + interval);
    };
  }
}
