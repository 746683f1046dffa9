package io.intellixity.sift.chart;

public record Limit(Integer limit, Integer offset) {
  public static Limit of(int limit) { return new Limit(limit, null); }
}
