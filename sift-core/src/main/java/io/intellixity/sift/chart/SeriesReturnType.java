package io.intellixity.sift.chart;

public enum SeriesReturnType {
  COLUMN,
  /** Two select items rendered as {@code divide(first, second)}. */
  RATIO
}
