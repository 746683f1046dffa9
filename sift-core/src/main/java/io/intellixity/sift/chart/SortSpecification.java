package io.intellixity.sift.chart;

import java.util.Objects;

/** ORDER BY item; a null ordering renders the expression as written. */
public record SortSpecification(String valueExpression, Ordering ordering) {
  public enum Ordering { ASC, DESC }

  public SortSpecification {
    Objects.requireNonNull(valueExpression, "valueExpression");
  }

  public static SortSpecification raw(String expression) { return new SortSpecification(expression, null); }
}
