package io.intellixity.sift.chart;

/**
 * One select-list entry.
 *
 * @param aggFn         aggregate function name ({@code count}, {@code quantile}, {@code sumMerge}, ...); null for
 *                      a plain expression
 * @param aggCondition  per-item filter applied through the {@code -If} combinator
 * @param level         quantile level
 * @param metricType    set when selecting from metric tables
 */
public record SelectItem(String aggFn, String valueExpression, String alias, String aggCondition,
                         SearchLanguage aggConditionLanguage, Double level, MetricType metricType,
                         String metricName) {
  public static SelectItem of(String aggFn, String valueExpression) {
    return new SelectItem(aggFn, valueExpression, null, null, null, null, null, null);
  }

  public static SelectItem expression(String valueExpression) {
    return of(null, valueExpression);
  }

  public boolean hasAggCondition() { return aggCondition != null && !aggCondition.isBlank(); }

  public SelectItem withAlias(String alias) {
    return new SelectItem(aggFn, valueExpression, alias, aggCondition, aggConditionLanguage, level, metricType,
        metricName);
  }

  public SelectItem withValueExpression(String valueExpression) {
    return new SelectItem(aggFn, valueExpression, alias, aggCondition, aggConditionLanguage, level, metricType,
        metricName);
  }

  public SelectItem withAggCondition(String aggCondition, SearchLanguage language) {
    return new SelectItem(aggFn, valueExpression, alias, aggCondition, language, level, metricType, metricName);
  }

  public SelectItem withLevel(Double level) {
    return new SelectItem(aggFn, valueExpression, alias, aggCondition, aggConditionLanguage, level, metricType,
        metricName);
  }

  public SelectItem withMetric(MetricType metricType, String metricName) {
    return new SelectItem(aggFn, valueExpression, alias, aggCondition, aggConditionLanguage, level, metricType,
        metricName);
  }
}
