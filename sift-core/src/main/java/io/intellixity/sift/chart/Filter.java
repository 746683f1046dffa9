package io.intellixity.sift.chart;

/** Extra WHERE condition. */
public sealed interface Filter permits Filter.SqlFilter, Filter.LuceneFilter, Filter.SqlAstFilter {

  record SqlFilter(String condition) implements Filter {}

  record LuceneFilter(String condition) implements Filter {}

  /** {@code (left operator right)}, with each side given as SQL. */
  record SqlAstFilter(String left, String operator, String right) implements Filter {}
}
