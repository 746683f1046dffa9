package io.intellixity.sift.spi.search;

import io.intellixity.sift.metadata.TableRef;

import java.util.Objects;

/**
 * Table a search runs against.
 *
 * @param implicitColumnExpression column(s) bare terms search, comma-separated for several
 */
public record SearchTarget(TableRef table, String implicitColumnExpression) {
  public SearchTarget {
    Objects.requireNonNull(table, "table");
  }
}
