package io.intellixity.sift.metadata;

import java.util.Objects;

/** Column name and its raw ClickHouse type, e.g. {@code Map(LowCardinality(String), String)}. */
public record ColumnMeta(String name, String type) {
  public ColumnMeta {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
  }
}
