package io.intellixity.sift.clickhouse.schema;

import java.util.Objects;

import static io.intellixity.sift.sql.SqlStrings.quote;
import static io.intellixity.sift.sql.SqlStrings.quoteIdentifier;

/** Map column and key a predicate reads; lets the map's skip index prune granules. */
public record MapKeyHint(String column, String key) {
  public MapKeyHint {
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(key, "key");
  }

  public String sql() {
    return "indexHint(mapContains(" + quoteIdentifier(column) + ", " + quote(key) + "))";
  }
}
