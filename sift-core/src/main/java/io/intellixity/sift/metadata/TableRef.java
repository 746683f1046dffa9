package io.intellixity.sift.metadata;

import java.util.Objects;

/** A table addressed through a connection. An empty {@code databaseName} refers to a CTE. */
public record TableRef(String databaseName, String tableName, String connectionId) {
  public TableRef {
    databaseName = databaseName == null ? "" : databaseName;
    tableName = Objects.requireNonNull(tableName, "tableName");
  }

  public boolean isCte() { return databaseName.isEmpty(); }
}
