package io.intellixity.sift.metadata;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Schema lookups consumed by the compilers. Implementations own caching and retries.
 * <p>
 * Futures complete with null for unknown columns and settings; a failed lookup completes exceptionally.
 */
public interface MetadataSource {
  CompletableFuture<ColumnMeta> getColumn(TableRef table, String column);

  CompletableFuture<List<SkipIndex>> getSkipIndices(TableRef table);

  /** Normalized source expression (e.g. {@code LogAttributes['k']}) to materialized column name. */
  CompletableFuture<Map<String, String>> getMaterializedColumnsLookupTable(TableRef table);

  CompletableFuture<String> getSetting(String settingName, String connectionId);
}
