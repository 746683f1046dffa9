package io.intellixity.sift.clickhouse.schema;

import io.intellixity.sift.metadata.ColumnMeta;
import io.intellixity.sift.metadata.MetadataSource;
import io.intellixity.sift.metadata.TableRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static io.intellixity.sift.sql.SqlStrings.quoteIdentifier;

/**
 * Resolves dotted search fields against table metadata.
 * <p>
 * An exact column match wins. Otherwise the shortest existing column prefix is taken and the remainder is
 * read through {@link PathAccess}. Fields that match nothing fall back to the raw name as a String column.
 */
public final class FieldResolver {
  private static final Logger log = LoggerFactory.getLogger(FieldResolver.class);
  private static final Pattern MAP_ACCESS = Pattern.compile("^`?(\\w+)`?\\['(.+)'\\]$");

  private final MetadataSource metadata;
  private final TableRef table;

  public FieldResolver(MetadataSource metadata, TableRef table) {
    this.metadata = Objects.requireNonNull(metadata, "metadata");
    this.table = Objects.requireNonNull(table, "table");
  }

  public CompletableFuture<ResolvedField> resolve(String field) {
    if (table.isCte()) return CompletableFuture.completedFuture(ResolvedField.unresolved(field));
    return metadata.getColumn(table, field).thenCompose(col -> {
      if (col != null) return exact(field, col);
      String[] segments = field.split("\\.");
      return prefix(field, segments, 1);
    });
  }

  private CompletableFuture<ResolvedField> exact(String field, ColumnMeta col) {
    FieldType type = ClickHouseTypes.parse(col.type());
    return materializedSource(col.name()).thenApply(hint ->
        new ResolvedField(field, col.name(), type, true, hint, List.of()));
  }

  /** Hint for a materialized column computed from {@code Map['key']}, or null. */
  private CompletableFuture<MapKeyHint> materializedSource(String column) {
    return metadata.getMaterializedColumnsLookupTable(table).handle((lookup, err) -> {
      if (err != null) {
        log.debug("Materialized column lookup failed table={} err={}", table.tableName(), err.toString());
        return null;
      }
      if (lookup == null) return null;
      for (Map.Entry<String, String> e : lookup.entrySet()) {
        if (!column.equals(e.getValue())) continue;
        Matcher m = MAP_ACCESS.matcher(e.getKey().trim());
        if (m.matches()) return new MapKeyHint(m.group(1), m.group(2));
      }
      return null;
    });
  }

  private CompletableFuture<ResolvedField> prefix(String field, String[] segments, int length) {
    if (length >= segments.length) return CompletableFuture.completedFuture(unresolved(field));
    String root = String.join(".", Arrays.copyOfRange(segments, 0, length));
    List<String> rest = List.of(Arrays.copyOfRange(segments, length, segments.length));
    return metadata.getColumn(table, root).thenCompose(col -> {
      if (col == null) return prefix(field, segments, length + 1);
      FieldType type = ClickHouseTypes.parse(col.type());
      PathAccess.Access access = PathAccess.descend(type, quotedBase(type, col.name()), col.name(), rest);
      if (access == null) return CompletableFuture.completedFuture(unresolved(field));
      return CompletableFuture.completedFuture(ResolvedField.of(field, access));
    });
  }

  private static String quotedBase(FieldType type, String column) {
    return type instanceof FieldType.ArrayType ? column : quoteIdentifier(column);
  }

  private ResolvedField unresolved(String field) {
    log.warn("Column not found, searching field as-is table={} field={}", table.tableName(), field);
    return ResolvedField.unresolved(field);
  }
}
