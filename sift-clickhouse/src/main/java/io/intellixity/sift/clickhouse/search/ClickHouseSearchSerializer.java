package io.intellixity.sift.clickhouse.search;

import io.intellixity.sift.clickhouse.ClickHouseDialectOptions;
import io.intellixity.sift.clickhouse.schema.FieldResolver;
import io.intellixity.sift.clickhouse.schema.FieldType;
import io.intellixity.sift.clickhouse.schema.ResolvedField;
import io.intellixity.sift.metadata.MetadataSource;
import io.intellixity.sift.query.SearchCompileException;
import io.intellixity.sift.spi.search.AbstractSearchSerializer;
import io.intellixity.sift.spi.search.ComparisonOperator;
import io.intellixity.sift.spi.search.LeafContext;
import io.intellixity.sift.spi.search.SearchTarget;
import io.intellixity.sift.sql.SqlStrings;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Compiles search trees to ClickHouse WHERE fragments. Fields are resolved against table metadata and the
 * predicate form follows the resolved type; bare terms go through {@link ImplicitSearchOptimizer}.
 */
public final class ClickHouseSearchSerializer extends AbstractSearchSerializer {
  private final FieldResolver resolver;
  private final String implicitColumn;
  private final ImplicitSearchOptimizer optimizer;

  public ClickHouseSearchSerializer(SearchTarget target, MetadataSource metadata, ClickHouseDialectOptions options) {
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(metadata, "metadata");
    Objects.requireNonNull(options, "options");
    this.resolver = new FieldResolver(metadata, target.table());
    this.implicitColumn = implicitColumn(target.implicitColumnExpression());
    this.optimizer = implicitColumn == null ? null
        : new ImplicitSearchOptimizer(target.table(), implicitColumn, metadata, options);
  }

  /** One column as-is; several comma-separated columns are concatenated into one searchable string. */
  static String implicitColumn(String expression) {
    List<String> columns = SqlStrings.splitTopLevel(expression);
    if (columns.isEmpty()) return null;
    if (columns.size() == 1) return columns.get(0);
    return "concatWithSeparator(';'," + String.join(",", columns) + ")";
  }

  @Override
  protected CompletableFuture<String> eq(LeafContext leaf, String term) {
    return leaf(leaf, f -> forms(f).eq(term, leaf.negated()), true);
  }

  @Override
  protected CompletableFuture<String> isNotNull(LeafContext leaf) {
    return leaf(leaf, f -> forms(f).isNotNull(leaf.negated()), false);
  }

  @Override
  protected CompletableFuture<String> compare(LeafContext leaf, ComparisonOperator op, String term) {
    return leaf(leaf, f -> forms(f).compare(op, term), true);
  }

  @Override
  protected CompletableFuture<String> range(LeafContext leaf, String low, String high) {
    return leaf(leaf, f -> forms(f).between(low, high, leaf.negated()), true);
  }

  @Override
  protected CompletableFuture<String> contains(LeafContext leaf, String term, boolean quoted) {
    if (leaf.implicit()) {
      if (optimizer == null) return missingImplicitColumn();
      return optimizer.render(term, leaf.negated());
    }
    if (term.isEmpty()) return CompletableFuture.completedFuture("(1=1)");
    return leaf(leaf, f -> forms(f).contains(term, leaf.negated()), true);
  }

  @Override
  protected CompletableFuture<String> like(LeafContext leaf, String term, boolean prefixWildcard,
                                           boolean suffixWildcard) {
    return leaf(leaf, f -> forms(f).like(term, prefixWildcard, suffixWildcard, leaf.negated()), true);
  }

  private CompletableFuture<String> leaf(LeafContext leaf, Function<ResolvedField, String> predicate,
                                         boolean parenthesize) {
    return resolve(leaf).thenApply(f -> {
      String sql = predicate.apply(f);
      if (f.mapKey() != null && leaf.hintAllowed()) sql = sql + " AND " + f.mapKey().sql();
      return parenthesize ? "(" + sql + ")" : sql;
    });
  }

  private CompletableFuture<ResolvedField> resolve(LeafContext leaf) {
    if (leaf.implicit()) {
      if (implicitColumn == null) return missingImplicitColumn();
      return CompletableFuture.completedFuture(
          new ResolvedField(null, implicitColumn, FieldType.STRING, true, null, List.of()));
    }
    return resolver.resolve(leaf.field());
  }

  private static PredicateForms forms(ResolvedField f) {
    return PredicateForms.of(f.field(), f.expression(), f.type(), f.elementPath());
  }

  private static <T> CompletableFuture<T> missingImplicitColumn() {
    return CompletableFuture.failedFuture(
        new SearchCompileException("Can not search bare text without an implicit column set."));
  }
}
