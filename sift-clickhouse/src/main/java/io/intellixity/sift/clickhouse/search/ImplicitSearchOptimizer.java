package io.intellixity.sift.clickhouse.search;

import io.intellixity.sift.clickhouse.ClickHouseDialectOptions;
import io.intellixity.sift.metadata.MetadataSource;
import io.intellixity.sift.metadata.SkipIndex;
import io.intellixity.sift.metadata.SkipIndexType;
import io.intellixity.sift.metadata.TableRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;

import static io.intellixity.sift.sql.SqlStrings.quote;

/**
 * Token search over the implicit column, in the fastest form the table's skip indices allow.
 * <p>
 * A {@code bloom_filter} index on {@code tokens(column)} or {@code tokens(lower(column))} yields {@code hasAll}, an enabled
 * {@code text} index yields {@code hasAllTokens}, and anything else falls back to one {@code hasToken}
 * per token. Terms spanning separators also get a {@code LIKE} guard so tokens must be adjacent.
 */
final class ImplicitSearchOptimizer {
  private static final Logger log = LoggerFactory.getLogger(ImplicitSearchOptimizer.class);
  static final Pattern SEPARATORS = Pattern.compile("[ -/:-@\\[-`{-~\\t\\n\\r]+");

  private final TableRef table;
  private final String column;
  private final MetadataSource metadata;
  private final ClickHouseDialectOptions options;
  private CompletableFuture<Strategy> strategy;

  ImplicitSearchOptimizer(TableRef table, String column, MetadataSource metadata, ClickHouseDialectOptions options) {
    this.table = table;
    this.column = column;
    this.metadata = metadata;
    this.options = options;
  }

  CompletableFuture<String> render(String term, boolean negated) {
    if (term.isEmpty()) return CompletableFuture.completedFuture("(1=1)");
    List<String> tokens = tokenize(term);
    boolean separated = SEPARATORS.matcher(term).find();
    return strategy().thenApply(s -> {
      List<String> parts = new ArrayList<>(s.predicates(term, tokens));
      if (separated) parts.add("(lower(" + column + ") LIKE lower(" + quote("%" + term + "%") + "))");
      if (parts.size() == 1) return "(" + (negated ? "NOT " : "") + parts.get(0) + ")";
      String joined = String.join(" AND ", parts);
      return negated ? "(NOT (" + joined + "))" : "(" + joined + ")";
    });
  }

  static List<String> tokenize(String term) {
    List<String> out = new ArrayList<>();
    for (String t : SEPARATORS.split(term)) {
      if (!t.isEmpty()) out.add(t);
    }
    return out;
  }

  /** Looked up once per serializer; every implicit leaf of a query shares the answer. */
  private synchronized CompletableFuture<Strategy> strategy() {
    if (strategy == null) strategy = chooseStrategy();
    return strategy;
  }

  private CompletableFuture<Strategy> chooseStrategy() {
    if (table.isCte()) return CompletableFuture.completedFuture(new HasToken());
    return metadata.getSkipIndices(table).thenCompose(indices -> {
      SkipIndex text = null;
      for (SkipIndex idx : indices == null ? List.<SkipIndex>of() : indices) {
        if (idx.kind() == SkipIndexType.BLOOM_FILTER && IndexExpressions.isTokensIndexOn(idx.expression(), column)) {
          log.debug("Implicit search strategy=bloom_filter table={} index={}", table.tableName(), idx.name());
          return CompletableFuture.completedFuture((Strategy) new BloomFilter(idx.expression()));
        }
        if (idx.kind() == SkipIndexType.TEXT && text == null && IndexExpressions.isTextIndexOn(idx.expression(), column)) {
          text = idx;
        }
      }
      if (text == null) {
        log.debug("Implicit search strategy=hasToken table={}", table.tableName());
        return CompletableFuture.completedFuture((Strategy) new HasToken());
      }
      SkipIndex textIndex = text;
      return textIndexEnabled().thenApply(enabled -> {
        log.debug("Implicit search strategy={} table={} index={}", enabled ? "text" : "hasToken",
            table.tableName(), textIndex.name());
        return enabled ? new TextIndex(textIndex.expression()) : new HasToken();
      });
    });
  }

  private CompletableFuture<Boolean> textIndexEnabled() {
    return metadata.getSetting(options.textIndexSetting(), table.connectionId()).handle((value, err) -> {
      if (err != null) {
        log.debug("Setting lookup failed, text index disabled setting={} err={}", options.textIndexSetting(),
            err.toString());
        return false;
      }
      return value != null && (value.trim().equals("1") || value.trim().equalsIgnoreCase("true"));
    });
  }

  /** Token groups of at most {@code maxTokensPerCall}; short terms stay whole. */
  private List<String> chunks(String term, List<String> tokens) {
    int max = options.maxTokensPerCall();
    if (tokens.size() <= max) return List.of(term);
    List<String> out = new ArrayList<>();
    for (int i = 0; i < tokens.size(); i += max) {
      out.add(String.join(" ", tokens.subList(i, Math.min(i + max, tokens.size()))));
    }
    return out;
  }

  private interface Strategy {
    List<String> predicates(String term, List<String> tokens);
  }

  private final class HasToken implements Strategy {
    @Override
    public List<String> predicates(String term, List<String> tokens) {
      List<String> out = new ArrayList<>(tokens.size());
      for (String t : tokens) out.add("hasToken(lower(" + column + "), lower(" + quote(t) + "))");
      return out;
    }
  }

  private final class BloomFilter implements Strategy {
    private final String expression;
    private final boolean lower;

    BloomFilter(String expression) {
      this.expression = expression;
      this.lower = IndexExpressions.appliesLower(expression);
    }

    @Override
    public List<String> predicates(String term, List<String> tokens) {
      List<String> out = new ArrayList<>();
      for (String chunk : chunks(term, tokens)) {
        String literal = lower ? "lower(" + quote(chunk) + ")" : quote(chunk);
        out.add("hasAll(" + expression + ", tokens(" + literal + "))");
      }
      return out;
    }
  }

  private final class TextIndex implements Strategy {
    private final String expression;
    private final boolean lower;

    TextIndex(String expression) {
      this.expression = expression;
      this.lower = IndexExpressions.appliesLower(expression);
    }

    @Override
    public List<String> predicates(String term, List<String> tokens) {
      List<String> out = new ArrayList<>();
      for (String chunk : chunks(term, tokens)) {
        String literal = lower ? "lower(" + quote(chunk) + ")" : quote(chunk);
        out.add("hasAllTokens(" + expression + ", " + literal + ")");
      }
      return out;
    }
  }
}
