package io.intellixity.sift.spi.search;

import io.intellixity.sift.spi.exec.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/** Renders a search query as a readable sentence, e.g. {@code 'ServiceName' contains foo}. */
public final class EnglishSearchSerializer extends AbstractSearchSerializer {
  private static final Logger log = LoggerFactory.getLogger(EnglishSearchSerializer.class);

  public static String explain(String query) {
    try {
      return Futures.await(new EnglishSearchSerializer().serialize(query));
    } catch (RuntimeException e) {
      log.debug("explain failed query={}", query, e);
      return "Message containing " + query;
    }
  }

  @Override
  protected CompletableFuture<String> eq(LeafContext leaf, String term) {
    return done(label(leaf) + (leaf.negated() ? " is not " : " is ") + term);
  }

  @Override
  protected CompletableFuture<String> isNotNull(LeafContext leaf) {
    return done(label(leaf) + (leaf.negated() ? " is null" : " is not null"));
  }

  @Override
  protected CompletableFuture<String> compare(LeafContext leaf, ComparisonOperator op, String term) {
    String words = switch (op) {
      case GTE -> "is greater than or equal to";
      case LTE -> "is less than or equal to";
      case GT -> "is greater than";
      case LT -> "is less than";
    };
    return done(label(leaf) + " " + words + " " + term);
  }

  @Override
  protected CompletableFuture<String> range(LeafContext leaf, String low, String high) {
    String field = leaf.implicit() ? "event" : leaf.field();
    return done(field + (leaf.negated() ? " is not" : " is") + " between " + low + " and " + high);
  }

  @Override
  protected CompletableFuture<String> contains(LeafContext leaf, String term, boolean quoted) {
    String shown = quoted ? "\"" + term + "\"" : term;
    if (leaf.implicit()) {
      return done(label(leaf) + (leaf.negated() ? " does not have whole word " : " has whole word ") + shown);
    }
    return done(label(leaf) + (leaf.negated() ? " does not contain " : " contains ") + shown);
  }

  @Override
  protected CompletableFuture<String> like(LeafContext leaf, String term, boolean prefixWildcard,
                                           boolean suffixWildcard) {
    String verb;
    if (prefixWildcard && suffixWildcard) {
      verb = leaf.negated() ? " does not contain " : " contains ";
    } else if (prefixWildcard) {
      verb = leaf.negated() ? " does not end with " : " ends with ";
    } else {
      verb = leaf.negated() ? " does not start with " : " starts with ";
    }
    return done(label(leaf) + verb + term);
  }

  private static String label(LeafContext leaf) {
    return switch (leaf.scope()) {
      case IMPLICIT -> "event";
      case EXPLICIT -> "'" + leaf.field() + "'";
      case GROUPED -> leaf.field();
    };
  }

  private static CompletableFuture<String> done(String s) {
    return CompletableFuture.completedFuture(s);
  }
}
