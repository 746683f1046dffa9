package io.intellixity.sift.spi.search;

import io.intellixity.sift.query.*;
import io.intellixity.sift.spi.exec.Futures;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Walks a parsed search tree and delegates each leaf to an operator hook.
 * <p>
 * Layout is shared by every target: groups join their children with {@code AND}/{@code OR} and keep
 * the parentheses the user wrote; {@code NOT} prefixes its subtree and is never distributed.
 * Subclasses render leaves.
 */
public abstract class AbstractSearchSerializer {
  private final SearchVisitor<CompletableFuture<String>, Boolean> visitor = new TreeVisitor();

  /** Parses and serializes {@code query}; a blank query yields an empty string. */
  public CompletableFuture<String> serialize(String query) {
    SearchElement root = SearchQueryParser.parse(query);
    if (root == null) return CompletableFuture.completedFuture("");
    return serialize(root);
  }

  public CompletableFuture<String> serialize(SearchElement root) {
    return root.accept(visitor, Boolean.FALSE);
  }

  protected abstract CompletableFuture<String> eq(LeafContext leaf, String term);

  protected abstract CompletableFuture<String> isNotNull(LeafContext leaf);

  /** {@code op} already accounts for the leaf's negation. */
  protected abstract CompletableFuture<String> compare(LeafContext leaf, ComparisonOperator op, String term);

  protected abstract CompletableFuture<String> range(LeafContext leaf, String low, String high);

  /** Substring/token search; {@code quoted} marks a phrase. */
  protected abstract CompletableFuture<String> contains(LeafContext leaf, String term, boolean quoted);

  /** Anchored wildcard search on implicit or grouped leaves. */
  protected abstract CompletableFuture<String> like(LeafContext leaf, String term, boolean prefixWildcard,
                                                    boolean suffixWildcard);

  protected CompletableFuture<String> term(Term t, boolean underNot) {
    LeafContext leaf = new LeafContext(t.field(), t.scope(), t.negated(), underNot);
    if (t.existence()) return isNotNull(leaf);
    if (t.quoted() && t.scope() == TermScope.EXPLICIT) return eq(leaf, t.value());

    if (!t.quoted() && !t.prefixWildcard() && !t.suffixWildcard()) {
      ComparisonOperator op = ComparisonOperator.prefixOf(t.value());
      if (op != null) {
        String operand = t.value().substring(op.symbol().length());
        return compare(leaf, t.negated() ? op.complement() : op, operand);
      }
    }

    boolean wildcard = !t.quoted() && (t.prefixWildcard() || t.suffixWildcard());
    if (wildcard && t.scope() != TermScope.EXPLICIT) {
      return like(leaf, t.value(), t.prefixWildcard(), t.suffixWildcard());
    }
    return contains(leaf, t.value(), t.quoted());
  }

  protected CompletableFuture<String> rangeTerm(RangeTerm r, boolean underNot) {
    LeafContext leaf = new LeafContext(r.field(), r.scope(), r.negated(), underNot);
    if (r.lowUnbounded() && r.highUnbounded()) return isNotNull(leaf);
    if (r.lowUnbounded()) {
      ComparisonOperator op = r.negated() ? ComparisonOperator.LTE.complement() : ComparisonOperator.LTE;
      return compare(leaf, op, r.high());
    }
    if (r.highUnbounded()) {
      ComparisonOperator op = r.negated() ? ComparisonOperator.GTE.complement() : ComparisonOperator.GTE;
      return compare(leaf, op, r.low());
    }
    return range(leaf, r.low(), r.high());
  }

  private final class TreeVisitor implements SearchVisitor<CompletableFuture<String>, Boolean> {
    @Override
    public CompletableFuture<String> visit(Term term, Boolean underNot) {
      return term(term, underNot);
    }

    @Override
    public CompletableFuture<String> visit(RangeTerm range, Boolean underNot) {
      return rangeTerm(range, underNot);
    }

    @Override
    public CompletableFuture<String> visit(LogicalGroup group, Boolean underNot) {
      List<CompletableFuture<String>> children = new ArrayList<>();
      for (SearchElement el : group.elements()) children.add(el.accept(this, underNot));
      String sep = " " + group.clause().sql() + " ";
      return Futures.allOf(children).thenApply(parts -> {
        List<String> nonBlank = new ArrayList<>();
        for (String p : parts) if (p != null && !p.isBlank()) nonBlank.add(p);
        String joined = String.join(sep, nonBlank);
        return group.parenthesized() ? "(" + joined + ")" : joined;
      });
    }

    @Override
    public CompletableFuture<String> visit(NotElement not, Boolean underNot) {
      return not.element().accept(this, Boolean.TRUE).thenApply(s -> "NOT " + s);
    }
  }
}
