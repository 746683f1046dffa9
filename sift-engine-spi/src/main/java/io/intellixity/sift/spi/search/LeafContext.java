package io.intellixity.sift.spi.search;

import io.intellixity.sift.query.TermScope;

/**
 * Where a leaf sits in the tree.
 *
 * @param field    field path, null for implicit searches
 * @param negated  the leaf itself carries {@code -}
 * @param underNot some ancestor is a {@code NOT}
 */
public record LeafContext(String field, TermScope scope, boolean negated, boolean underNot) {
  public boolean implicit() { return scope == TermScope.IMPLICIT; }

  /** Positive leaves only: hints are unsafe once anything above or on the leaf negates it. */
  public boolean hintAllowed() { return !negated && !underNot; }
}
