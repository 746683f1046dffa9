package io.intellixity.sift.query;

/** Node of a parsed search expression tree. Trees are immutable once built. */
public interface SearchElement {
  <R, C> R accept(SearchVisitor<R, C> visitor, C ctx);
}
