package io.intellixity.sift.query;

import java.util.Objects;

/** Unary NOT over a subtree. Negation stays at this node; it is never pushed into the children. */
public final class NotElement implements SearchElement {
  private final SearchElement element;

  public NotElement(SearchElement element) {
    this.element = Objects.requireNonNull(element, "element");
  }

  public SearchElement element() { return element; }

  @Override
  public <R, C> R accept(SearchVisitor<R, C> visitor, C ctx) { return visitor.visit(this, ctx); }

  @Override
  public String toString() { return "Not{" + element + "}"; }
}
