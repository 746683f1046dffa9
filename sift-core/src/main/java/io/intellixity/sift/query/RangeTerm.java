package io.intellixity.sift.query;

import java.util.Objects;

/** {@code field:[low TO high]}; a {@code *} bound means unbounded on that side. */
public record RangeTerm(String field, String low, String high, boolean lowInclusive, boolean highInclusive,
                        TermScope scope, boolean negated) implements SearchElement {
  public RangeTerm {
    low = Objects.requireNonNull(low, "low");
    high = Objects.requireNonNull(high, "high");
    scope = Objects.requireNonNull(scope, "scope");
    if (scope == TermScope.IMPLICIT) field = null;
  }

  public boolean lowUnbounded() { return "*".equals(low); }
  public boolean highUnbounded() { return "*".equals(high); }

  @Override
  public <R, C> R accept(SearchVisitor<R, C> visitor, C ctx) { return visitor.visit(this, ctx); }
}
