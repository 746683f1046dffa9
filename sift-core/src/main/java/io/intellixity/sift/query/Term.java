package io.intellixity.sift.query;

import java.util.Objects;

/**
 * Leaf term. {@code value} has leading/trailing wildcards stripped; the flags record them.
 * A bare {@code *} is stored as an empty value with both wildcard flags set.
 */
public record Term(String field, String value, TermScope scope, boolean quoted,
                   boolean prefixWildcard, boolean suffixWildcard, boolean negated) implements SearchElement {
  public enum Kind { TERM, PHRASE, FIELDED_TERM, FIELDED_PHRASE }

  public Term {
    value = value == null ? "" : value;
    scope = Objects.requireNonNull(scope, "scope");
    if (scope == TermScope.IMPLICIT) field = null;
    else Objects.requireNonNull(field, "field");
  }

  public static Term implicit(String value) {
    return new Term(null, value, TermScope.IMPLICIT, false, false, false, false);
  }

  public static Term fielded(String field, String value) {
    return new Term(field, value, TermScope.EXPLICIT, false, false, false, false);
  }

  public Kind kind() {
    if (scope == TermScope.IMPLICIT) return quoted ? Kind.PHRASE : Kind.TERM;
    return quoted ? Kind.FIELDED_PHRASE : Kind.FIELDED_TERM;
  }

  public boolean implicit() { return scope == TermScope.IMPLICIT; }

  public boolean existence() { return !quoted && value.isEmpty() && prefixWildcard && suffixWildcard; }

  public Term negate() {
    return new Term(field, value, scope, quoted, prefixWildcard, suffixWildcard, !negated);
  }

  @Override
  public <R, C> R accept(SearchVisitor<R, C> visitor, C ctx) { return visitor.visit(this, ctx); }
}
