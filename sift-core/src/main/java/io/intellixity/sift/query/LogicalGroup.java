package io.intellixity.sift.query;

import java.util.*;

public final class LogicalGroup implements SearchElement {
  private final Clause clause;
  private final List<SearchElement> elements;
  private final boolean parenthesized;

  public LogicalGroup(Clause clause, List<SearchElement> elements, boolean parenthesized) {
    this.clause = Objects.requireNonNull(clause, "clause");
    this.elements = List.copyOf(elements == null ? List.of() : elements);
    this.parenthesized = parenthesized;
  }

  public Clause clause() { return clause; }
  public List<SearchElement> elements() { return elements; }
  /** True when the group was written with explicit parentheses. */
  public boolean parenthesized() { return parenthesized; }

  LogicalGroup withParentheses() {
    return parenthesized ? this : new LogicalGroup(clause, elements, true);
  }

  @Override
  public <R, C> R accept(SearchVisitor<R, C> visitor, C ctx) { return visitor.visit(this, ctx); }

  @Override
  public String toString() {
    return "LogicalGroup{" + clause + (parenthesized ? ", ()" : "") + ", " + elements + "}";
  }
}
