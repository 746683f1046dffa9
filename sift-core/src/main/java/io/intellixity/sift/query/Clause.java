package io.intellixity.sift.query;

public enum Clause {
  AND, OR;

  public String sql() { return this == OR ? "OR" : "AND"; }
}
