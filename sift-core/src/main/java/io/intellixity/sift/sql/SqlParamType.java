package io.intellixity.sift.sql;

/** ClickHouse query parameter types used in {@code {name:Type}} placeholders. */
public enum SqlParamType {
  IDENTIFIER("Identifier"),
  STRING("String"),
  INT32("Int32"),
  INT64("Int64"),
  FLOAT64("Float64");

  private final String chName;

  SqlParamType(String chName) {
    this.chName = chName;
  }

  public String chName() { return chName; }
}
