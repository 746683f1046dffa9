package io.intellixity.sift.query;

/** An operator was applied to a field whose type has no SQL form for it (e.g. a range over an array). */
public final class UnsupportedFieldOperationException extends SearchCompileException {
  private final String field;
  private final String operation;

  public UnsupportedFieldOperationException(String field, String operation, String fieldKind) {
    super("Operation '" + operation + "' is not supported for " + fieldKind + " field '" + field + "'");
    this.field = field;
    this.operation = operation;
  }

  public String field() { return field; }
  public String operation() { return operation; }
}
