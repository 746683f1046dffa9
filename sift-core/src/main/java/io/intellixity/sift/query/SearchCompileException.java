package io.intellixity.sift.query;

/**
 * Raised when a search expression cannot be compiled to SQL.
 * <p>
 * Parsing itself never fails; this is thrown while serializing a parsed tree.
 */
public class SearchCompileException extends RuntimeException {
  public SearchCompileException(String message) {
    super(message);
  }

  public SearchCompileException(String message, Throwable cause) {
    super(message, cause);
  }
}
