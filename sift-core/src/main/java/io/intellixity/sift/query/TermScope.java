package io.intellixity.sift.query;

/** How a leaf got its field. */
public enum TermScope {
  /** No field; searched against the implicit column expression. */
  IMPLICIT,
  /** Written as {@code field:value}. */
  EXPLICIT,
  /** Inherited from an enclosing {@code field:( ... )} group. */
  GROUPED
}
