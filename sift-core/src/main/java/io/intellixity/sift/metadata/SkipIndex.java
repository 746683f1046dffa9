package io.intellixity.sift.metadata;

/**
 * Skip index as reported by {@code system.data_skipping_indices}.
 *
 * @param expression raw index expression text, kept verbatim
 * @param typeFull   full type including tokenizer arguments, may be null
 */
public record SkipIndex(String name, String type, String typeFull, String expression, long granularity) {
  public SkipIndex {
    expression = expression == null ? "" : expression;
  }

  public SkipIndexType kind() { return SkipIndexType.of(type); }
}
