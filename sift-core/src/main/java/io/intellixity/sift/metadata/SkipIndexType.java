package io.intellixity.sift.metadata;

import java.util.Locale;

public enum SkipIndexType {
  BLOOM_FILTER, TEXT, TOKENBF_V1, OTHER;

  public static SkipIndexType of(String raw) {
    if (raw == null) return OTHER;
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "bloom_filter" -> BLOOM_FILTER;
      case "text" -> TEXT;
      case "tokenbf_v1" -> TOKENBF_V1;
      default -> OTHER;
    };
  }
}
