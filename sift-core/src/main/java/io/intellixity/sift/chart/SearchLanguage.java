package io.intellixity.sift.chart;

import java.util.Locale;

/** Language of a condition string: raw SQL or the search language. */
public enum SearchLanguage {
  SQL, LUCENE;

  public static SearchLanguage of(String raw, SearchLanguage fallback) {
    if (raw == null || raw.isBlank()) return fallback;
    return valueOf(raw.trim().toUpperCase(Locale.ROOT));
  }
}
