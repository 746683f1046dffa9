package io.intellixity.sift.clickhouse;

import java.util.Properties;

/**
 * Tunables for ClickHouse compilation.
 *
 * @param textIndexSetting       server setting that must be {@code 1}/{@code true} before text indices are used
 * @param maxTokensPerCall       most tokens passed to one {@code hasAll}/{@code hasAllTokens} call
 * @param autoGranularityBuckets bucket count {@code granularity: auto} aims for
 */
public record ClickHouseDialectOptions(String textIndexSetting, int maxTokensPerCall, int autoGranularityBuckets) {
  public static final String TEXT_INDEX_SETTING = "sift.clickhouse.textIndexSetting";
  public static final String MAX_TOKENS_PER_CALL = "sift.clickhouse.maxTokensPerCall";
  public static final String AUTO_GRANULARITY_BUCKETS = "sift.clickhouse.autoGranularityBuckets";

  public ClickHouseDialectOptions {
    if (textIndexSetting == null || textIndexSetting.isBlank()) {
      throw new IllegalArgumentException(TEXT_INDEX_SETTING + " must not be blank");
    }
    if (maxTokensPerCall < 1) throw new IllegalArgumentException(MAX_TOKENS_PER_CALL + " must be >= 1");
    if (autoGranularityBuckets < 1) throw new IllegalArgumentException(AUTO_GRANULARITY_BUCKETS + " must be >= 1");
  }

  public static ClickHouseDialectOptions defaults() {
    return new ClickHouseDialectOptions("enable_full_text_index", 50, 60);
  }

  /** Reads overrides from {@code props}; absent keys keep their defaults. */
  public static ClickHouseDialectOptions fromProperties(Properties props) {
    ClickHouseDialectOptions d = defaults();
    return new ClickHouseDialectOptions(
        props.getProperty(TEXT_INDEX_SETTING, d.textIndexSetting()).trim(),
        intProperty(props, MAX_TOKENS_PER_CALL, d.maxTokensPerCall()),
        intProperty(props, AUTO_GRANULARITY_BUCKETS, d.autoGranularityBuckets()));
  }

  private static int intProperty(Properties props, String key, int def) {
    String raw = props.getProperty(key);
    if (raw == null || raw.isBlank()) return def;
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid integer for " + key + ": " + raw, e);
    }
  }
}
