package io.intellixity.sift.sql;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SQL text with ClickHouse-style {@code {name:Type}} placeholders and their values.
 * <p>
 * Placeholder names are a digest of the type and value, so equal values share one parameter, distinct values
 * never do, and rendering is deterministic.
 */
public record ParameterizedSql(String sql, Map<String, SqlParam> params) {
  public static final ParameterizedSql EMPTY = new ParameterizedSql("", Map.of());

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+):(\\w+)}");

  public ParameterizedSql {
    sql = sql == null ? "" : sql;
    params = params == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(params));
  }

  public static ParameterizedSql raw(String sql) {
    return new ParameterizedSql(sql, Map.of());
  }

  public static ParameterizedSql param(SqlParamType type, Object value) {
    String name = paramName(type, value);
    return new ParameterizedSql("{" + name + ":" + type.chName() + "}", Map.of(name, new SqlParam(type, value)));
  }

  public static ParameterizedSql identifier(String name) { return param(SqlParamType.IDENTIFIER, name); }
  public static ParameterizedSql string(String value) { return param(SqlParamType.STRING, value); }
  public static ParameterizedSql int32(int value) { return param(SqlParamType.INT32, value); }
  public static ParameterizedSql int64(long value) { return param(SqlParamType.INT64, value); }
  public static ParameterizedSql float64(double value) { return param(SqlParamType.FLOAT64, value); }

  /** Concatenates parts; each part is a {@link ParameterizedSql} or raw SQL text ({@code toString()}). */
  public static ParameterizedSql of(Object... parts) {
    StringBuilder sb = new StringBuilder();
    Map<String, SqlParam> params = new LinkedHashMap<>();
    for (Object p : parts) {
      if (p == null) continue;
      if (p instanceof ParameterizedSql ps) {
        sb.append(ps.sql());
        merge(params, ps.params());
      } else {
        sb.append(p);
      }
    }
    return new ParameterizedSql(sb.toString(), params);
  }

  /** Joins the non-empty parts with {@code separator}. */
  public static ParameterizedSql join(String separator, List<ParameterizedSql> parts) {
    StringBuilder sb = new StringBuilder();
    Map<String, SqlParam> params = new LinkedHashMap<>();
    for (ParameterizedSql p : parts) {
      if (p == null || p.isEmpty()) continue;
      if (sb.length() > 0) sb.append(separator);
      sb.append(p.sql());
      merge(params, p.params());
    }
    return new ParameterizedSql(sb.toString(), params);
  }

  public boolean isEmpty() { return sql.isBlank(); }

  /** {@code left + sql + right}, or empty when this is empty. */
  public ParameterizedSql wrapIfNotEmpty(String left, String right) {
    return isEmpty() ? EMPTY : new ParameterizedSql(left + sql + right, params);
  }

  /** SQL with every placeholder replaced by its literal value. */
  public String toInlineSql() {
    Matcher m = PLACEHOLDER.matcher(sql);
    StringBuilder sb = new StringBuilder();
    while (m.find()) {
      SqlParam p = params.get(m.group(1));
      String replacement = p == null ? m.group() : p.inline();
      m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
    }
    m.appendTail(sb);
    return sb.toString();
  }

  private static void merge(Map<String, SqlParam> into, Map<String, SqlParam> from) {
    for (Map.Entry<String, SqlParam> e : from.entrySet()) {
      SqlParam prev = into.putIfAbsent(e.getKey(), e.getValue());
      if (prev != null && !prev.equals(e.getValue())) {
        throw new IllegalStateException("Parameter " + e.getKey() + " bound to " + prev + " and " + e.getValue());
      }
    }
  }

  /** {@code PARAM_} followed by the first 128 bits of the SHA-256 of {@code type:value}, in hex. */
  static String paramName(SqlParamType type, Object value) {
    MessageDigest digest;
    try {
      digest = MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
    byte[] hash = digest.digest((type.chName() + ":" + value).getBytes(StandardCharsets.UTF_8));
    return "PARAM_" + HexFormat.of().formatHex(hash, 0, 16);
  }
}
