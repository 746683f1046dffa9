package io.intellixity.sift.clickhouse.schema;

import io.intellixity.sift.sql.SqlStrings;

import java.util.List;
import java.util.regex.Pattern;

/** Maps raw ClickHouse type names onto {@link FieldType}. */
public final class ClickHouseTypes {
  private static final Pattern NUMERIC = Pattern.compile("(U?Int\\d+|Float\\d+|BFloat16|Decimal(\\d+)?(\\(.*\\))?)");

  private ClickHouseTypes() {}

  /** Unknown and textual types (String, FixedString, Enum, UUID, IPv4, ...) map to {@link FieldType#STRING}. */
  public static FieldType parse(String rawType) {
    String t = unwrap(rawType == null ? "" : rawType.trim());
    if (t.startsWith("Array(")) return new FieldType.ArrayType(parse(inner(t)));
    if (t.equals("Array")) return new FieldType.ArrayType(FieldType.STRING);
    if (t.startsWith("Map(")) {
      List<String> args = SqlStrings.splitTopLevel(inner(t));
      return new FieldType.MapType(args.size() == 2 ? parse(args.get(1)) : FieldType.STRING);
    }
    if (t.equals("Map")) return new FieldType.MapType(FieldType.STRING);
    if (t.startsWith("JSON") || t.startsWith("Object(") || t.equals("Dynamic")) return FieldType.JSON;
    if (t.equals("Bool") || t.equals("Boolean")) return FieldType.BOOL;
    if (NUMERIC.matcher(t).matches()) return FieldType.NUMBER;
    if (t.startsWith("DateTime")) return new FieldType.DateTimeType(false);
    if (t.startsWith("Date")) return new FieldType.DateTimeType(true);
    return FieldType.STRING;
  }

  private static String unwrap(String t) {
    String cur = t;
    while (cur.startsWith("LowCardinality(") || cur.startsWith("Nullable(")) {
      cur = inner(cur).trim();
    }
    return cur;
  }

  private static String inner(String t) {
    int open = t.indexOf('(');
    int close = t.lastIndexOf(')');
    if (open < 0 || close <= open) return "";
    return t.substring(open + 1, close);
  }
}
