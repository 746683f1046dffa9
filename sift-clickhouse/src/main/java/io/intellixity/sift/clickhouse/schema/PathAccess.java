package io.intellixity.sift.clickhouse.schema;

import java.util.ArrayList;
import java.util.List;

import static io.intellixity.sift.sql.SqlStrings.quote;
import static io.intellixity.sift.sql.SqlStrings.quotePath;

/**
 * Access to a dotted path below a column or an array element.
 * <p>
 * Maps take the rest of the path as a single key, JSON columns get one quoted sub-column per segment,
 * String columns are read as JSON text and arrays keep the path for their elements.
 */
public final class PathAccess {
  private PathAccess() {}

  /**
   * @param expression SQL reading the value
   * @param mapKey     set when a named map column is indexed by key
   * @param elementPath path applied to each element when {@code type} is an array
   */
  public record Access(String expression, FieldType type, MapKeyHint mapKey, List<String> elementPath) {
    public Access {
      elementPath = elementPath == null ? List.of() : List.copyOf(elementPath);
    }
  }

  /**
   * @param column map column name used for index hints; null below array elements
   * @return null when the base type has no sub-fields
   */
  public static Access descend(FieldType baseType, String baseExpression, String column, List<String> path) {
    return baseType.accept(new Descend(baseExpression, column, path));
  }

  private record Descend(String base, String column, List<String> path) implements FieldTypeVisitor<Access> {
    @Override
    public Access visitString(FieldType.StringType t) {
      List<String> keys = new ArrayList<>(path.size());
      for (String p : path) keys.add(quote(p));
      return new Access("JSONExtractString(" + base + ", " + String.join(", ", keys) + ")",
          FieldType.STRING, null, null);
    }

    @Override
    public Access visitNumber(FieldType.NumberType t) { return null; }

    @Override
    public Access visitBool(FieldType.BoolType t) { return null; }

    @Override
    public Access visitDateTime(FieldType.DateTimeType t) { return null; }

    @Override
    public Access visitJson(FieldType.JsonType t) {
      return new Access(base + "." + quotePath(path), FieldType.JSON, null, null);
    }

    @Override
    public Access visitMap(FieldType.MapType t) {
      String key = String.join(".", path);
      MapKeyHint hint = column == null ? null : new MapKeyHint(column, key);
      return new Access(base + "[" + quote(key) + "]", t.valueType(), hint, null);
    }

    @Override
    public Access visitArray(FieldType.ArrayType t) {
      return new Access(base, t, null, path);
    }
  }
}
