package io.intellixity.sift.clickhouse.schema;

import java.util.List;
import java.util.Objects;

/**
 * A search field bound to SQL.
 *
 * @param found       false when no column matched and the field name is used as-is
 * @param mapKey      index hint source, null when the field does not read a map key
 * @param elementPath for arrays, the path applied to each element
 */
public record ResolvedField(String field, String expression, FieldType type, boolean found, MapKeyHint mapKey,
                            List<String> elementPath) {
  public ResolvedField {
    Objects.requireNonNull(expression, "expression");
    Objects.requireNonNull(type, "type");
    elementPath = elementPath == null ? List.of() : List.copyOf(elementPath);
  }

  static ResolvedField of(String field, PathAccess.Access access) {
    return new ResolvedField(field, access.expression(), access.type(), true, access.mapKey(),
        access.elementPath());
  }

  public static ResolvedField unresolved(String field) {
    return new ResolvedField(field, field, FieldType.STRING, false, null, List.of());
  }
}
