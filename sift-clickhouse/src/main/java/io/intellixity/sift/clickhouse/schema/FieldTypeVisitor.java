package io.intellixity.sift.clickhouse.schema;

public interface FieldTypeVisitor<R> {
  R visitString(FieldType.StringType t);

  R visitNumber(FieldType.NumberType t);

  R visitBool(FieldType.BoolType t);

  R visitDateTime(FieldType.DateTimeType t);

  R visitJson(FieldType.JsonType t);

  R visitMap(FieldType.MapType t);

  R visitArray(FieldType.ArrayType t);
}
