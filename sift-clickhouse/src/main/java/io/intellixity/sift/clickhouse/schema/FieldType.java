package io.intellixity.sift.clickhouse.schema;

import java.util.Objects;

/** The shape of a ClickHouse column as far as search compilation is concerned. */
public sealed interface FieldType
    permits FieldType.StringType, FieldType.NumberType, FieldType.BoolType, FieldType.DateTimeType,
    FieldType.JsonType, FieldType.MapType, FieldType.ArrayType {

  StringType STRING = new StringType();
  NumberType NUMBER = new NumberType();
  BoolType BOOL = new BoolType();
  JsonType JSON = new JsonType();

  <R> R accept(FieldTypeVisitor<R> v);

  /** Scalars compare directly against a literal. */
  default boolean scalar() { return false; }

  record StringType() implements FieldType {
    @Override public <R> R accept(FieldTypeVisitor<R> v) { return v.visitString(this); }
    @Override public boolean scalar() { return true; }
  }

  record NumberType() implements FieldType {
    @Override public <R> R accept(FieldTypeVisitor<R> v) { return v.visitNumber(this); }
    @Override public boolean scalar() { return true; }
  }

  record BoolType() implements FieldType {
    @Override public <R> R accept(FieldTypeVisitor<R> v) { return v.visitBool(this); }
    @Override public boolean scalar() { return true; }
  }

  /** @param dateOnly {@code Date}/{@code Date32} rather than a {@code DateTime} variant */
  record DateTimeType(boolean dateOnly) implements FieldType {
    @Override public <R> R accept(FieldTypeVisitor<R> v) { return v.visitDateTime(this); }
    @Override public boolean scalar() { return true; }
  }

  record JsonType() implements FieldType {
    @Override public <R> R accept(FieldTypeVisitor<R> v) { return v.visitJson(this); }
  }

  record MapType(FieldType valueType) implements FieldType {
    public MapType {
      Objects.requireNonNull(valueType, "valueType");
    }

    @Override public <R> R accept(FieldTypeVisitor<R> v) { return v.visitMap(this); }
  }

  record ArrayType(FieldType elementType) implements FieldType {
    public ArrayType {
      Objects.requireNonNull(elementType, "elementType");
    }

    @Override public <R> R accept(FieldTypeVisitor<R> v) { return v.visitArray(this); }
  }
}
