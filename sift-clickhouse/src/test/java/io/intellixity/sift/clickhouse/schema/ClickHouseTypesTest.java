package io.intellixity.sift.clickhouse.schema;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class ClickHouseTypesTest {

  @Test
  void scalars() {
    assertEquals(FieldType.STRING, ClickHouseTypes.parse("String"));
    assertEquals(FieldType.STRING, ClickHouseTypes.parse("LowCardinality(String)"));
    assertEquals(FieldType.STRING, ClickHouseTypes.parse("FixedString(16)"));
    assertEquals(FieldType.STRING, ClickHouseTypes.parse("UUID"));
    assertEquals(FieldType.NUMBER, ClickHouseTypes.parse("UInt64"));
    assertEquals(FieldType.NUMBER, ClickHouseTypes.parse("Nullable(Float64)"));
    assertEquals(FieldType.NUMBER, ClickHouseTypes.parse("Decimal(18, 4)"));
    assertEquals(FieldType.BOOL, ClickHouseTypes.parse("Bool"));
    assertEquals(new FieldType.DateTimeType(false), ClickHouseTypes.parse("DateTime64(9, 'UTC')"));
    assertEquals(new FieldType.DateTimeType(true), ClickHouseTypes.parse("Date32"));
  }

  @Test
  void containers() {
    assertEquals(new FieldType.MapType(FieldType.STRING),
        ClickHouseTypes.parse("Map(LowCardinality(String), String)"));
    assertEquals(new FieldType.MapType(FieldType.NUMBER), ClickHouseTypes.parse("Map(String, UInt64)"));
    assertEquals(new FieldType.ArrayType(FieldType.STRING),
        ClickHouseTypes.parse("Array(LowCardinality(String))"));
    assertEquals(new FieldType.ArrayType(new FieldType.MapType(FieldType.STRING)),
        ClickHouseTypes.parse("Array(Map(LowCardinality(String), String))"));
    assertEquals(FieldType.JSON, ClickHouseTypes.parse("JSON(max_dynamic_paths = 10)"));
    assertEquals(FieldType.JSON, ClickHouseTypes.parse("Dynamic"));
  }

  @Test
  void unknownOrBlankIsString() {
    assertEquals(FieldType.STRING, ClickHouseTypes.parse(""));
    assertEquals(FieldType.STRING, ClickHouseTypes.parse(null));
    assertEquals(FieldType.STRING, ClickHouseTypes.parse("IPv4"));
  }
}
