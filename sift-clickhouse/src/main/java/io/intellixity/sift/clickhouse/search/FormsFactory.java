package io.intellixity.sift.clickhouse.search;

import io.intellixity.sift.clickhouse.schema.FieldType;
import io.intellixity.sift.clickhouse.schema.FieldTypeVisitor;

import java.util.List;

final class FormsFactory implements FieldTypeVisitor<PredicateForms> {
  private final String field;
  private final String expression;
  private final List<String> elementPath;
  private final int depth;

  FormsFactory(String field, String expression, List<String> elementPath, int depth) {
    this.field = field;
    this.expression = expression;
    this.elementPath = elementPath;
    this.depth = depth;
  }

  @Override
  public PredicateForms visitString(FieldType.StringType t) { return new PredicateForms.StringForms(expression); }

  @Override
  public PredicateForms visitNumber(FieldType.NumberType t) { return new PredicateForms.NumberForms(expression); }

  @Override
  public PredicateForms visitBool(FieldType.BoolType t) { return new PredicateForms.BoolForms(expression); }

  @Override
  public PredicateForms visitDateTime(FieldType.DateTimeType t) {
    return new PredicateForms.DateTimeForms(expression);
  }

  @Override
  public PredicateForms visitJson(FieldType.JsonType t) { return new PredicateForms.JsonForms(expression); }

  @Override
  public PredicateForms visitMap(FieldType.MapType t) { return new PredicateForms.MapForms(field, expression); }

  @Override
  public PredicateForms visitArray(FieldType.ArrayType t) {
    return new PredicateForms.ArrayForms(field, expression, t.elementType(), elementPath, depth);
  }
}
