package io.intellixity.sift.clickhouse.search;

import io.intellixity.sift.clickhouse.schema.FieldType;
import io.intellixity.sift.clickhouse.schema.PathAccess;
import io.intellixity.sift.query.UnsupportedFieldOperationException;
import io.intellixity.sift.spi.search.ComparisonOperator;

import java.util.List;
import java.util.Locale;

import static io.intellixity.sift.sql.SqlStrings.numberOrQuoted;
import static io.intellixity.sift.sql.SqlStrings.quote;

/**
 * Predicate SQL for one field type. Results carry no outer parentheses or index hints.
 */
interface PredicateForms {
  String eq(String term, boolean negated);

  String contains(String term, boolean negated);

  String like(String term, boolean prefixWildcard, boolean suffixWildcard, boolean negated);

  String isNotNull(boolean negated);

  String compare(ComparisonOperator op, String term);

  String between(String low, String high, boolean negated);

  /** Literal compared against this type, used for array membership. */
  default String literal(String term) { return quote(term); }

  static PredicateForms of(String field, String expression, FieldType type, List<String> elementPath) {
    return type.accept(new FormsFactory(field, expression, elementPath, 0));
  }

  static String likePattern(String term, boolean prefixWildcard, boolean suffixWildcard) {
    return (prefixWildcard ? "%" : "") + term + (suffixWildcard ? "%" : "");
  }

  final class StringForms implements PredicateForms {
    private final String expr;

    StringForms(String expr) { this.expr = expr; }

    @Override
    public String eq(String term, boolean negated) {
      return expr + (negated ? " != " : " = ") + quote(term);
    }

    @Override
    public String contains(String term, boolean negated) {
      return expr + (negated ? " NOT ILIKE " : " ILIKE ") + quote("%" + term + "%");
    }

    @Override
    public String like(String term, boolean prefixWildcard, boolean suffixWildcard, boolean negated) {
      return "lower(" + expr + ")" + (negated ? " NOT LIKE " : " LIKE ")
          + "lower(" + quote(likePattern(term, prefixWildcard, suffixWildcard)) + ")";
    }

    @Override
    public String isNotNull(boolean negated) {
      return "notEmpty(" + expr + ")" + (negated ? " != 1" : " = 1");
    }

    @Override
    public String compare(ComparisonOperator op, String term) {
      return expr + " " + op.symbol() + " " + quote(term);
    }

    @Override
    public String between(String low, String high, boolean negated) {
      return expr + (negated ? " NOT BETWEEN " : " BETWEEN ") + numberOrQuoted(low) + " AND " + numberOrQuoted(high);
    }
  }

  final class NumberForms implements PredicateForms {
    private final String expr;

    NumberForms(String expr) { this.expr = expr; }

    @Override
    public String eq(String term, boolean negated) {
      return expr + (negated ? " != " : " = ") + literal(term);
    }

    @Override
    public String contains(String term, boolean negated) { return eq(term, negated); }

    @Override
    public String like(String term, boolean prefixWildcard, boolean suffixWildcard, boolean negated) {
      return eq(term, negated);
    }

    @Override
    public String isNotNull(boolean negated) {
      return (negated ? "isNull(" : "isNotNull(") + expr + ")";
    }

    @Override
    public String compare(ComparisonOperator op, String term) {
      return expr + " " + op.symbol() + " " + quote(term);
    }

    @Override
    public String between(String low, String high, boolean negated) {
      return expr + (negated ? " NOT BETWEEN " : " BETWEEN ") + numberOrQuoted(low) + " AND " + numberOrQuoted(high);
    }

    @Override
    public String literal(String term) { return "CAST(" + quote(term) + ", 'Float64')"; }
  }

  final class BoolForms implements PredicateForms {
    private final String expr;

    BoolForms(String expr) { this.expr = expr; }

    @Override
    public String eq(String term, boolean negated) {
      return expr + (negated ? " != " : " = ") + literal(term);
    }

    @Override
    public String contains(String term, boolean negated) { return eq(term, negated); }

    @Override
    public String like(String term, boolean prefixWildcard, boolean suffixWildcard, boolean negated) {
      return eq(term, negated);
    }

    @Override
    public String isNotNull(boolean negated) {
      return (negated ? "isNull(" : "isNotNull(") + expr + ")";
    }

    @Override
    public String compare(ComparisonOperator op, String term) {
      return expr + " " + op.symbol() + " " + literal(term);
    }

    @Override
    public String between(String low, String high, boolean negated) {
      return expr + (negated ? " NOT BETWEEN " : " BETWEEN ") + literal(low) + " AND " + literal(high);
    }

    @Override
    public String literal(String term) {
      String t = term.trim().toLowerCase(Locale.ROOT);
      return t.equals("true") || t.equals("1") ? "1" : "0";
    }
  }

  final class DateTimeForms implements PredicateForms {
    private final String expr;

    DateTimeForms(String expr) { this.expr = expr; }

    @Override
    public String eq(String term, boolean negated) {
      return expr + (negated ? " != " : " = ") + quote(term);
    }

    @Override
    public String contains(String term, boolean negated) {
      return "toString(" + expr + ")" + (negated ? " NOT ILIKE " : " ILIKE ") + quote("%" + term + "%");
    }

    @Override
    public String like(String term, boolean prefixWildcard, boolean suffixWildcard, boolean negated) {
      return "lower(toString(" + expr + "))" + (negated ? " NOT LIKE " : " LIKE ")
          + "lower(" + quote(likePattern(term, prefixWildcard, suffixWildcard)) + ")";
    }

    @Override
    public String isNotNull(boolean negated) {
      return (negated ? "isNull(" : "isNotNull(") + expr + ")";
    }

    @Override
    public String compare(ComparisonOperator op, String term) {
      return expr + " " + op.symbol() + " " + quote(term);
    }

    @Override
    public String between(String low, String high, boolean negated) {
      return expr + (negated ? " NOT BETWEEN " : " BETWEEN ") + numberOrQuoted(low) + " AND " + numberOrQuoted(high);
    }
  }

  /** JSON sub-columns: text operators read {@code toString(x)}, numeric ones guard on {@code dynamicType}. */
  final class JsonForms implements PredicateForms {
    static final String NUMBER_TYPES = "'Int8', 'Int16', 'Int32', 'Int64', 'Int128', 'Int256', "
        + "'UInt8', 'UInt16', 'UInt32', 'UInt64', 'UInt128', 'UInt256', 'Float32', 'Float64'";

    private final String target;
    private final StringForms text;

    JsonForms(String target) {
      this.target = target;
      this.text = new StringForms("toString(" + target + ")");
    }

    @Override
    public String eq(String term, boolean negated) { return text.eq(term, negated); }

    @Override
    public String contains(String term, boolean negated) { return text.contains(term, negated); }

    @Override
    public String like(String term, boolean prefixWildcard, boolean suffixWildcard, boolean negated) {
      return text.like(term, prefixWildcard, suffixWildcard, negated);
    }

    @Override
    public String isNotNull(boolean negated) { return text.isNotNull(negated); }

    @Override
    public String compare(ComparisonOperator op, String term) {
      return numericGuard() + " " + op.symbol() + " " + quote(term);
    }

    @Override
    public String between(String low, String high, boolean negated) {
      return numericGuard() + (negated ? " NOT BETWEEN " : " BETWEEN ")
          + numberOrQuoted(low) + " AND " + numberOrQuoted(high);
    }

    private String numericGuard() {
      return "dynamicType(" + target + ") in (" + NUMBER_TYPES + ") and " + target;
    }
  }

  /** A whole map searched by value. */
  final class MapForms implements PredicateForms {
    private final String field;
    private final String expr;

    MapForms(String field, String expr) {
      this.field = field;
      this.expr = expr;
    }

    @Override
    public String eq(String term, boolean negated) {
      return (negated ? "NOT " : "") + "has(mapValues(" + expr + "), " + quote(term) + ")";
    }

    @Override
    public String contains(String term, boolean negated) {
      return (negated ? "NOT " : "") + "arrayExists(v -> v ILIKE " + quote("%" + term + "%")
          + ", mapValues(" + expr + "))";
    }

    @Override
    public String like(String term, boolean prefixWildcard, boolean suffixWildcard, boolean negated) {
      return (negated ? "NOT " : "") + "arrayExists(v -> lower(v) LIKE lower("
          + quote(likePattern(term, prefixWildcard, suffixWildcard)) + "), mapValues(" + expr + "))";
    }

    @Override
    public String isNotNull(boolean negated) {
      return "notEmpty(" + expr + ")" + (negated ? " != 1" : " = 1");
    }

    @Override
    public String compare(ComparisonOperator op, String term) {
      throw new UnsupportedFieldOperationException(field, op.symbol(), "map-typed");
    }

    @Override
    public String between(String low, String high, boolean negated) {
      throw new UnsupportedFieldOperationException(field, "range", "map-typed");
    }
  }

  /**
   * Arrays match when any element does. Scalar elements use {@code has}; anything else goes through
   * {@code arrayExists} with the element predicate, negation staying outside the lambda.
   */
  final class ArrayForms implements PredicateForms {
    private final String field;
    private final String expr;
    private final FieldType elementType;
    private final List<String> elementPath;
    private final String var;
    private final int depth;

    ArrayForms(String field, String expr, FieldType elementType, List<String> elementPath, int depth) {
      this.field = field;
      this.expr = expr;
      this.elementType = elementType;
      this.elementPath = elementPath;
      this.depth = depth;
      this.var = depth == 0 ? "el" : "el" + (depth + 1);
    }

    @Override
    public String eq(String term, boolean negated) {
      if (elementPath.isEmpty() && elementType.scalar()) {
        return not(negated, "has(" + expr + ", " + element().literal(term) + ")");
      }
      return not(negated, exists(element().eq(term, false)));
    }

    @Override
    public String contains(String term, boolean negated) {
      if (elementPath.isEmpty() && (elementType instanceof FieldType.NumberType
          || elementType instanceof FieldType.BoolType)) {
        return eq(term, negated);
      }
      return not(negated, exists(element().contains(term, false)));
    }

    @Override
    public String like(String term, boolean prefixWildcard, boolean suffixWildcard, boolean negated) {
      return not(negated, exists(element().like(term, prefixWildcard, suffixWildcard, false)));
    }

    @Override
    public String isNotNull(boolean negated) {
      if (elementPath.isEmpty()) return "notEmpty(" + expr + ")" + (negated ? " != 1" : " = 1");
      return not(negated, exists(element().isNotNull(false)));
    }

    @Override
    public String compare(ComparisonOperator op, String term) {
      throw new UnsupportedFieldOperationException(field, op.symbol(), "array-typed");
    }

    @Override
    public String between(String low, String high, boolean negated) {
      throw new UnsupportedFieldOperationException(field, "range", "array-typed");
    }

    private String exists(String predicate) {
      return "arrayExists(" + var + " -> " + predicate + ", " + expr + ")";
    }

    private static String not(boolean negated, String sql) {
      return negated ? "NOT " + sql : sql;
    }

    private PredicateForms element() {
      if (elementPath.isEmpty()) {
        return elementType.accept(new FormsFactory(field, var, List.of(), depth + 1));
      }
      PathAccess.Access access = PathAccess.descend(elementType, var, null, elementPath);
      if (access == null) {
        throw new UnsupportedFieldOperationException(field, "nested access", "array-typed");
      }
      return access.type().accept(new FormsFactory(field, access.expression(), access.elementPath(), depth + 1));
    }
  }
}
