package io.intellixity.sift.chart;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.*;
import io.intellixity.sift.query.Clause;

import java.io.IOException;
import java.time.Instant;
import java.util.*;

/** JSON deserializer for {@link ChartConfig}. The internal {@code with} list is not read from JSON. */
public final class ChartConfigJsonDeserializer extends JsonDeserializer<ChartConfig> {
  @Override
  public ChartConfig deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new ChartConfigException("ChartConfig JSON must be an object");

    ChartConfig.Builder b = ChartConfig.builder();

    b.select(parseSelectList(root.get("select")));
    JsonNode from = root.get("from");
    if (from == null || !from.isObject()) {
      throw new ChartConfigException("ChartConfig requires from {databaseName, tableName}");
    }
    b.from(textOrNull(from.get("databaseName")), textOrNull(from.get("tableName")));

    JsonNode where = root.get("where");
    if (where != null && where.isObject()) {
      b.where(textOrNull(where.get("condition")));
      b.whereLanguage(SearchLanguage.of(textOrNull(where.get("language")), SearchLanguage.SQL));
    } else {
      b.where(textOrNull(where));
      b.whereLanguage(SearchLanguage.of(textOrNull(root.get("whereLanguage")), SearchLanguage.SQL));
    }

    JsonNode filters = root.get("filters");
    if (filters != null && filters.isArray()) {
      List<Filter> out = new ArrayList<>();
      for (JsonNode f : filters) out.add(parseFilter(f));
      b.filters(out);
    }
    String op = textOrNull(root.get("filtersLogicalOperator"));
    if (op != null) {
      try {
        b.filtersLogicalOperator(Clause.valueOf(op.toUpperCase(Locale.ROOT)));
      } catch (IllegalArgumentException e) {
        throw new ChartConfigException("Unknown filtersLogicalOperator: " + op, e);
      }
    }

    JsonNode groupBy = root.get("groupBy");
    if (groupBy != null && !groupBy.isNull()) b.groupBy(parseSelectList(groupBy));
    b.orderBy(parseOrderBy(root.get("orderBy")));

    b.having(textOrNull(root.get("having")));
    b.havingLanguage(SearchLanguage.of(textOrNull(root.get("havingLanguage")), SearchLanguage.SQL));

    JsonNode limit = root.get("limit");
    if (limit != null && limit.isObject()) {
      b.limit(new Limit(intOrNull(limit.get("limit")), intOrNull(limit.get("offset"))));
    }

    JsonNode range = root.get("dateRange");
    if (range != null && range.isArray() && range.size() == 2) {
      b.dateRange(new DateRange(instant(range.get(0)), instant(range.get(1))));
    }
    b.dateRangeStartInclusive(boolOrDefault(root.get("dateRangeStartInclusive"), true));
    b.dateRangeEndInclusive(boolOrDefault(root.get("dateRangeEndInclusive"), true));

    b.granularity(textOrNull(root.get("granularity")));
    b.timestampValueExpression(textOrNull(root.get("timestampValueExpression")));
    b.implicitColumnExpression(textOrNull(root.get("implicitColumnExpression")));
    String connection = textOrNull(root.get("connection"));
    b.connectionId(connection != null ? connection : textOrNull(root.get("connectionId")));

    JsonNode metricTables = root.get("metricTables");
    if (metricTables != null && metricTables.isObject()) {
      b.metricTables(new MetricTables(
          textOrNull(metricTables.get("gauge")),
          textOrNull(metricTables.get("sum")),
          textOrNull(metricTables.get("histogram"))));
    }

    String returnType = textOrNull(root.get("seriesReturnType"));
    if (returnType != null) b.seriesReturnType(SeriesReturnType.valueOf(returnType.toUpperCase(Locale.ROOT)));

    JsonNode settings = root.get("settings");
    if (settings != null && settings.isArray()) {
      List<String> out = new ArrayList<>();
      for (JsonNode s : settings) if (s.isTextual()) out.add(s.asText());
      b.settings(out);
    } else if (settings != null && settings.isTextual()) {
      b.settings(List.of(settings.asText()));
    }
    b.fillGaps(boolOrDefault(root.get("fillGaps"), true));
    b.selectGroupBy(boolOrDefault(root.get("selectGroupBy"), true));

    return b.build();
  }

  private static SelectList parseSelectList(JsonNode n) {
    if (n == null || n.isNull()) throw new ChartConfigException("ChartConfig requires select");
    if (n.isTextual()) return SelectList.raw(n.asText());
    if (!n.isArray()) throw new ChartConfigException("select must be a string or an array");
    List<SelectItem> items = new ArrayList<>();
    for (JsonNode x : n) {
      if (x.isTextual()) {
        items.add(SelectItem.expression(x.asText()));
      } else if (x.isObject()) {
        items.add(parseSelectItem(x));
      }
    }
    return SelectList.of(items);
  }

  private static SelectItem parseSelectItem(JsonNode x) {
    String language = textOrNull(x.get("aggConditionLanguage"));
    JsonNode level = x.get("level");
    return new SelectItem(
        textOrNull(x.get("aggFn")),
        textOrNull(x.get("valueExpression")),
        textOrNull(x.get("alias")),
        textOrNull(x.get("aggCondition")),
        language == null ? null : SearchLanguage.of(language, SearchLanguage.SQL),
        level == null || level.isNull() ? null : level.asDouble(),
        MetricType.of(textOrNull(x.get("metricType"))),
        textOrNull(x.get("metricName")));
  }

  private static Filter parseFilter(JsonNode f) {
    String type = f == null ? null : textOrNull(f.get("type"));
    if (type == null) throw new UnknownFilterTypeException("null");
    return switch (type) {
      case "sql" -> new Filter.SqlFilter(textOrNull(f.get("condition")));
      case "lucene" -> new Filter.LuceneFilter(textOrNull(f.get("condition")));
      case "sql_ast" -> new Filter.SqlAstFilter(
          textOrNull(f.get("left")), textOrNull(f.get("operator")), textOrNull(f.get("right")));
      default -> throw new UnknownFilterTypeException(type);
    };
  }

  private static List<SortSpecification> parseOrderBy(JsonNode n) {
    if (n == null || n.isNull()) return List.of();
    if (n.isTextual()) return n.asText().isBlank() ? List.of() : List.of(SortSpecification.raw(n.asText()));
    List<SortSpecification> out = new ArrayList<>();
    if (!n.isArray()) return out;
    for (JsonNode s : n) {
      if (s.isTextual()) {
        out.add(SortSpecification.raw(s.asText()));
        continue;
      }
      String expr = textOrNull(s.get("valueExpression"));
      if (expr == null) continue;
      String ordering = textOrNull(s.get("ordering"));
      out.add(new SortSpecification(expr,
          ordering == null ? null : SortSpecification.Ordering.valueOf(ordering.toUpperCase(Locale.ROOT))));
    }
    return out;
  }

  private static Instant instant(JsonNode n) {
    if (n.isNumber()) return Instant.ofEpochMilli(n.asLong());
    return Instant.parse(n.asText());
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }

  private static Integer intOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asInt();
  }

  private static boolean boolOrDefault(JsonNode n, boolean def) {
    return (n == null || n.isNull()) ? def : n.asBoolean(def);
  }
}
