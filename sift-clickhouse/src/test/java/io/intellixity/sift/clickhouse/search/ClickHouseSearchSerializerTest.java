package io.intellixity.sift.clickhouse.search;

import io.intellixity.sift.clickhouse.ClickHouseDialectOptions;
import io.intellixity.sift.clickhouse.InMemoryMetadataSource;
import io.intellixity.sift.metadata.TableRef;
import io.intellixity.sift.query.SearchCompileException;
import io.intellixity.sift.query.UnsupportedFieldOperationException;
import io.intellixity.sift.spi.exec.Futures;
import io.intellixity.sift.spi.search.SearchQueryBuilder;
import io.intellixity.sift.spi.search.SearchTarget;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class ClickHouseSearchSerializerTest {
  private static final TableRef LOGS = new TableRef("default", "otel_logs", "conn-1");

  private static InMemoryMetadataSource logs() {
    return new InMemoryMetadataSource()
        .column("Body", "String")
        .column("ServiceName", "LowCardinality(String)")
        .column("SeverityNumber", "UInt8")
        .column("IsRoot", "Bool")
        .column("Timestamp", "DateTime64(9)")
        .column("LogAttributes", "Map(LowCardinality(String), String)")
        .column("ResourceAttributesJSON", "JSON")
        .column("Events.Name", "Array(LowCardinality(String))")
        .column("Events.Attributes", "Array(Map(LowCardinality(String), String))")
        .column("Counts", "Array(UInt64)")
        .column("UserId", "String")
        .materialized("LogAttributes['user.id']", "UserId");
  }

  private static String compile(String query) {
    return compile(query, LOGS, "Body", logs());
  }

  private static String compile(String query, TableRef table, String implicit, InMemoryMetadataSource metadata) {
    ClickHouseSearchSerializer serializer = new ClickHouseSearchSerializer(
        new SearchTarget(table, implicit), metadata, ClickHouseDialectOptions.defaults());
    return Futures.await(new SearchQueryBuilder(query, serializer).build());
  }

  @Test
  void bareTermsAreTokenSearches() {
    assertEquals("((hasToken(lower(Body), lower('foo'))) AND (hasToken(lower(Body), lower('bar'))) "
            + "AND (hasToken(lower(Body), lower('baz'))))",
        compile("foo bar baz"));
  }

  @Test
  void fieldedAndBareTermsMix() {
    assertEquals("((ServiceName ILIKE '%foo%') AND (hasToken(lower(Body), lower('bar'))) "
            + "AND (hasToken(lower(Body), lower('baz'))))",
        compile("ServiceName:foo bar baz"));
  }

  @Test
  void phraseAddsAdjacencyGuard() {
    assertEquals("((hasToken(lower(Body), lower('foo')) AND hasToken(lower(Body), lower('bar')) "
            + "AND hasToken(lower(Body), lower('baz')) AND (lower(Body) LIKE lower('%foo bar baz%'))))",
        compile("\"foo bar baz\""));
  }

  @Test
  void fieldedPhraseIsEquality() {
    assertEquals("((ServiceName = 'foo bar baz'))", compile("ServiceName:\"foo bar baz\""));
    assertEquals("((ServiceName != 'api'))", compile("-ServiceName:\"api\""));
  }

  @Test
  void notStaysOutsideTheGroup() {
    assertEquals("(NOT ((foo ILIKE '%bar%') AND (foo ILIKE '%baz%')))", compile("NOT foo:(bar baz)"));
    assertEquals("(NOT ((foo NOT ILIKE '%bar%')))", compile("-foo:(-bar)"));
  }

  @Test
  void wildcards() {
    assertEquals("((lower(Body) LIKE lower('%bar')))", compile("*bar"));
    assertEquals("((foo ILIKE '%bar%'))", compile("foo:*bar"));
    assertEquals("(((lower(foo) LIKE lower('%bar'))))", compile("foo:(*bar)"));
    assertEquals("(((lower(foo) LIKE lower('bar%'))))", compile("foo:(bar*)"));
  }

  @Test
  void ranges() {
    assertEquals("((foo BETWEEN 1 AND 5))", compile("foo:[1 TO 5]"));
    assertEquals("((foo NOT BETWEEN 1 AND 5))", compile("-foo:[1 TO 5]"));
    assertEquals("((SeverityNumber >= '3'))", compile("SeverityNumber:[3 TO *]"));
  }

  @Test
  void comparisons() {
    assertEquals("((SeverityNumber > '10'))", compile("SeverityNumber:>10"));
    assertEquals("((SeverityNumber >= '10'))", compile("-SeverityNumber:<10"));
  }

  @Test
  void numberBoolAndDateTimeColumns() {
    assertEquals("((SeverityNumber = CAST('5', 'Float64')))", compile("SeverityNumber:5"));
    assertEquals("((IsRoot = 1))", compile("IsRoot:true"));
    assertEquals("((toString(Timestamp) ILIKE '%2024%'))", compile("Timestamp:2024"));
  }

  @Test
  void mapKeyCarriesIndexHint() {
    assertEquals("((`LogAttributes`['error.message'] = 'Failed to fetch' "
            + "AND indexHint(mapContains(`LogAttributes`, 'error.message'))))",
        compile("LogAttributes.error.message:\"Failed to fetch\""));
  }

  @Test
  void negatedMapKeyHasNoHint() {
    assertEquals("((`LogAttributes`['error.message'] != 'x'))", compile("-LogAttributes.error.message:\"x\""));
    assertEquals("(NOT (`LogAttributes`['a'] ILIKE '%x%'))", compile("NOT LogAttributes.a:x"));
  }

  @Test
  void materializedColumnCarriesSourceHint() {
    assertEquals("((UserId = 'abc' AND indexHint(mapContains(`LogAttributes`, 'user.id'))))",
        compile("UserId:\"abc\""));
  }

  @Test
  void jsonPathsUseSubColumns() {
    assertEquals("(((toString(`ResourceAttributesJSON`.`error`.`message`) ILIKE '%Failed to fetch%')))",
        compile("ResourceAttributesJSON.error.message:(\"Failed to fetch\")"));
    assertEquals("((dynamicType(`ResourceAttributesJSON`.`code`) in (" + PredicateForms.JsonForms.NUMBER_TYPES
            + ") and `ResourceAttributesJSON`.`code` > '400'))",
        compile("ResourceAttributesJSON.code:>400"));
  }

  @Test
  void stringColumnPathReadsJsonText() {
    assertEquals("((JSONExtractString(`Body`, 'a', 'b') = 'x'))", compile("Body.a.b:\"x\""));
  }

  @Test
  void arrays() {
    assertEquals("((has(Events.Name, 'foo')))", compile("Events.Name:\"foo\""));
    assertEquals("((arrayExists(el -> el ILIKE '%foo%', Events.Name)))", compile("Events.Name:foo"));
    assertEquals("((NOT has(Events.Name, 'foo')))", compile("-Events.Name:\"foo\""));
    assertEquals("((has(Counts, CAST('5', 'Float64'))))", compile("Counts:5"));
    assertEquals("((arrayExists(el -> el['http.method'] ILIKE '%GET%', Events.Attributes)))",
        compile("Events.Attributes.http.method:GET"));
  }

  @Test
  void existence() {
    assertEquals("(notEmpty(ServiceName) = 1)", compile("ServiceName:*"));
    assertEquals("(notEmpty(ServiceName) != 1)", compile("-ServiceName:*"));
    assertEquals("(isNotNull(SeverityNumber))", compile("SeverityNumber:*"));
    assertEquals("(notEmpty(Events.Name) = 1)", compile("Events.Name:*"));
  }

  @Test
  void unsupportedOperationsFail() {
    UnsupportedFieldOperationException e = assertThrows(UnsupportedFieldOperationException.class,
        () -> compile("Events.Name:[1 TO 5]"));
    assertEquals("Events.Name", e.field());
    assertEquals("range", e.operation());
    assertThrows(UnsupportedFieldOperationException.class, () -> compile("LogAttributes:>5"));
  }

  @Test
  void bareTextNeedsImplicitColumn() {
    SearchCompileException e = assertThrows(SearchCompileException.class,
        () -> compile("foo", LOGS, null, logs()));
    assertEquals("Can not search bare text without an implicit column set.", e.getMessage());
    assertEquals("((ServiceName = 'a'))", compile("ServiceName:\"a\"", LOGS, null, logs()));
  }

  @Test
  void severalImplicitColumnsAreConcatenated() {
    assertEquals("concatWithSeparator(';',Body,ServiceName)", ClickHouseSearchSerializer.implicitColumn("Body, ServiceName"));
    assertEquals("Body", ClickHouseSearchSerializer.implicitColumn(" Body "));
    assertNull(ClickHouseSearchSerializer.implicitColumn(" "));
  }

  @Test
  void cteTablesSkipMetadata() {
    InMemoryMetadataSource metadata = logs();
    assertEquals("((SeverityNumber > '3') AND (hasToken(lower(Body), lower('foo'))))",
        compile("SeverityNumber:>3 foo", new TableRef("", "Source", null), "Body", metadata));
    assertEquals(0, metadata.columnLookups.get());
    assertEquals(0, metadata.skipIndexLookups.get());
  }

  @Test
  void consecutiveNotsNegateEachOperand() {
    assertEquals("(NOT (hasToken(lower(Body), lower('foo'))) AND NOT (hasToken(lower(Body), lower('bar'))))",
        compile("NOT foo NOT bar"));
  }

  @Test
  void blankQueryIsEmpty() {
    assertEquals("", compile("   "));
  }
}
