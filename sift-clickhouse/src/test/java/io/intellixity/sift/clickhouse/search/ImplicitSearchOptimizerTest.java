package io.intellixity.sift.clickhouse.search;

import io.intellixity.sift.clickhouse.ClickHouseDialectOptions;
import io.intellixity.sift.clickhouse.InMemoryMetadataSource;
import io.intellixity.sift.metadata.TableRef;
import io.intellixity.sift.spi.exec.Futures;
import io.intellixity.sift.spi.search.SearchQueryBuilder;
import io.intellixity.sift.spi.search.SearchTarget;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ImplicitSearchOptimizerTest {
  private static final TableRef LOGS = new TableRef("default", "otel_logs", "conn-1");

  private static InMemoryMetadataSource withIndex(String type, String expression) {
    return new InMemoryMetadataSource().column("Body", "String").skipIndex("idx_body", type, expression);
  }

  private static String compile(String query, InMemoryMetadataSource metadata) {
    return compile(query, metadata, ClickHouseDialectOptions.defaults());
  }

  private static String compile(String query, InMemoryMetadataSource metadata, ClickHouseDialectOptions options) {
    ClickHouseSearchSerializer serializer =
        new ClickHouseSearchSerializer(new SearchTarget(LOGS, "Body"), metadata, options);
    return Futures.await(new SearchQueryBuilder(query, serializer).build());
  }

  @Test
  void bloomFilterOverTokensUsesHasAll() {
    InMemoryMetadataSource md = withIndex("bloom_filter", "tokens(lower(Body))");
    assertEquals("((hasAll(tokens(lower(Body)), tokens(lower('foo')))))", compile("foo", md));
    assertEquals("((NOT hasAll(tokens(lower(Body)), tokens(lower('foo')))))", compile("-foo", md));
  }

  @Test
  void indexExpressionIsEmittedVerbatim() {
    assertEquals("((hasAll(tokens ( lower ( Body ) ) , tokens(lower('FooBar')))))",
        compile("FooBar", withIndex("bloom_filter", "tokens ( lower ( Body ) ) ")));
  }

  @Test
  void caseIsKeptWithoutLower() {
    InMemoryMetadataSource md = withIndex("bloom_filter", "tokens(Body)");
    assertEquals("((hasAll(tokens(Body), tokens('FooBar'))))", compile("FooBar", md));
    assertEquals("((hasAll(tokens(Body), tokens('Foo Bar')) AND (lower(Body) LIKE lower('%Foo Bar%'))))",
        compile("\"Foo Bar\"", md));
  }

  @Test
  void backtickedColumnStillMatches() {
    assertEquals("((hasAll(tokens(`Body`), tokens('foo'))))",
        compile("foo", withIndex("bloom_filter", "tokens(`Body`)")));
  }

  @Test
  void otherIndexesFallBackToHasToken() {
    String expected = "((hasToken(lower(Body), lower('foo'))))";
    assertEquals(expected, compile("foo", withIndex("tokenbf_v1", "Body")));
    assertEquals(expected, compile("foo", withIndex("bloom_filter", "Body")));
    assertEquals(expected, compile("foo", withIndex("bloom_filter", "tokens(lower(Body2))")));
    assertEquals(expected, compile("foo", withIndex("minmax", "tokens(Body)")));
    assertEquals(expected, compile("foo", new InMemoryMetadataSource()));
  }

  @Test
  void indexOnAnotherExpressionOfTheColumnFallsBack() {
    String expected = "((hasToken(lower(Body), lower('foo'))))";
    assertEquals(expected,
        compile("foo", withIndex("bloom_filter", "tokens(lower(JSONExtractString(Body, 'msg')))")));
    assertEquals(expected, compile("foo", withIndex("text", "JSONExtractString(Body, 'msg')")
        .setting("enable_full_text_index", "1")));
  }

  @Test
  void matchingIndexIsPickedAmongOthers() {
    InMemoryMetadataSource md = new InMemoryMetadataSource()
        .column("Body", "String")
        .skipIndex("idx_msg", "bloom_filter", "tokens(lower(JSONExtractString(Body, 'msg')))")
        .skipIndex("idx_body", "bloom_filter", "tokens(lower(Body))");
    assertEquals("((hasAll(tokens(lower(Body)), tokens(lower('foo')))))", compile("foo", md));
  }

  @Test
  void textIndexNeedsTheServerSetting() {
    InMemoryMetadataSource enabled = withIndex("text", "Body").setting("enable_full_text_index", "1");
    assertEquals("((hasAllTokens(Body, 'foo')))", compile("foo", enabled));

    InMemoryMetadataSource lower = withIndex("text", "lower(Body)").setting("enable_full_text_index", "true");
    assertEquals("((hasAllTokens(lower(Body), lower('foo'))))", compile("foo", lower));

    String fallback = "((hasToken(lower(Body), lower('foo'))))";
    assertEquals(fallback, compile("foo", withIndex("text", "Body")));
    assertEquals(fallback, compile("foo", withIndex("text", "Body").setting("enable_full_text_index", "0")));
    assertEquals(fallback, compile("foo", withIndex("text", "Body").failSettings()));
  }

  @Test
  void settingNameIsConfigurable() {
    InMemoryMetadataSource md = withIndex("text", "Body").setting("allow_experimental_full_text_index", "1");
    ClickHouseDialectOptions options = new ClickHouseDialectOptions("allow_experimental_full_text_index", 50, 60);
    assertEquals("((hasAllTokens(Body, 'foo')))", compile("foo", md, options));
  }

  @Test
  void longPhrasesAreChunked() {
    ClickHouseDialectOptions options = new ClickHouseDialectOptions("enable_full_text_index", 2, 60);
    assertEquals("((hasAll(tokens(Body), tokens('a b')) AND hasAll(tokens(Body), tokens('c')) "
            + "AND (lower(Body) LIKE lower('%a b c%'))))",
        compile("\"a b c\"", withIndex("bloom_filter", "tokens(Body)"), options));
  }

  @Test
  void strategyIsLookedUpOncePerSerializer() {
    InMemoryMetadataSource md = withIndex("bloom_filter", "tokens(Body)");
    compile("foo bar baz", md);
    assertEquals(1, md.skipIndexLookups.get());
  }

  @Test
  void tokenizeSplitsOnPunctuation() {
    assertEquals(List.of("foo", "bar", "baz"), ImplicitSearchOptimizer.tokenize("foo.bar-baz"));
    assertEquals(List.of("a", "b"), ImplicitSearchOptimizer.tokenize("  a::b "));
    assertEquals(List.of("über"), ImplicitSearchOptimizer.tokenize("über"));
  }
}
