package io.intellixity.sift.clickhouse.rewrite;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class MaterializedColumnRewriterTest {
  private final MaterializedColumnRewriter rewriter = new MaterializedColumnRewriter();
  private static final Map<String, String> USER_ID = Map.of("LogAttributes['user.id']", "UserId");

  @Test
  void mapReadInConditionIsReplaced() {
    assertEquals("UserId = 'x'", rewriter.rewriteCondition("LogAttributes['user.id'] = 'x'", USER_ID));
  }

  @Test
  void backticksAndSpacingDoNotMatter() {
    Map<String, String> lookup = Map.of("`LogAttributes`[ 'user.id' ]", "UserId");
    assertEquals("UserId = 'x'", rewriter.rewriteCondition("LogAttributes['user.id'] = 'x'", lookup));
  }

  @Test
  void extractionCallIsReplaced() {
    Map<String, String> lookup = Map.of("JSONExtractString(Body, 'message')", "Message");
    assertEquals("lower(Message)", rewriter.rewriteExpression("lower(JSONExtractString(Body, 'message'))", lookup));
  }

  @Test
  void untouchedInputIsReturnedVerbatim() {
    String condition = "ServiceName  =  'api'";
    assertSame(condition, rewriter.rewriteCondition(condition, USER_ID));
    assertEquals("count()", rewriter.rewriteExpression("count()", USER_ID));
  }

  @Test
  void emptyLookupSkipsParsing() {
    String condition = "LogAttributes['user.id'] = 'x'";
    assertSame(condition, rewriter.rewriteCondition(condition, Map.of()));
    assertSame(condition, rewriter.rewriteCondition(condition, null));
    assertNull(rewriter.rewriteExpression(null, USER_ID));
  }

  @Test
  void unparseableInputIsReturnedUnchanged() {
    String broken = "LogAttributes['user.id'] = (";
    assertEquals(broken, rewriter.rewriteCondition(broken, USER_ID));
    assertEquals(broken, rewriter.rewriteExpression(broken, USER_ID));
  }

  @Test
  void normalizeDropsBackticksAndWhitespace() {
    assertEquals("LogAttributes['a']", MaterializedColumnRewriter.normalize(" `LogAttributes` [ 'a' ] "));
  }
}
