package io.intellixity.sift.query;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class SearchQueryParserTest {

  @Test
  void blankQueryParsesToNull() {
    assertNull(SearchQueryParser.parse(null));
    assertNull(SearchQueryParser.parse("   "));
  }

  @Test
  void bareTermIsImplicit() {
    Term t = (Term) SearchQueryParser.parse("foo");
    assertNull(t.field());
    assertEquals("foo", t.value());
    assertEquals(TermScope.IMPLICIT, t.scope());
    assertEquals(Term.Kind.TERM, t.kind());
  }

  @Test
  void adjacentTermsAreAnded() {
    LogicalGroup g = (LogicalGroup) SearchQueryParser.parse("foo bar baz");
    assertEquals(Clause.AND, g.clause());
    assertFalse(g.parenthesized());
    assertEquals(3, g.elements().size());
  }

  @Test
  void quotedPhraseKeepsSpaces() {
    Term t = (Term) SearchQueryParser.parse("\"foo bar baz\"");
    assertEquals("foo bar baz", t.value());
    assertEquals(Term.Kind.PHRASE, t.kind());
  }

  @Test
  void fieldedPhrase() {
    Term t = (Term) SearchQueryParser.parse("ServiceName:\"foo bar\"");
    assertEquals("ServiceName", t.field());
    assertEquals("foo bar", t.value());
    assertEquals(Term.Kind.FIELDED_PHRASE, t.kind());
  }

  @Test
  void fieldGroupPropagatesFieldToChildren() {
    NotElement not = (NotElement) SearchQueryParser.parse("NOT foo:(bar baz)");
    LogicalGroup g = (LogicalGroup) not.element();
    assertTrue(g.parenthesized());
    for (SearchElement el : g.elements()) {
      Term t = (Term) el;
      assertEquals("foo", t.field());
      assertEquals(TermScope.GROUPED, t.scope());
    }
  }

  @Test
  void minusNegatesGroupAndTerm() {
    NotElement not = (NotElement) SearchQueryParser.parse("-foo:(-bar)");
    LogicalGroup g = (LogicalGroup) not.element();
    Term t = (Term) g.elements().get(0);
    assertTrue(t.negated());
    assertEquals("bar", t.value());
  }

  @Test
  void wildcardsAreStrippedIntoFlags() {
    Term prefix = (Term) SearchQueryParser.parse("*bar");
    assertEquals("bar", prefix.value());
    assertTrue(prefix.prefixWildcard());
    assertFalse(prefix.suffixWildcard());

    Term suffix = (Term) SearchQueryParser.parse("foo:bar*");
    assertTrue(suffix.suffixWildcard());
    assertFalse(suffix.prefixWildcard());

    Term star = (Term) SearchQueryParser.parse("foo:*");
    assertEquals("", star.value());
    assertTrue(star.prefixWildcard());
    assertTrue(star.suffixWildcard());
  }

  @Test
  void rangeTerm() {
    RangeTerm r = (RangeTerm) SearchQueryParser.parse("foo:[1 TO 5]");
    assertEquals("foo", r.field());
    assertEquals("1", r.low());
    assertEquals("5", r.high());
    assertTrue(r.lowInclusive());
    assertTrue(r.highInclusive());

    RangeTerm open = (RangeTerm) SearchQueryParser.parse("foo:{* TO 5}");
    assertTrue(open.lowUnbounded());
    assertFalse(open.highInclusive());
  }

  @Test
  void explicitOrNestsToTheRight() {
    LogicalGroup g = (LogicalGroup) SearchQueryParser.parse("a AND b OR c");
    assertEquals(Clause.AND, g.clause());
    LogicalGroup rest = (LogicalGroup) g.elements().get(1);
    assertEquals(Clause.OR, rest.clause());
    assertEquals(2, rest.elements().size());
  }

  @Test
  void symbolicOperators() {
    LogicalGroup g = (LogicalGroup) SearchQueryParser.parse("a || b");
    assertEquals(Clause.OR, g.clause());
  }

  @Test
  void urlsAreNotFields() {
    Term t = (Term) SearchQueryParser.parse("http://example.com/a");
    assertNull(t.field());
    assertEquals("http://example.com/a", t.value());

    Term host = (Term) SearchQueryParser.parse("localhost:8080");
    assertNull(host.field());
  }

  @Test
  void escapedColonStaysInFieldName() {
    Term t = (Term) SearchQueryParser.parse("a\\:b:c");
    assertEquals("a:b", t.field());
    assertEquals("c", t.value());
  }

  @Test
  void unbalancedInputIsLenient() {
    assertNotNull(SearchQueryParser.parse("foo:(bar"));
    assertNotNull(SearchQueryParser.parse("foo) bar"));
    Term t = (Term) SearchQueryParser.parse("\"unterminated");
    assertEquals("unterminated", t.value());
  }

  @Test
  void trailingOperatorIsIgnored() {
    Term t = (Term) SearchQueryParser.parse("foo AND");
    assertEquals("foo", t.value());
  }
}
