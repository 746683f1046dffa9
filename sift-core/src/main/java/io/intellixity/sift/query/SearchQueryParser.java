package io.intellixity.sift.query;

import java.util.*;

/**
 * Lenient parser for the Lucene-style search language.
 * <p>
 * Supported: bare terms, quoted phrases, {@code field:value}, {@code field:"phrase"}, {@code field:(group)},
 * {@code field:[a TO b]}, leading/trailing {@code *} wildcards, {@code AND}/{@code OR}/{@code NOT}
 * ({@code &&}/{@code ||}), and {@code -} as negation shorthand. Adjacent operands are ANDed.
 * <p>
 * Parsing never fails: malformed fragments become literal terms.
 */
public final class SearchQueryParser {
  private final String in;
  private int pos;

  private SearchQueryParser(String in) {
    this.in = in;
  }

  /** Parses {@code query}; returns null when it is blank. */
  public static SearchElement parse(String query) {
    if (query == null || query.isBlank()) return null;
    return new SearchQueryParser(query).parseSequence(null, false);
  }

  private SearchElement parseSequence(String groupField, boolean inGroup) {
    List<SearchElement> operands = new ArrayList<>();
    List<Clause> clauses = new ArrayList<>();
    Clause pending = null;
    while (true) {
      skipWhitespace();
      if (eof()) break;
      if (peek() == ')') {
        pos++;
        if (inGroup) break;
        continue;
      }
      Clause op = readClause();
      if (op != null) {
        if (!operands.isEmpty()) pending = op;
        continue;
      }
      SearchElement operand = parseOperand(groupField);
      if (operand == null) continue;
      if (!operands.isEmpty()) clauses.add(pending == null ? Clause.AND : pending);
      operands.add(operand);
      pending = null;
    }
    if (operands.isEmpty()) return null;
    return chain(operands, clauses, 0);
  }

  // a AND b OR c nests to the right: a AND (b OR c), unparenthesized
  private static SearchElement chain(List<SearchElement> operands, List<Clause> clauses, int i) {
    SearchElement head = operands.get(i);
    if (i == operands.size() - 1) return head;
    Clause clause = clauses.get(i);
    SearchElement rest = chain(operands, clauses, i + 1);
    List<SearchElement> elements = new ArrayList<>();
    elements.add(head);
    if (rest instanceof LogicalGroup g && !g.parenthesized() && g.clause() == clause) {
      elements.addAll(g.elements());
    } else {
      elements.add(rest);
    }
    return new LogicalGroup(clause, elements, false);
  }

  private SearchElement parseOperand(String groupField) {
    if (keywordAt("NOT")) {
      pos += 3;
      skipWhitespace();
      if (eof() || peek() == ')') return null;
      SearchElement inner = parseOperand(groupField);
      return inner == null ? null : new NotElement(inner);
    }

    boolean negated = false;
    if (peek() == '-' && pos + 1 < in.length() && !isStop(in.charAt(pos + 1))) {
      negated = true;
      pos++;
    }

    TermScope scope = groupField == null ? TermScope.IMPLICIT : TermScope.GROUPED;
    char c = peek();
    if (c == '(') {
      pos++;
      return negate(parseGroup(groupField), negated);
    }
    if (c == '"') {
      return new Term(groupField, readQuoted(), scope, true, false, false, negated);
    }
    if (c == '[' || c == '{') {
      RangeTerm range = tryReadRange(groupField, scope, negated);
      if (range != null) return range;
    }

    String field = tryReadField();
    if (field != null) return parseFieldValue(field, negated);

    Bare bare = readBare();
    return new Term(groupField, bare.value, scope, false, bare.prefix, bare.suffix, negated);
  }

  private SearchElement parseFieldValue(String field, boolean negated) {
    char c = peek();
    if (c == '(') {
      pos++;
      return negate(parseGroup(field), negated);
    }
    if (c == '"') {
      return new Term(field, readQuoted(), TermScope.EXPLICIT, true, false, false, negated);
    }
    if (c == '[' || c == '{') {
      RangeTerm range = tryReadRange(field, TermScope.EXPLICIT, negated);
      if (range != null) return range;
    }
    Bare bare = readBare();
    return new Term(field, bare.value, TermScope.EXPLICIT, false, bare.prefix, bare.suffix, negated);
  }

  private SearchElement parseGroup(String groupField) {
    SearchElement inner = parseSequence(groupField, true);
    if (inner == null) return null;
    if (inner instanceof LogicalGroup g && !g.parenthesized()) return g.withParentheses();
    return new LogicalGroup(Clause.AND, List.of(inner), true);
  }

  private static SearchElement negate(SearchElement el, boolean negated) {
    if (el == null || !negated) return el;
    return new NotElement(el);
  }

  private Clause readClause() {
    if (keywordAt("AND")) { pos += 3; return Clause.AND; }
    if (keywordAt("&&")) { pos += 2; return Clause.AND; }
    if (keywordAt("OR")) { pos += 2; return Clause.OR; }
    if (keywordAt("||")) { pos += 2; return Clause.OR; }
    return null;
  }

  private boolean keywordAt(String kw) {
    if (!in.startsWith(kw, pos)) return false;
    int end = pos + kw.length();
    if (end == in.length()) return true;
    char next = in.charAt(end);
    return Character.isWhitespace(next) || next == '(';
  }

  /** Reads {@code name:} and returns the name, or leaves the position untouched and returns null. */
  private String tryReadField() {
    int i = pos;
    while (i < in.length()) {
      char ch = in.charAt(i);
      if (ch == '\\') { i += 2; continue; }
      if (ch == ':') break;
      if (Character.isWhitespace(ch) || ch == '(' || ch == ')' || ch == '"') return null;
      i++;
    }
    if (i >= in.length() || i == pos) return null;
    int after = i + 1;
    if (after >= in.length() || isStop(in.charAt(after))) return null;

    String name = unescape(in.substring(pos, i));
    if ((name.equalsIgnoreCase("http") || name.equalsIgnoreCase("https")) && in.startsWith("//", after)) {
      return null;
    }
    if (name.equalsIgnoreCase("localhost") && Character.isDigit(in.charAt(after))) return null;
    pos = after;
    return name;
  }

  private RangeTerm tryReadRange(String field, TermScope scope, boolean negated) {
    int close = -1;
    for (int i = pos + 1; i < in.length(); i++) {
      char ch = in.charAt(i);
      if (ch == ']' || ch == '}') {
        close = i;
        break;
      }
    }
    if (close < 0) return null;
    String[] parts = in.substring(pos + 1, close).trim().split("\\s+");
    if (parts.length != 3 || !parts[1].equals("TO")) return null;
    boolean lowInclusive = in.charAt(pos) == '[';
    boolean highInclusive = in.charAt(close) == ']';
    pos = close + 1;
    return new RangeTerm(field, stripQuotes(parts[0]), stripQuotes(parts[2]), lowInclusive, highInclusive,
        scope, negated);
  }

  private String readQuoted() {
    pos++;
    StringBuilder sb = new StringBuilder();
    while (pos < in.length()) {
      char ch = in.charAt(pos);
      if (ch == '\\' && pos + 1 < in.length()) {
        sb.append(in.charAt(pos + 1));
        pos += 2;
        continue;
      }
      pos++;
      if (ch == '"') break;
      sb.append(ch);
    }
    return sb.toString();
  }

  private Bare readBare() {
    StringBuilder sb = new StringBuilder();
    List<Boolean> escaped = new ArrayList<>();
    while (pos < in.length()) {
      char ch = in.charAt(pos);
      if (Character.isWhitespace(ch) || ch == '(' || ch == ')') break;
      if (ch == '\\' && pos + 1 < in.length()) {
        sb.append(in.charAt(pos + 1));
        escaped.add(true);
        pos += 2;
        continue;
      }
      sb.append(ch);
      escaped.add(false);
      pos++;
    }

    int start = 0;
    while (start < sb.length() && sb.charAt(start) == '*' && !escaped.get(start)) start++;
    int end = sb.length();
    while (end > start && sb.charAt(end - 1) == '*' && !escaped.get(end - 1)) end--;
    boolean prefix = start > 0;
    boolean suffix = end < sb.length() || (prefix && start == sb.length());
    return new Bare(sb.substring(start, end), prefix, suffix);
  }

  private record Bare(String value, boolean prefix, boolean suffix) {}

  private static String unescape(String s) {
    if (s.indexOf('\\') < 0) return s;
    StringBuilder sb = new StringBuilder(s.length());
    for (int i = 0; i < s.length(); i++) {
      char ch = s.charAt(i);
      if (ch == '\\' && i + 1 < s.length()) ch = s.charAt(++i);
      sb.append(ch);
    }
    return sb.toString();
  }

  private static String stripQuotes(String s) {
    if (s.length() >= 2 && s.startsWith("\"") && s.endsWith("\"")) return s.substring(1, s.length() - 1);
    return s;
  }

  private static boolean isStop(char ch) {
    return Character.isWhitespace(ch) || ch == ')';
  }

  private void skipWhitespace() {
    while (pos < in.length() && Character.isWhitespace(in.charAt(pos))) pos++;
  }

  private boolean eof() { return pos >= in.length(); }

  private char peek() { return in.charAt(pos); }
}
