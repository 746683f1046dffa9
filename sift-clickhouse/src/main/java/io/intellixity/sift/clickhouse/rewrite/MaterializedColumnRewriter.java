package io.intellixity.sift.clickhouse.rewrite;

import net.sf.jsqlparser.expression.ArrayExpression;
import net.sf.jsqlparser.expression.BinaryExpression;
import net.sf.jsqlparser.expression.CastExpression;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.Function;
import net.sf.jsqlparser.expression.NotExpression;
import net.sf.jsqlparser.expression.StringValue;
import net.sf.jsqlparser.expression.operators.relational.Between;
import net.sf.jsqlparser.expression.operators.relational.ExpressionList;
import net.sf.jsqlparser.expression.operators.relational.InExpression;
import net.sf.jsqlparser.expression.operators.relational.IsNullExpression;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.SelectItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Replaces expressions that a table already materializes with the materialized column.
 * <p>
 * Fragments are parsed inside a {@code SELECT ... FROM `t`} shell. Candidates are map-key reads
 * ({@code Col['key']}) and two-argument calls over a column and a string literal
 * ({@code JSONExtractString(Body, 'message')}). Lookup keys and candidates are compared with backticks and
 * whitespace removed. Anything the parser cannot handle is returned unchanged.
 */
public final class MaterializedColumnRewriter {
  private static final Logger log = LoggerFactory.getLogger(MaterializedColumnRewriter.class);
  private static final Pattern SELECT_PREFIX = Pattern.compile("^SELECT\\s+", Pattern.CASE_INSENSITIVE);
  private static final Pattern FROM_SUFFIX = Pattern.compile("\\s+FROM\\s+`t`$", Pattern.CASE_INSENSITIVE);
  private static final Pattern WHERE_PREFIX =
      Pattern.compile("^SELECT\\s+\\*\\s+FROM\\s+`t`\\s+WHERE\\s+", Pattern.CASE_INSENSITIVE);

  /** Rewrites a select-list expression. */
  public String rewriteExpression(String expression, Map<String, String> materialized) {
    if (skip(expression, materialized)) return expression;
    try {
      PlainSelect select = parse("SELECT " + expression + " FROM `t`");
      Rewrite rewrite = new Rewrite(normalizedLookup(materialized));
      for (SelectItem<?> item : select.getSelectItems()) {
        @SuppressWarnings("unchecked")
        SelectItem<Expression> it = (SelectItem<Expression>) item;
        it.setExpression(rewrite.apply(it.getExpression()));
      }
      if (!rewrite.changed) return expression;
      String out = FROM_SUFFIX.matcher(SELECT_PREFIX.matcher(select.toString()).replaceFirst("")).replaceFirst("");
      log.debug("Materialized rewrite expression={} result={}", expression, out);
      return out;
    } catch (Exception e) {
      log.debug("Materialized rewrite skipped, keeping original expression={}", expression, e);
      return expression;
    }
  }

  /** Rewrites a boolean condition. */
  public String rewriteCondition(String condition, Map<String, String> materialized) {
    if (skip(condition, materialized)) return condition;
    try {
      PlainSelect select = parse("SELECT * FROM `t` WHERE " + condition);
      Rewrite rewrite = new Rewrite(normalizedLookup(materialized));
      select.setWhere(rewrite.apply(select.getWhere()));
      if (!rewrite.changed) return condition;
      String out = WHERE_PREFIX.matcher(select.toString()).replaceFirst("");
      log.debug("Materialized rewrite condition={} result={}", condition, out);
      return out;
    } catch (Exception e) {
      log.debug("Materialized rewrite skipped, keeping original condition={}", condition, e);
      return condition;
    }
  }

  private static boolean skip(String sql, Map<String, String> materialized) {
    return sql == null || sql.isBlank() || materialized == null || materialized.isEmpty();
  }

  private static PlainSelect parse(String sql) throws Exception {
    Statement st = CCJSqlParserUtil.parse(sql);
    if (!(st instanceof PlainSelect ps)) throw new IllegalStateException("Not a plain select: " + sql);
    return ps;
  }

  private static Map<String, String> normalizedLookup(Map<String, String> materialized) {
    Map<String, String> out = new HashMap<>();
    for (Map.Entry<String, String> e : materialized.entrySet()) out.put(normalize(e.getKey()), e.getValue());
    return out;
  }

  static String normalize(String expression) {
    StringBuilder sb = new StringBuilder(expression.length());
    for (int i = 0; i < expression.length(); i++) {
      char c = expression.charAt(i);
      if (c != '`' && !Character.isWhitespace(c)) sb.append(c);
    }
    return sb.toString();
  }

  /** Returns replacement nodes for matches and rebuilds parents in place of their children. */
  private static final class Rewrite {
    private final Map<String, String> lookup;
    private boolean changed;

    Rewrite(Map<String, String> lookup) {
      this.lookup = lookup;
    }

    Expression apply(Expression e) {
      if (e == null) return null;
      String key = candidateKey(e);
      if (key != null) {
        String column = lookup.get(normalize(key));
        if (column != null) {
          changed = true;
          return new Column(column);
        }
      }
      if (e instanceof BinaryExpression b) {
        b.setLeftExpression(apply(b.getLeftExpression()));
        b.setRightExpression(apply(b.getRightExpression()));
      } else if (e instanceof Function f) {
        applyAll(f.getParameters());
      } else if (e instanceof ExpressionList<?> list) {
        applyAll(list);
      } else if (e instanceof NotExpression n) {
        n.setExpression(apply(n.getExpression()));
      } else if (e instanceof Between b) {
        b.setLeftExpression(apply(b.getLeftExpression()));
        b.setBetweenExpressionStart(apply(b.getBetweenExpressionStart()));
        b.setBetweenExpressionEnd(apply(b.getBetweenExpressionEnd()));
      } else if (e instanceof IsNullExpression n) {
        n.setLeftExpression(apply(n.getLeftExpression()));
      } else if (e instanceof InExpression in) {
        in.setLeftExpression(apply(in.getLeftExpression()));
      } else if (e instanceof CastExpression c) {
        c.setLeftExpression(apply(c.getLeftExpression()));
      }
      return e;
    }

    private void applyAll(ExpressionList<?> params) {
      if (params == null) return;
      @SuppressWarnings("unchecked")
      ExpressionList<Expression> list = (ExpressionList<Expression>) params;
      for (int i = 0; i < list.size(); i++) list.set(i, apply(list.get(i)));
    }

    private static String candidateKey(Expression e) {
      if (e instanceof ArrayExpression a && a.getObjExpression() instanceof Column c
          && a.getIndexExpression() instanceof StringValue s) {
        return c.getColumnName() + "['" + s.getValue() + "']";
      }
      if (e instanceof Column c && c.toString().contains("['")) return c.toString();
      if (e instanceof Function f && f.getParameters() != null && f.getParameters().size() == 2
          && f.getParameters().get(0) instanceof Column c && f.getParameters().get(1) instanceof StringValue s) {
        return f.getName() + "(" + c.getColumnName() + ", '" + s.getValue() + "')";
      }
      return null;
    }
  }
}
