package io.intellixity.sift.query;

public interface SearchVisitor<R, C> {
  R visit(Term term, C ctx);
  R visit(RangeTerm range, C ctx);
  R visit(LogicalGroup group, C ctx);
  R visit(NotElement not, C ctx);
}
