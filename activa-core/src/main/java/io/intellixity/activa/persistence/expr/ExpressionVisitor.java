package io.intellixity.activa.persistence.expr;

public interface ExpressionVisitor<R> {
  R visitColumn(Column column);
  R visitLiteral(Literal literal);
  R visitBinary(BinaryOp binary);
  R visitUnary(UnaryOp unary);
  R visitFunction(FunctionCall function);
  R visitSubquery(Subquery subquery);
  R visitCase(CaseWhen caseWhen);
  R visitInList(InList in);
  R visitInSubquery(InSubquery in);
  R visitBetween(Between between);
  R visitIsNull(IsNull isNull);
  R visitExists(Exists exists);
  R visitAliased(Aliased aliased);
  R visitStar(Star star);
  R visitRaw(RawSql raw);
}
