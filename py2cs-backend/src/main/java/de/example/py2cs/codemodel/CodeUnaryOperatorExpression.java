package de.example.py2cs.codemodel;

public record CodeUnaryOperatorExpression(CodeOperatorType operator, CodeExpression expression) implements CodeExpression {

  @Override
  public <A> void accept(CodeExpressionVisitor<A> v, A arg) {
    v.visit(this, arg);
  }
}
