package de.example.py2cs.codemodel;

public record CodeBinaryOperatorExpression(CodeExpression left, CodeOperatorType operator, CodeExpression right) implements CodeExpression {

  @Override
  public <A> void accept(CodeExpressionVisitor<A> v, A arg) {
    v.visit(this, arg);
  }
}
