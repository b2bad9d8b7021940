package de.example.py2cs.codemodel;

public record CodeFieldReferenceExpression(CodeExpression expression, String fieldName) implements CodeExpression {

  @Override
  public <A> void accept(CodeExpressionVisitor<A> v, A arg) {
    v.visit(this, arg);
  }
}
