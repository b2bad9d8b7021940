package de.example.py2cs.codemodel;

public record CodeNamedArgument(CodeExpression name, CodeExpression value) implements CodeExpression {

  @Override
  public <A> void accept(CodeExpressionVisitor<A> v, A arg) {
    v.visit(this, arg);
  }
}
