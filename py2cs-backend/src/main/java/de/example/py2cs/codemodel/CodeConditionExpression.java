package de.example.py2cs.codemodel;

public record CodeConditionExpression(CodeExpression condition, CodeExpression consequent, CodeExpression alternative) implements CodeExpression {

  @Override
  public <A> void accept(CodeExpressionVisitor<A> v, A arg) {
    v.visit(this, arg);
  }
}
