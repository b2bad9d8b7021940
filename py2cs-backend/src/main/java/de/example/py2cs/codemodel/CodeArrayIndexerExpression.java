package de.example.py2cs.codemodel;

import java.util.List;

public record CodeArrayIndexerExpression(CodeExpression targetObject, List<CodeExpression> indices) implements CodeExpression {

  public CodeArrayIndexerExpression {
    indices = List.copyOf(indices);
  }

  @Override
  public <A> void accept(CodeExpressionVisitor<A> v, A arg) {
    v.visit(this, arg);
  }
}
