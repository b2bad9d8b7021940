package de.example.py2cs.codemodel;

import java.util.List;

public record CodeArrayCreateExpression(CodeTypeReference elementType, List<CodeExpression> initializers) implements CodeExpression {

  public CodeArrayCreateExpression {
    initializers = List.copyOf(initializers);
  }

  @Override
  public <A> void accept(CodeExpressionVisitor<A> v, A arg) {
    v.visit(this, arg);
  }
}
