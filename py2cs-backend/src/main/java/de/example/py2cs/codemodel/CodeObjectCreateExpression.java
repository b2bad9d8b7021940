package de.example.py2cs.codemodel;

import java.util.List;

public record CodeObjectCreateExpression(CodeTypeReference type, List<CodeExpression> arguments, List<CodeExpression> initializers, CodeExpression initializer) implements CodeExpression {

  public CodeObjectCreateExpression {
    arguments = arguments == null ? List.of() : List.copyOf(arguments);
    initializers = initializers == null ? List.of() : List.copyOf(initializers);
  }

  @Override
  public <A> void accept(CodeExpressionVisitor<A> v, A arg) {
    v.visit(this, arg);
  }
}
