package de.example.py2cs.codemodel;

import java.util.List;

public record CodeApplicationExpression(CodeExpression method, List<CodeExpression> arguments) implements CodeExpression {

  public CodeApplicationExpression {
    arguments = List.copyOf(arguments);
  }

  @Override
  public <A> void accept(CodeExpressionVisitor<A> v, A arg) {
    v.visit(this, arg);
  }
}
