package de.example.py2cs.codemodel;

import java.util.List;

public record CodeCollectionInitializer(List<CodeExpression> values) implements CodeExpression {

  public CodeCollectionInitializer {
    values = List.copyOf(values);
  }

  @Override
  public <A> void accept(CodeExpressionVisitor<A> v, A arg) {
    v.visit(this, arg);
  }
}
