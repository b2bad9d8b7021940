package de.example.py2cs.syntax;

import java.util.List;

public record ExpList(List<Exp> expressions) implements Exp {
  public ExpList {
    expressions = Nodes.copy(expressions);
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> v) {
    return v.visit(this);
  }
}
