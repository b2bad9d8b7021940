package de.example.py2cs.syntax;

import java.util.List;

public record PySet(List<Exp> elements) implements Exp {
  public PySet {
    elements = Nodes.copy(elements);
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> v) {
    return v.visit(this);
  }
}
