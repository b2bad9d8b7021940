package de.example.py2cs.syntax;

import java.util.List;

public record PyList(List<Exp> elements) implements Exp {
  public PyList {
    elements = Nodes.copy(elements);
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> v) {
    return v.visit(this);
  }
}
