package de.example.py2cs.syntax;

import java.util.List;

public record PyTuple(List<Exp> values) implements Exp {
  public PyTuple {
    values = Nodes.copy(values);
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> v) {
    return v.visit(this);
  }
}
