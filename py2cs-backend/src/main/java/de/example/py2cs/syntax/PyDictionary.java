package de.example.py2cs.syntax;

import java.util.List;

public record PyDictionary(List<KeyValue> items) implements Exp {
  public PyDictionary {
    items = Nodes.copy(items);
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> v) {
    return v.visit(this);
  }
}
