package de.example.py2cs.syntax;

import java.util.List;

public record ArrayRef(Exp array, List<Slice> subs) implements Exp {
  public ArrayRef {
    Nodes.require(array, "ArrayRef", "array");
    subs = Nodes.copy(subs);
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> v) {
    return v.visit(this);
  }
}
