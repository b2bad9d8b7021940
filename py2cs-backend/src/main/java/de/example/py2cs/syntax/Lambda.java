package de.example.py2cs.syntax;

import java.util.List;

public record Lambda(List<Parameter> parameters, Exp body) implements Exp {
  public Lambda {
    Nodes.require(body, "Lambda", "body");
    parameters = Nodes.copy(parameters);
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> v) {
    return v.visit(this);
  }
}
