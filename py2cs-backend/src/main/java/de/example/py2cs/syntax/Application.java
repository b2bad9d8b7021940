package de.example.py2cs.syntax;

import java.util.List;

public record Application(Exp function, List<Argument> args) implements Exp {
  public Application {
    Nodes.require(function, "Application", "function");
    args = Nodes.copy(args);
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> v) {
    return v.visit(this);
  }
}
