package de.example.py2cs.syntax;

import java.util.List;

public record Decorated(List<Decorator> decorations, Statement statement) implements Statement {
  public Decorated {
    Nodes.require(statement, "Decorated", "statement");
    decorations = Nodes.copy(decorations);
  }

  @Override
  public <A> void accept(StatementVisitor<A> v, A arg) {
    v.visit(this, arg);
  }
}
