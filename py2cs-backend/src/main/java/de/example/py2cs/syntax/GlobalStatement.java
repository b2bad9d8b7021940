package de.example.py2cs.syntax;

import java.util.List;

public record GlobalStatement(List<Identifier> names) implements Statement {
  public GlobalStatement {
    names = Nodes.copy(names);
  }

  @Override
  public <A> void accept(StatementVisitor<A> v, A arg) {
    v.visit(this, arg);
  }
}
