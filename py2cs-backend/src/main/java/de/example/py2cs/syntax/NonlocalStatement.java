package de.example.py2cs.syntax;

import java.util.List;

public record NonlocalStatement(List<Identifier> names) implements Statement {
  public NonlocalStatement {
    names = Nodes.copy(names);
  }

  @Override
  public <A> void accept(StatementVisitor<A> v, A arg) {
    v.visit(this, arg);
  }
}
