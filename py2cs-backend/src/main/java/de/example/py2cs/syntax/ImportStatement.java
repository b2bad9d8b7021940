package de.example.py2cs.syntax;

import java.util.List;

public record ImportStatement(List<AliasedName> names) implements Statement {
  public ImportStatement {
    names = Nodes.copy(names);
  }

  @Override
  public <A> void accept(StatementVisitor<A> v, A arg) {
    v.visit(this, arg);
  }
}
