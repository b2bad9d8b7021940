package de.example.py2cs.syntax;

import java.util.List;

public record DelStatement(List<Exp> expressions) implements Statement {
  public DelStatement {
    expressions = Nodes.copy(expressions);
  }

  @Override
  public <A> void accept(StatementVisitor<A> v, A arg) {
    v.visit(this, arg);
  }
}
