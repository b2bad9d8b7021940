package de.example.py2cs.syntax;

import java.util.List;

public record WithStatement(List<WithItem> items, List<Statement> body) implements Statement {
  public WithStatement {
    items = Nodes.copy(items);
    body = Nodes.copy(body);
  }

  @Override
  public <A> void accept(StatementVisitor<A> v, A arg) {
    v.visit(this, arg);
  }
}
