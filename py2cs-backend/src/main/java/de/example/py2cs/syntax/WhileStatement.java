package de.example.py2cs.syntax;

import java.util.List;

public record WhileStatement(Exp test, List<Statement> body, List<Statement> orElse) implements Statement {
  public WhileStatement {
    Nodes.require(test, "WhileStatement", "test");
    body = Nodes.copy(body);
    orElse = Nodes.copy(orElse);
  }

  @Override
  public <A> void accept(StatementVisitor<A> v, A arg) {
    v.visit(this, arg);
  }
}
