package de.example.py2cs.syntax;

import java.util.List;

public record ForStatement(Exp exprs, Exp tests, List<Statement> body) implements Statement {
  public ForStatement {
    Nodes.require(exprs, "ForStatement", "exprs");
    Nodes.require(tests, "ForStatement", "tests");
    body = Nodes.copy(body);
  }

  @Override
  public <A> void accept(StatementVisitor<A> v, A arg) {
    v.visit(this, arg);
  }
}
