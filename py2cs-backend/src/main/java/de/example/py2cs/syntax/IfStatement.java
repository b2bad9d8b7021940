package de.example.py2cs.syntax;

import java.util.List;

public record IfStatement(Exp test, List<Statement> then, List<Statement> orElse) implements Statement {
  public IfStatement {
    Nodes.require(test, "IfStatement", "test");
    then = Nodes.copy(then);
    orElse = Nodes.copy(orElse);
  }

  @Override
  public <A> void accept(StatementVisitor<A> v, A arg) {
    v.visit(this, arg);
  }
}
