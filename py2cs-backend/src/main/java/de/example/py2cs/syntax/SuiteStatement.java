package de.example.py2cs.syntax;

import java.util.List;

public record SuiteStatement(List<Statement> statements) implements Statement {
  public SuiteStatement {
    statements = Nodes.copy(statements);
  }

  @Override
  public <A> void accept(StatementVisitor<A> v, A arg) {
    v.visit(this, arg);
  }
}
