package de.example.py2cs.syntax;

import java.util.List;

public record AssertStatement(List<Exp> tests) implements Statement {
  public AssertStatement {
    tests = Nodes.copy(tests);
  }

  @Override
  public <A> void accept(StatementVisitor<A> v, A arg) {
    v.visit(this, arg);
  }
}
