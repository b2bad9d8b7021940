package de.example.py2cs.syntax;

import java.util.List;

public record PrintStatement(Exp outputStream, List<Argument> args) implements Statement {
  public PrintStatement {
    args = Nodes.copy(args);
  }

  @Override
  public <A> void accept(StatementVisitor<A> v, A arg) {
    v.visit(this, arg);
  }
}
