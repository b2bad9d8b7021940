package de.example.py2cs.syntax;

import java.util.List;

public record TryStatement(List<Statement> body, List<ExceptHandler> handlers, List<Statement> finallyBody) implements Statement {
  public TryStatement {
    body = Nodes.copy(body);
    handlers = Nodes.copy(handlers);
    finallyBody = Nodes.copy(finallyBody);
  }

  @Override
  public <A> void accept(StatementVisitor<A> v, A arg) {
    v.visit(this, arg);
  }
}
