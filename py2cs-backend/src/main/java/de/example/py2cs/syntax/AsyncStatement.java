package de.example.py2cs.syntax;

public record AsyncStatement(Statement statement) implements Statement {
  public AsyncStatement {
    Nodes.require(statement, "AsyncStatement", "statement");
  }

  @Override
  public <A> void accept(StatementVisitor<A> v, A arg) {
    v.visit(this, arg);
  }
}
