package de.example.py2cs.syntax;

public record ContinueStatement() implements Statement {
  @Override
  public <A> void accept(StatementVisitor<A> v, A arg) {
    v.visit(this, arg);
  }
}
