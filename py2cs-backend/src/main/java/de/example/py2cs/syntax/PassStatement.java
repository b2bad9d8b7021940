package de.example.py2cs.syntax;

public record PassStatement() implements Statement {
  @Override
  public <A> void accept(StatementVisitor<A> v, A arg) {
    v.visit(this, arg);
  }
}
