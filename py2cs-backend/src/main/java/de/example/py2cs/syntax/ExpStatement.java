package de.example.py2cs.syntax;

public record ExpStatement(Exp expression) implements Statement {
  public ExpStatement {
    Nodes.require(expression, "ExpStatement", "expression");
  }

  @Override
  public <A> void accept(StatementVisitor<A> v, A arg) {
    v.visit(this, arg);
  }
}
