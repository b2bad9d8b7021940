package de.example.py2cs.syntax;

public record UnaryExp(Op op, Exp expression) implements Exp {
  public UnaryExp {
    Nodes.require(op, "UnaryExp", "op");
    Nodes.require(expression, "UnaryExp", "expression");
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> v) {
    return v.visit(this);
  }
}
