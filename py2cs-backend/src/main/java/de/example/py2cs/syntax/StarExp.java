package de.example.py2cs.syntax;

public record StarExp(Exp expression) implements Exp {
  public StarExp {
    Nodes.require(expression, "StarExp", "expression");
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> v) {
    return v.visit(this);
  }
}
