package de.example.py2cs.syntax;

public record TestExp(Exp consequent, Exp condition, Exp alternative) implements Exp {
  public TestExp {
    Nodes.require(consequent, "TestExp", "consequent");
    Nodes.require(condition, "TestExp", "condition");
    Nodes.require(alternative, "TestExp", "alternative");
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> v) {
    return v.visit(this);
  }
}
