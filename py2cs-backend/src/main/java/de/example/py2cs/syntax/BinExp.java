package de.example.py2cs.syntax;

public record BinExp(Op op, Exp left, Exp right) implements Exp {
  public BinExp {
    Nodes.require(op, "BinExp", "op");
    Nodes.require(left, "BinExp", "left");
    Nodes.require(right, "BinExp", "right");
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> v) {
    return v.visit(this);
  }
}
