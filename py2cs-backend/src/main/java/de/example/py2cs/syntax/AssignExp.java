package de.example.py2cs.syntax;

public record AssignExp(Exp dst, Op op, Exp src) implements Exp {
  public AssignExp {
    Nodes.require(dst, "AssignExp", "dst");
    Nodes.require(op, "AssignExp", "op");
    Nodes.require(src, "AssignExp", "src");
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> v) {
    return v.visit(this);
  }
}
