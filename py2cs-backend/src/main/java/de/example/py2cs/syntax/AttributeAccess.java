package de.example.py2cs.syntax;

public record AttributeAccess(Exp expression, Identifier fieldName) implements Exp {
  public AttributeAccess {
    Nodes.require(expression, "AttributeAccess", "expression");
    Nodes.require(fieldName, "AttributeAccess", "fieldName");
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> v) {
    return v.visit(this);
  }
}
