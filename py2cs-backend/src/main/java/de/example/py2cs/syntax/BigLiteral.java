package de.example.py2cs.syntax;

import java.math.BigInteger;

public record BigLiteral(BigInteger value) implements Exp {
  public BigLiteral {
    Nodes.require(value, "BigLiteral", "value");
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> v) {
    return v.visit(this);
  }
}
