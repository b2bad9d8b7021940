package de.example.py2cs.syntax;

public record LongLiteral(long value) implements Exp {
  @Override
  public <R> R accept(ExpressionVisitor<R> v) {
    return v.visit(this);
  }
}
