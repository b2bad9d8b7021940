package de.example.py2cs.syntax;

/** A {@code b"..."} literal; {@code s} keeps its escape sequences as written. */
public record Bytes(String s) implements Exp {
  public Bytes {
    Nodes.require(s, "Bytes", "s");
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> v) {
    return v.visit(this);
  }
}
