package de.example.py2cs.syntax;

public record Identifier(String name) implements Exp {
  public Identifier {
    Nodes.require(name, "Identifier", "name");
  }

  /** The placeholder target {@code _} that discards a value. */
  public boolean isWildcard() {
    return "_".equals(name);
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> v) {
    return v.visit(this);
  }
}
