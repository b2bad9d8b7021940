package de.example.py2cs.syntax;

/**
 * A string literal. {@code s} is the literal body exactly as written between
 * the quotes, escape sequences included; {@code raw} marks {@code r"..."},
 * {@code longForm} marks triple-quoted strings.
 */
public record Str(String s, boolean raw, boolean longForm) implements Exp {
  public Str {
    Nodes.require(s, "Str", "s");
  }

  public static Str of(String s) {
    return new Str(s, false, false);
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> v) {
    return v.visit(this);
  }
}
