package de.example.py2cs.syntax;

/** A call argument; {@code name} is set for keyword arguments. */
public record Argument(Identifier name, Exp value) {
  public Argument {
    Nodes.require(value, "Argument", "value");
  }

  public static Argument of(Exp value) {
    return new Argument(null, value);
  }
}
