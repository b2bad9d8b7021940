package de.example.py2cs.syntax;

/**
 * A formal parameter. {@code varArgs} marks {@code *args}, {@code keyArgs}
 * marks {@code **kwargs}.
 */
public record Parameter(Identifier id, Exp annotation, Exp defaultValue, boolean varArgs, boolean keyArgs) {
  public Parameter {
    Nodes.require(id, "Parameter", "id");
  }

  public static Parameter of(String name) {
    return new Parameter(new Identifier(name), null, null, false, false);
  }
}
