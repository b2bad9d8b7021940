package de.example.py2cs.syntax;

import java.util.List;

public record Decorator(DottedName className, List<Argument> arguments) {
  public Decorator {
    Nodes.require(className, "Decorator", "className");
    arguments = Nodes.copy(arguments);
  }
}
