package de.example.py2cs.syntax;

import java.util.List;

/** One translation unit: a parsed Python source file. */
public record Module(String name, List<Statement> statements) {
  public Module {
    statements = Nodes.copy(statements);
  }
}
