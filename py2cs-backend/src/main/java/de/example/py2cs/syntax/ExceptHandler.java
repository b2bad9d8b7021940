package de.example.py2cs.syntax;

import java.util.List;

/** {@code except type as name:}; both type and name may be absent. */
public record ExceptHandler(Exp type, Identifier name, List<Statement> body) {
  public ExceptHandler {
    body = Nodes.copy(body);
  }
}
