package de.example.py2cs.syntax;

import java.util.List;

public record FunctionDef(Identifier name, List<Parameter> parameters, List<Statement> body, Exp annotation) implements Statement {
  public FunctionDef {
    Nodes.require(name, "FunctionDef", "name");
    parameters = Nodes.copy(parameters);
    body = Nodes.copy(body);
  }

  @Override
  public <A> void accept(StatementVisitor<A> v, A arg) {
    v.visit(this, arg);
  }
}
