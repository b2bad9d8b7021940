package de.example.py2cs.syntax;

import java.util.List;

public record ClassDef(Identifier name, List<Exp> bases, List<Statement> body) implements Statement {
  public ClassDef {
    Nodes.require(name, "ClassDef", "name");
    bases = Nodes.copy(bases);
    body = Nodes.copy(body);
  }

  @Override
  public <A> void accept(StatementVisitor<A> v, A arg) {
    v.visit(this, arg);
  }
}
