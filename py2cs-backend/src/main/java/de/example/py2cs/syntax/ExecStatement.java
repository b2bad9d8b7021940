package de.example.py2cs.syntax;

public record ExecStatement(Exp code, Exp globals, Exp locals) implements Statement {
  public ExecStatement {
    Nodes.require(code, "ExecStatement", "code");
  }

  @Override
  public <A> void accept(StatementVisitor<A> v, A arg) {
    v.visit(this, arg);
  }
}
