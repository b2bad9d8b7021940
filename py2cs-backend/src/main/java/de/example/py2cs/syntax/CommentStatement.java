package de.example.py2cs.syntax;

public record CommentStatement(String comment) implements Statement {
  public CommentStatement {
    Nodes.require(comment, "CommentStatement", "comment");
  }

  @Override
  public <A> void accept(StatementVisitor<A> v, A arg) {
    v.visit(this, arg);
  }
}
