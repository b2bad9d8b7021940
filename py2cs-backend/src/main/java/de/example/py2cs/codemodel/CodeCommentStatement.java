package de.example.py2cs.codemodel;

public record CodeCommentStatement(String comment) implements CodeStatement {

  @Override
  public void accept(CodeStatementVisitor v) {
    v.visit(this);
  }
}
