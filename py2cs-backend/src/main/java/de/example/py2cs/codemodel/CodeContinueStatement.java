package de.example.py2cs.codemodel;

public record CodeContinueStatement() implements CodeStatement {

  @Override
  public void accept(CodeStatementVisitor v) {
    v.visit(this);
  }
}
