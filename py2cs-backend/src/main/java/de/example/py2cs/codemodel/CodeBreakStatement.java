package de.example.py2cs.codemodel;

public record CodeBreakStatement() implements CodeStatement {

  @Override
  public void accept(CodeStatementVisitor v) {
    v.visit(this);
  }
}
