package de.example.py2cs.codemodel;

public record CodeYieldStatement(CodeExpression expression) implements CodeStatement {

  @Override
  public void accept(CodeStatementVisitor v) {
    v.visit(this);
  }
}
