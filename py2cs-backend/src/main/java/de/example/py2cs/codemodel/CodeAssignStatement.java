package de.example.py2cs.codemodel;

public record CodeAssignStatement(CodeExpression destination, CodeExpression source) implements CodeStatement {

  @Override
  public void accept(CodeStatementVisitor v) {
    v.visit(this);
  }
}
