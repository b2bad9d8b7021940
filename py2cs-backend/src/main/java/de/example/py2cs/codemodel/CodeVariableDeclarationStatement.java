package de.example.py2cs.codemodel;

/** A local declaration; a null {@code type} is written as {@code var}. */
public record CodeVariableDeclarationStatement(CodeTypeReference type, String name, CodeExpression initExpression) implements CodeStatement {

  @Override
  public void accept(CodeStatementVisitor v) {
    v.visit(this);
  }
}
