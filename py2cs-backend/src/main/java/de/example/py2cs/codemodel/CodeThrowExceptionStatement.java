package de.example.py2cs.codemodel;

/** {@code toThrow} is null for a bare rethrow. */
public record CodeThrowExceptionStatement(CodeExpression toThrow) implements CodeStatement {

  @Override
  public void accept(CodeStatementVisitor v) {
    v.visit(this);
  }
}
