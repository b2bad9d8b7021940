package de.example.py2cs.codemodel;

import java.util.List;

public record CodeDoWhileStatement(List<CodeStatement> statements, CodeExpression test) implements CodeStatement {

  @Override
  public void accept(CodeStatementVisitor v) {
    v.visit(this);
  }
}
