package de.example.py2cs.codemodel;

import java.util.List;

public record CodeForeachStatement(CodeExpression variable, CodeExpression collection, List<CodeStatement> statements) implements CodeStatement {

  @Override
  public void accept(CodeStatementVisitor v) {
    v.visit(this);
  }
}
