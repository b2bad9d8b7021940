package de.example.py2cs.codemodel;

import java.util.List;

public record CodeTryCatchFinallyStatement(List<CodeStatement> tryStatements, List<CodeCatchClause> catchClauses, List<CodeStatement> finallyStatements) implements CodeStatement {

  @Override
  public void accept(CodeStatementVisitor v) {
    v.visit(this);
  }
}
