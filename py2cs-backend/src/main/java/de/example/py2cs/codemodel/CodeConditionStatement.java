package de.example.py2cs.codemodel;

import java.util.List;

/** Branch lists are filled in place while the branches are generated. */
public record CodeConditionStatement(CodeExpression condition, List<CodeStatement> trueStatements, List<CodeStatement> falseStatements) implements CodeStatement {

  @Override
  public void accept(CodeStatementVisitor v) {
    v.visit(this);
  }
}
