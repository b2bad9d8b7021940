package de.example.py2cs.codemodel;

import java.util.List;

/** Each initializer is a declaration, an assignment or an expression statement. */
public record CodeUsingStatement(List<CodeStatement> initializers, List<CodeStatement> statements) implements CodeStatement {

  @Override
  public void accept(CodeStatementVisitor v) {
    v.visit(this);
  }
}
