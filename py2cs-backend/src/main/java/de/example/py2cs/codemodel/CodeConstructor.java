package de.example.py2cs.codemodel;

import java.util.List;

/** Instance or static constructor; takes its name from the enclosing type when written. */
public final class CodeConstructor extends CodeMemberMethod {

  public CodeConstructor(List<CodeParameterDeclarationExpression> parameters) {
    super(null, parameters, null);
  }

  @Override
  public void accept(CodeMemberVisitor v) {
    v.visit(this);
  }
}
