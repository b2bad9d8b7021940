package de.example.py2cs.codemodel;

import java.util.ArrayList;
import java.util.List;

public class CodeMemberMethod extends CodeTypeMember {
  private final List<CodeParameterDeclarationExpression> parameters;
  private final CodeTypeReference returnType;
  private final List<CodeStatement> statements = new ArrayList<>();

  public CodeMemberMethod(String name, List<CodeParameterDeclarationExpression> parameters, CodeTypeReference returnType) {
    super(name);
    this.parameters = List.copyOf(parameters);
    this.returnType = returnType;
  }

  public List<CodeParameterDeclarationExpression> getParameters() {
    return parameters;
  }

  public CodeTypeReference getReturnType() {
    return returnType;
  }

  public List<CodeStatement> getStatements() {
    return statements;
  }

  @Override
  public void accept(CodeMemberVisitor v) {
    v.visit(this);
  }
}
