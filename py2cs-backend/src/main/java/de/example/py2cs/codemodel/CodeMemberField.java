package de.example.py2cs.codemodel;

public final class CodeMemberField extends CodeTypeMember {
  private final CodeTypeReference type;
  private CodeExpression initExpression;

  public CodeMemberField(CodeTypeReference type, String name) {
    super(name);
    this.type = type;
  }

  public CodeTypeReference getType() {
    return type;
  }

  public CodeExpression getInitExpression() {
    return initExpression;
  }

  public void setInitExpression(CodeExpression initExpression) {
    this.initExpression = initExpression;
  }

  @Override
  public void accept(CodeMemberVisitor v) {
    v.visit(this);
  }
}
