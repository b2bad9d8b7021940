package de.example.py2cs.codemodel;

import java.util.ArrayList;
import java.util.List;

public final class CodeTypeDeclaration extends CodeTypeMember {
  private final List<CodeTypeReference> baseTypes = new ArrayList<>();
  private final List<CodeTypeMember> members = new ArrayList<>();

  public CodeTypeDeclaration(String name) {
    super(name);
  }

  public List<CodeTypeReference> getBaseTypes() {
    return baseTypes;
  }

  public List<CodeTypeMember> getMembers() {
    return members;
  }

  @Override
  public void accept(CodeMemberVisitor v) {
    v.visit(this);
  }
}
