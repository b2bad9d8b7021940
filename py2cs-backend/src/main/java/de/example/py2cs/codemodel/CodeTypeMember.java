package de.example.py2cs.codemodel;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

public abstract class CodeTypeMember {
  private final String name;
  private final Set<MemberAttributes> attributes = EnumSet.noneOf(MemberAttributes.class);
  private final List<CodeAttributeDeclaration> customAttributes = new ArrayList<>();
  private final List<CodeCommentStatement> comments = new ArrayList<>();

  protected CodeTypeMember(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  public Set<MemberAttributes> getAttributes() {
    return attributes;
  }

  public boolean isStatic() {
    return attributes.contains(MemberAttributes.STATIC);
  }

  public List<CodeAttributeDeclaration> getCustomAttributes() {
    return customAttributes;
  }

  public List<CodeCommentStatement> getComments() {
    return comments;
  }

  public abstract void accept(CodeMemberVisitor v);
}
