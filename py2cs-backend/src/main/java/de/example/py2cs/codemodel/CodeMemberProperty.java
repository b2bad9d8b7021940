package de.example.py2cs.codemodel;

import java.util.ArrayList;
import java.util.List;

/**
 * A property with a getter and an optional setter. A property is never
 * setter-only: the getter body always exists, the setter body only after
 * {@link #enableSetter()}.
 */
public final class CodeMemberProperty extends CodeTypeMember {
  private final CodeTypeReference propertyType;
  private final List<CodeStatement> getStatements = new ArrayList<>();
  private List<CodeStatement> setStatements;

  public CodeMemberProperty(String name, CodeTypeReference propertyType) {
    super(name);
    this.propertyType = propertyType;
  }

  public CodeTypeReference getPropertyType() {
    return propertyType;
  }

  public List<CodeStatement> getGetStatements() {
    return getStatements;
  }

  public boolean hasSet() {
    return setStatements != null;
  }

  /** Null when the property has no setter. */
  public List<CodeStatement> getSetStatements() {
    return setStatements;
  }

  public List<CodeStatement> enableSetter() {
    if (setStatements == null) setStatements = new ArrayList<>();
    return setStatements;
  }

  @Override
  public void accept(CodeMemberVisitor v) {
    v.visit(this);
  }
}
