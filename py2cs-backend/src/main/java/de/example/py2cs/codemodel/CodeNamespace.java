package de.example.py2cs.codemodel;

import java.util.ArrayList;
import java.util.List;

public final class CodeNamespace {
  private final String name;
  private final List<CodeNamespaceImport> imports = new ArrayList<>();
  private final List<CodeTypeDeclaration> types = new ArrayList<>();

  public CodeNamespace(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  public List<CodeNamespaceImport> getImports() {
    return imports;
  }

  public List<CodeTypeDeclaration> getTypes() {
    return types;
  }
}
