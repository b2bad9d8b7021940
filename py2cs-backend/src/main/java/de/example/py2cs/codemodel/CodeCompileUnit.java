package de.example.py2cs.codemodel;

import java.util.ArrayList;
import java.util.List;

public final class CodeCompileUnit {
  private final List<CodeNamespace> namespaces = new ArrayList<>();

  public List<CodeNamespace> getNamespaces() {
    return namespaces;
  }
}
