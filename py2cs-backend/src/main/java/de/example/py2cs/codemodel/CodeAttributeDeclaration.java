package de.example.py2cs.codemodel;

import java.util.List;

public record CodeAttributeDeclaration(CodeTypeReference attributeType, List<CodeAttributeArgument> arguments) {

  public CodeAttributeDeclaration {
    arguments = List.copyOf(arguments);
  }
}
