package de.example.py2cs.codemodel;

import java.util.Arrays;
import java.util.List;

public record CodeTypeReference(String typeName, List<CodeTypeReference> typeArguments, int arrayRank) {

  public static final CodeTypeReference OBJECT = of("object");
  public static final CodeTypeReference VOID = of("void");

  public CodeTypeReference {
    typeArguments = typeArguments == null ? List.of() : List.copyOf(typeArguments);
  }

  public static CodeTypeReference of(String typeName, CodeTypeReference... typeArguments) {
    return new CodeTypeReference(typeName, Arrays.asList(typeArguments), 0);
  }

  public static CodeTypeReference arrayOf(CodeTypeReference element) {
    return new CodeTypeReference(element.typeName, element.typeArguments, element.arrayRank + 1);
  }

  public boolean isVoid() {
    return arrayRank == 0 && (typeName == null || "void".equals(typeName));
  }

  public boolean isObject() {
    return arrayRank == 0 && typeArguments.isEmpty()
        && ("object".equals(typeName) || "System.Object".equals(typeName));
  }
}
