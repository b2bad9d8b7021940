package de.example.py2cs.codemodel;

public record CodeParameterDeclarationExpression(
    CodeTypeReference parameterType, String parameterName, CodeExpression defaultValue, boolean isParams) {

  public static CodeParameterDeclarationExpression of(CodeTypeReference type, String name) {
    return new CodeParameterDeclarationExpression(type, name, null, false);
  }
}
