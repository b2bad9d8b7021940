package de.example.py2cs.codemodel;

/** A method name, optionally qualified by a target; a null target means an unqualified call. */
public record CodeMethodReferenceExpression(CodeExpression targetObject, String methodName) implements CodeExpression {

  @Override
  public <A> void accept(CodeExpressionVisitor<A> v, A arg) {
    v.visit(this, arg);
  }
}
