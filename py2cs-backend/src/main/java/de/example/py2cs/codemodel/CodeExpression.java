package de.example.py2cs.codemodel;

public interface CodeExpression {

  <A> void accept(CodeExpressionVisitor<A> v, A arg);
}
