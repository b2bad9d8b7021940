package de.example.py2cs.codemodel;

/**
 * A literal. {@code value} is null, a {@link String}, {@link Boolean}, {@link Integer},
 * {@link Long}, {@link Double}, {@link java.math.BigInteger}, {@link CodeStringLiteral}
 * or {@link CodeByteLiteral}.
 */
public record CodePrimitiveExpression(Object value) implements CodeExpression {

  @Override
  public <A> void accept(CodeExpressionVisitor<A> v, A arg) {
    v.visit(this, arg);
  }
}
