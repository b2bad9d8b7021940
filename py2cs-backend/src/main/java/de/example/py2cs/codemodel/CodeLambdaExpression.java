package de.example.py2cs.codemodel;

import java.util.List;

/** Either an expression body or a statement body; {@code body} is null for the latter. */
public record CodeLambdaExpression(List<CodeVariableReferenceExpression> arguments, CodeExpression body, List<CodeStatement> statements) implements CodeExpression {

  public CodeLambdaExpression {
    arguments = List.copyOf(arguments);
    statements = statements == null ? List.of() : List.copyOf(statements);
  }

  public static CodeLambdaExpression of(List<CodeVariableReferenceExpression> arguments, CodeExpression body) {
    return new CodeLambdaExpression(arguments, body, List.of());
  }

  public boolean hasStatementBody() {
    return body == null;
  }

  @Override
  public <A> void accept(CodeExpressionVisitor<A> v, A arg) {
    v.visit(this, arg);
  }
}
