package de.example.py2cs.codemodel;

public interface CodeExpressionVisitor<A> {

  void visit(CodeVariableReferenceExpression e, A arg);

  void visit(CodeFieldReferenceExpression e, A arg);

  void visit(CodeMethodReferenceExpression e, A arg);

  void visit(CodeArrayIndexerExpression e, A arg);

  void visit(CodeApplicationExpression e, A arg);

  void visit(CodeBinaryOperatorExpression e, A arg);

  void visit(CodeUnaryOperatorExpression e, A arg);

  void visit(CodeConditionExpression e, A arg);

  void visit(CodeLambdaExpression e, A arg);

  void visit(CodeObjectCreateExpression e, A arg);

  void visit(CodeArrayCreateExpression e, A arg);

  void visit(CodeCollectionInitializer e, A arg);

  void visit(CodePrimitiveExpression e, A arg);

  void visit(CodeNamedArgument e, A arg);

  void visit(CodeThisReferenceExpression e, A arg);

  void visit(CodeTypeReferenceExpression e, A arg);
}
