package de.example.py2cs.codemodel;

public interface CodeStatementVisitor {

  void visit(CodeAssignStatement s);

  void visit(CodeExpressionStatement s);

  void visit(CodeVariableDeclarationStatement s);

  void visit(CodeConditionStatement s);

  void visit(CodeWhileStatement s);

  void visit(CodeDoWhileStatement s);

  void visit(CodeForeachStatement s);

  void visit(CodeTryCatchFinallyStatement s);

  void visit(CodeUsingStatement s);

  void visit(CodeThrowExceptionStatement s);

  void visit(CodeMethodReturnStatement s);

  void visit(CodeYieldStatement s);

  void visit(CodeCommentStatement s);

  void visit(CodeBreakStatement s);

  void visit(CodeContinueStatement s);
}
