package de.example.py2cs.translate;

import de.example.py2cs.codemodel.CodeApplicationExpression;
import de.example.py2cs.codemodel.CodeArrayCreateExpression;
import de.example.py2cs.codemodel.CodeArrayIndexerExpression;
import de.example.py2cs.codemodel.CodeAssignStatement;
import de.example.py2cs.codemodel.CodeBinaryOperatorExpression;
import de.example.py2cs.codemodel.CodeBreakStatement;
import de.example.py2cs.codemodel.CodeCatchClause;
import de.example.py2cs.codemodel.CodeCollectionInitializer;
import de.example.py2cs.codemodel.CodeCommentStatement;
import de.example.py2cs.codemodel.CodeConditionExpression;
import de.example.py2cs.codemodel.CodeConditionStatement;
import de.example.py2cs.codemodel.CodeContinueStatement;
import de.example.py2cs.codemodel.CodeDoWhileStatement;
import de.example.py2cs.codemodel.CodeExpression;
import de.example.py2cs.codemodel.CodeExpressionStatement;
import de.example.py2cs.codemodel.CodeExpressionVisitor;
import de.example.py2cs.codemodel.CodeFieldReferenceExpression;
import de.example.py2cs.codemodel.CodeForeachStatement;
import de.example.py2cs.codemodel.CodeLambdaExpression;
import de.example.py2cs.codemodel.CodeMethodReferenceExpression;
import de.example.py2cs.codemodel.CodeMethodReturnStatement;
import de.example.py2cs.codemodel.CodeNamedArgument;
import de.example.py2cs.codemodel.CodeObjectCreateExpression;
import de.example.py2cs.codemodel.CodePrimitiveExpression;
import de.example.py2cs.codemodel.CodeStatement;
import de.example.py2cs.codemodel.CodeStatementVisitor;
import de.example.py2cs.codemodel.CodeThisReferenceExpression;
import de.example.py2cs.codemodel.CodeThrowExceptionStatement;
import de.example.py2cs.codemodel.CodeTryCatchFinallyStatement;
import de.example.py2cs.codemodel.CodeTypeReferenceExpression;
import de.example.py2cs.codemodel.CodeUnaryOperatorExpression;
import de.example.py2cs.codemodel.CodeUsingStatement;
import de.example.py2cs.codemodel.CodeVariableDeclarationStatement;
import de.example.py2cs.codemodel.CodeVariableReferenceExpression;
import de.example.py2cs.codemodel.CodeWhileStatement;
import de.example.py2cs.codemodel.CodeYieldStatement;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects the variable names a piece of code mentions, lambda bodies
 * included, together with names introduced by declarations.
 */
final class VariableReferenceFinder implements CodeStatementVisitor, CodeExpressionVisitor<Void> {
  private final Set<String> referenced = new LinkedHashSet<>();
  private Set<String> declared = new LinkedHashSet<>();

  static boolean references(CodeStatement s, String name) {
    VariableReferenceFinder f = new VariableReferenceFinder();
    s.accept(f);
    return f.referenced.contains(name);
  }

  static boolean references(CodeExpression e, String name) {
    VariableReferenceFinder f = new VariableReferenceFinder();
    f.expr(e);
    return f.referenced.contains(name);
  }

  /** Names declared by a declaration statement anywhere in {@code statements}. */
  static Set<String> declaredNames(List<CodeStatement> statements) {
    VariableReferenceFinder f = new VariableReferenceFinder();
    f.all(statements);
    return f.declared;
  }

  private void all(List<CodeStatement> statements) {
    for (CodeStatement s : statements) s.accept(this);
  }

  private void expr(CodeExpression e) {
    if (e != null) e.accept(this, null);
  }

  private void exprs(List<CodeExpression> es) {
    for (CodeExpression e : es) expr(e);
  }

  @Override
  public void visit(CodeAssignStatement s) {
    expr(s.destination());
    expr(s.source());
  }

  @Override
  public void visit(CodeExpressionStatement s) {
    expr(s.expression());
  }

  @Override
  public void visit(CodeVariableDeclarationStatement s) {
    declared.add(s.name());
    expr(s.initExpression());
  }

  @Override
  public void visit(CodeConditionStatement s) {
    expr(s.condition());
    all(s.trueStatements());
    all(s.falseStatements());
  }

  @Override
  public void visit(CodeWhileStatement s) {
    expr(s.test());
    all(s.statements());
  }

  @Override
  public void visit(CodeDoWhileStatement s) {
    all(s.statements());
    expr(s.test());
  }

  @Override
  public void visit(CodeForeachStatement s) {
    expr(s.variable());
    expr(s.collection());
    all(s.statements());
  }

  @Override
  public void visit(CodeTryCatchFinallyStatement s) {
    all(s.tryStatements());
    for (CodeCatchClause c : s.catchClauses()) all(c.statements());
    all(s.finallyStatements());
  }

  @Override
  public void visit(CodeUsingStatement s) {
    all(s.initializers());
    all(s.statements());
  }

  @Override
  public void visit(CodeThrowExceptionStatement s) {
    expr(s.toThrow());
  }

  @Override
  public void visit(CodeMethodReturnStatement s) {
    expr(s.expression());
  }

  @Override
  public void visit(CodeYieldStatement s) {
    expr(s.expression());
  }

  @Override
  public void visit(CodeCommentStatement s) {
  }

  @Override
  public void visit(CodeBreakStatement s) {
  }

  @Override
  public void visit(CodeContinueStatement s) {
  }

  @Override
  public void visit(CodeVariableReferenceExpression e, Void arg) {
    referenced.add(e.name());
  }

  @Override
  public void visit(CodeFieldReferenceExpression e, Void arg) {
    expr(e.expression());
  }

  @Override
  public void visit(CodeMethodReferenceExpression e, Void arg) {
    expr(e.targetObject());
    // an unqualified call mentions the name of a local delegate
    if (e.targetObject() == null) referenced.add(e.methodName());
  }

  @Override
  public void visit(CodeArrayIndexerExpression e, Void arg) {
    expr(e.targetObject());
    exprs(e.indices());
  }

  @Override
  public void visit(CodeApplicationExpression e, Void arg) {
    expr(e.method());
    exprs(e.arguments());
  }

  @Override
  public void visit(CodeBinaryOperatorExpression e, Void arg) {
    expr(e.left());
    expr(e.right());
  }

  @Override
  public void visit(CodeUnaryOperatorExpression e, Void arg) {
    expr(e.expression());
  }

  @Override
  public void visit(CodeConditionExpression e, Void arg) {
    expr(e.condition());
    expr(e.consequent());
    expr(e.alternative());
  }

  @Override
  public void visit(CodeLambdaExpression e, Void arg) {
    // declarations inside a lambda body are local to it
    Set<String> outer = declared;
    declared = new LinkedHashSet<>();
    try {
      expr(e.body());
      all(e.statements());
    } finally {
      declared = outer;
    }
  }

  @Override
  public void visit(CodeObjectCreateExpression e, Void arg) {
    exprs(e.arguments());
    exprs(e.initializers());
    expr(e.initializer());
  }

  @Override
  public void visit(CodeArrayCreateExpression e, Void arg) {
    exprs(e.initializers());
  }

  @Override
  public void visit(CodeCollectionInitializer e, Void arg) {
    exprs(e.values());
  }

  @Override
  public void visit(CodePrimitiveExpression e, Void arg) {
  }

  @Override
  public void visit(CodeNamedArgument e, Void arg) {
    expr(e.value());
  }

  @Override
  public void visit(CodeThisReferenceExpression e, Void arg) {
  }

  @Override
  public void visit(CodeTypeReferenceExpression e, Void arg) {
  }
}
