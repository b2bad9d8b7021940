package de.example.py2cs.codemodel;

import java.util.List;

public final class CSharpStatementWriter implements CodeStatementVisitor {
  private final IndentingTextWriter writer;
  private final CSharpExpressionWriter expr;

  public CSharpStatementWriter(IndentingTextWriter writer) {
    this.writer = writer;
    this.expr = new CSharpExpressionWriter(writer);
  }

  public void writeStatements(List<CodeStatement> statements) {
    for (CodeStatement s : statements) {
      s.accept(this);
    }
  }

  /** Writes " {", the indented statements and a closing brace, without a trailing newline. */
  public void writeBlock(List<CodeStatement> statements) {
    writer.write(" {");
    writer.writeLine();
    writer.indent(() -> writeStatements(statements));
    writer.write("}");
  }

  @Override
  public void visit(CodeAssignStatement s) {
    writeAssignment(s);
    writer.writeLine(";");
  }

  private void writeAssignment(CodeAssignStatement s) {
    expr.write(s.destination(), CSharpExpressionWriter.PREC_ASSIGNMENT, true);
    writer.write(" = ");
    expr.write(s.source(), CSharpExpressionWriter.PREC_ASSIGNMENT, false);
  }

  @Override
  public void visit(CodeExpressionStatement s) {
    expr.write(s.expression());
    writer.writeLine(";");
  }

  @Override
  public void visit(CodeVariableDeclarationStatement s) {
    writeDeclaration(s);
    writer.writeLine(";");
  }

  private void writeDeclaration(CodeVariableDeclarationStatement s) {
    if (s.type() == null) writer.write("var");
    else expr.writeType(s.type());
    writer.write(" ");
    writer.writeName(s.name());
    if (s.initExpression() != null) {
      writer.write(" = ");
      expr.write(s.initExpression(), CSharpExpressionWriter.PREC_ASSIGNMENT, false);
    }
  }

  @Override
  public void visit(CodeConditionStatement s) {
    writer.write("if (");
    expr.write(s.condition());
    writer.write(")");
    writeBlock(s.trueStatements());
    List<CodeStatement> orElse = s.falseStatements();
    while (orElse.size() == 1 && orElse.get(0) instanceof CodeConditionStatement elif) {
      writer.write(" else if (");
      expr.write(elif.condition());
      writer.write(")");
      writeBlock(elif.trueStatements());
      orElse = elif.falseStatements();
    }
    if (!orElse.isEmpty()) {
      writer.write(" else");
      writeBlock(orElse);
    }
    writer.writeLine();
  }

  @Override
  public void visit(CodeWhileStatement s) {
    writer.write("while (");
    expr.write(s.test());
    writer.write(")");
    writeBlock(s.statements());
    writer.writeLine();
  }

  @Override
  public void visit(CodeDoWhileStatement s) {
    writer.write("do");
    writeBlock(s.statements());
    writer.write(" while (");
    expr.write(s.test());
    writer.writeLine(");");
  }

  @Override
  public void visit(CodeForeachStatement s) {
    writer.write("foreach (");
    if (s.variable() instanceof CodeVariableReferenceExpression v) {
      writer.write("var ");
      writer.writeName(v.name());
    } else {
      expr.write(s.variable());
    }
    writer.write(" in ");
    expr.write(s.collection());
    writer.write(")");
    writeBlock(s.statements());
    writer.writeLine();
  }

  @Override
  public void visit(CodeTryCatchFinallyStatement s) {
    writer.write("try");
    writeBlock(s.tryStatements());
    for (CodeCatchClause clause : s.catchClauses()) {
      writer.write(" catch");
      if (clause.catchExceptionType() != null) {
        writer.write(" (");
        expr.writeType(clause.catchExceptionType());
        if (clause.localName() != null) {
          writer.write(" ");
          writer.writeName(clause.localName());
        }
        writer.write(")");
      }
      writeBlock(clause.statements());
    }
    if (!s.finallyStatements().isEmpty()) {
      writer.write(" finally");
      writeBlock(s.finallyStatements());
    }
    writer.writeLine();
  }

  @Override
  public void visit(CodeUsingStatement s) {
    for (int i = 0; i < s.initializers().size(); i++) {
      if (i > 0) writer.writeLine();
      writer.write("using (");
      CodeStatement init = s.initializers().get(i);
      if (init instanceof CodeVariableDeclarationStatement decl) writeDeclaration(decl);
      else if (init instanceof CodeAssignStatement ass) writeAssignment(ass);
      else if (init instanceof CodeExpressionStatement es) expr.write(es.expression());
      writer.write(")");
    }
    writeBlock(s.statements());
    writer.writeLine();
  }

  @Override
  public void visit(CodeThrowExceptionStatement s) {
    if (s.toThrow() == null) {
      writer.writeLine("throw;");
      return;
    }
    writer.write("throw ");
    expr.write(s.toThrow());
    writer.writeLine(";");
  }

  @Override
  public void visit(CodeMethodReturnStatement s) {
    if (s.expression() == null) {
      writer.writeLine("return;");
      return;
    }
    writer.write("return ");
    expr.write(s.expression());
    writer.writeLine(";");
  }

  @Override
  public void visit(CodeYieldStatement s) {
    writer.write("yield return ");
    if (s.expression() == null) writer.write("null");
    else expr.write(s.expression());
    writer.writeLine(";");
  }

  @Override
  public void visit(CodeCommentStatement s) {
    writeComment(writer, s.comment());
  }

  static void writeComment(IndentingTextWriter writer, String comment) {
    for (String line : comment.split("\r\n|\r|\n", -1)) {
      writer.writeLine("//" + line);
    }
  }

  @Override
  public void visit(CodeBreakStatement s) {
    writer.writeLine("break;");
  }

  @Override
  public void visit(CodeContinueStatement s) {
    writer.writeLine("continue;");
  }
}
