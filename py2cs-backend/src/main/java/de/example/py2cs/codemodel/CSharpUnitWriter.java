package de.example.py2cs.codemodel;

import de.example.py2cs.UnsupportedConstructException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/** Writes namespaces, using directives, types and their members. */
public final class CSharpUnitWriter implements CodeMemberVisitor {
  private final IndentingTextWriter writer;
  private final CSharpExpressionWriter expr;
  private final CSharpStatementWriter stmts;
  private final Deque<CodeTypeDeclaration> types = new ArrayDeque<>();

  public CSharpUnitWriter(IndentingTextWriter writer) {
    this.writer = writer;
    this.expr = new CSharpExpressionWriter(writer);
    this.stmts = new CSharpStatementWriter(writer);
  }

  public void write(CodeCompileUnit unit) {
    for (CodeNamespace ns : unit.getNamespaces()) {
      writeNamespace(ns);
    }
  }

  public void writeNamespace(CodeNamespace ns) {
    writer.write("namespace ");
    writer.writeName(ns.getName());
    writer.writeLine(" {");
    writer.indent(() -> {
      if (!ns.getImports().isEmpty()) {
        writer.writeLine();
        for (CodeNamespaceImport imp : ns.getImports()) {
          writer.write("using ");
          if (imp.alias() != null) {
            writer.writeName(imp.alias());
            writer.write(" = ");
          }
          writer.writeName(imp.namespace());
          writer.writeLine(";");
        }
      }
      for (CodeTypeDeclaration type : ns.getTypes()) {
        writer.writeLine();
        type.accept(this);
      }
    });
    writer.writeLine("}");
  }

  private void writeLeadingTrivia(CodeTypeMember m) {
    for (CodeCommentStatement c : m.getComments()) {
      CSharpStatementWriter.writeComment(writer, c.comment());
    }
    for (CodeAttributeDeclaration attr : m.getCustomAttributes()) {
      writer.write("[");
      expr.writeType(attr.attributeType());
      List<CodeAttributeArgument> args = attr.arguments();
      if (!args.isEmpty()) {
        writer.write("(");
        for (int i = 0; i < args.size(); i++) {
          if (i > 0) writer.write(", ");
          if (args.get(i).name() != null) {
            writer.writeName(args.get(i).name());
            writer.write(" = ");
          }
          expr.write(args.get(i).value());
        }
        writer.write(")");
      }
      writer.writeLine("]");
    }
  }

  private void writeModifiers(CodeTypeMember m) {
    for (MemberAttributes a : m.getAttributes()) {
      writer.write(a.keyword());
      writer.write(" ");
    }
  }

  @Override
  public void visit(CodeTypeDeclaration type) {
    writeLeadingTrivia(type);
    writeModifiers(type);
    writer.write("class ");
    writer.writeName(type.getName());
    for (int i = 0; i < type.getBaseTypes().size(); i++) {
      writer.write(i == 0 ? " : " : ", ");
      expr.writeType(type.getBaseTypes().get(i));
    }
    writer.writeLine(" {");
    types.push(type);
    try {
      writer.indent(() -> {
        for (CodeTypeMember member : type.getMembers()) {
          writer.writeLine();
          member.accept(this);
        }
      });
    } finally {
      types.pop();
    }
    writer.writeLine("}");
  }

  @Override
  public void visit(CodeMemberField field) {
    writeLeadingTrivia(field);
    writeModifiers(field);
    expr.writeType(field.getType());
    writer.write(" ");
    writer.writeName(field.getName());
    if (field.getInitExpression() != null) {
      writer.write(" = ");
      expr.write(field.getInitExpression(), CSharpExpressionWriter.PREC_ASSIGNMENT, false);
    }
    writer.writeLine(";");
  }

  @Override
  public void visit(CodeMemberMethod method) {
    writeLeadingTrivia(method);
    writeModifiers(method);
    expr.writeType(method.getReturnType());
    writer.write(" ");
    writer.writeName(method.getName());
    writeParameters(method.getParameters());
    stmts.writeBlock(method.getStatements());
    writer.writeLine();
  }

  @Override
  public void visit(CodeConstructor ctor) {
    writeLeadingTrivia(ctor);
    if (ctor.isStatic()) {
      writer.write("static ");
    } else {
      writeModifiers(ctor);
    }
    if (types.isEmpty()) throw new UnsupportedConstructException("constructor outside of a type");
    writer.writeName(types.peek().getName());
    writeParameters(ctor.getParameters());
    stmts.writeBlock(ctor.getStatements());
    writer.writeLine();
  }

  private void writeParameters(List<CodeParameterDeclarationExpression> parameters) {
    writer.write("(");
    for (int i = 0; i < parameters.size(); i++) {
      CodeParameterDeclarationExpression p = parameters.get(i);
      if (i > 0) writer.write(", ");
      if (p.isParams()) writer.write("params ");
      expr.writeType(p.parameterType());
      writer.write(" ");
      writer.writeName(p.parameterName());
      if (p.defaultValue() != null) {
        writer.write(" = ");
        expr.write(p.defaultValue());
      }
    }
    writer.write(")");
  }

  @Override
  public void visit(CodeMemberProperty property) {
    writeLeadingTrivia(property);
    writeModifiers(property);
    expr.writeType(property.getPropertyType());
    writer.write(" ");
    writer.writeName(property.getName());
    writer.writeLine(" {");
    writer.indent(() -> {
      writer.write("get");
      stmts.writeBlock(property.getGetStatements());
      writer.writeLine();
      if (property.hasSet()) {
        writer.write("set");
        stmts.writeBlock(property.getSetStatements());
        writer.writeLine();
      }
    });
    writer.writeLine("}");
  }

  @Override
  public void visit(CodeCommentMember comment) {
    CSharpStatementWriter.writeComment(writer, comment.getComment());
  }
}
