package de.example.py2cs.codemodel;

import de.example.py2cs.UnsupportedConstructException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CSharpUnitWriterTest {

  private static String render(CodeCompileUnit unit) {
    IndentingTextWriter out = new IndentingTextWriter();
    new CSharpUnitWriter(out).write(unit);
    return out.toString();
  }

  @Test
  void writesNamespaceUsingsAndMembers() {
    CodeNamespace ns = new CodeNamespace("App.Core");
    ns.getImports().add(new CodeNamespaceImport(null, "System.Collections.Generic"));
    ns.getImports().add(new CodeNamespaceImport("np", "numpy"));

    CodeTypeDeclaration type = new CodeTypeDeclaration("Util");
    type.getAttributes().add(MemberAttributes.PUBLIC);
    type.getBaseTypes().add(CodeTypeReference.of("Base"));

    CodeMemberField field = new CodeMemberField(CodeTypeReference.of("int"), "count");
    field.getAttributes().add(MemberAttributes.PUBLIC);
    field.getAttributes().add(MemberAttributes.STATIC);
    field.setInitExpression(new CodePrimitiveExpression(0));
    type.getMembers().add(field);

    CodeMemberMethod method = new CodeMemberMethod("Twice",
        List.of(CodeParameterDeclarationExpression.of(CodeTypeReference.OBJECT, "x")), CodeTypeReference.OBJECT);
    method.getAttributes().add(MemberAttributes.PUBLIC);
    method.getComments().add(new CodeCommentStatement(" doubles x"));
    method.getCustomAttributes().add(new CodeAttributeDeclaration(CodeTypeReference.of("Pure"), List.of()));
    method.getStatements().add(new CodeMethodReturnStatement(new CodeBinaryOperatorExpression(
        new CodeVariableReferenceExpression("x"), CodeOperatorType.MUL, new CodePrimitiveExpression(2))));
    type.getMembers().add(method);

    ns.getTypes().add(type);
    CodeCompileUnit unit = new CodeCompileUnit();
    unit.getNamespaces().add(ns);

    assertThat(render(unit)).isEqualTo("""
        namespace App.Core {

            using System.Collections.Generic;
            using np = numpy;

            public class Util : Base {

                public static int count = 0;

                // doubles x
                [Pure]
                public object Twice(object x) {
                    return x * 2;
                }
            }
        }
        """);
  }

  @Test
  void constructorsTakeTheEnclosingTypeName() {
    CodeTypeDeclaration type = new CodeTypeDeclaration("Point");
    CodeConstructor ctor = new CodeConstructor(List.of());
    ctor.getAttributes().add(MemberAttributes.PUBLIC);
    CodeConstructor cctor = new CodeConstructor(List.of());
    cctor.getAttributes().add(MemberAttributes.STATIC);
    type.getMembers().add(ctor);
    type.getMembers().add(cctor);

    IndentingTextWriter out = new IndentingTextWriter();
    type.accept(new CSharpUnitWriter(out));
    assertThat(out.toString())
        .contains("public Point() {\n    }")
        .contains("static Point() {\n    }");
  }

  @Test
  void constructorOutsideATypeIsRejected() {
    IndentingTextWriter out = new IndentingTextWriter();
    assertThatThrownBy(() -> new CodeConstructor(List.of()).accept(new CSharpUnitWriter(out)))
        .isInstanceOf(UnsupportedConstructException.class);
  }

  @Test
  void propertyWithSetter() {
    CodeMemberProperty prop = new CodeMemberProperty("Size", CodeTypeReference.OBJECT);
    prop.getAttributes().add(MemberAttributes.PUBLIC);
    prop.getGetStatements().add(new CodeMethodReturnStatement(new CodeVariableReferenceExpression("_size")));
    prop.enableSetter().add(new CodeAssignStatement(
        new CodeVariableReferenceExpression("_size"), new CodeVariableReferenceExpression("value")));

    IndentingTextWriter out = new IndentingTextWriter();
    prop.accept(new CSharpUnitWriter(out));
    assertThat(out.toString()).isEqualTo("""
        public object Size {
            get {
                return _size;
            }
            set {
                _size = value;
            }
        }
        """);
  }

  @Test
  void statementForms() {
    List<CodeStatement> body = new ArrayList<>();
    CodeVariableReferenceExpression x = new CodeVariableReferenceExpression("x");
    body.add(new CodeConditionStatement(x,
        List.of(new CodeBreakStatement()),
        List.of(new CodeConditionStatement(new CodeVariableReferenceExpression("y"),
            List.of(new CodeContinueStatement()), List.of(new CodeThrowExceptionStatement(null))))));
    body.add(new CodeForeachStatement(new CodeVariableReferenceExpression("item"), x,
        List.of(new CodeYieldStatement(new CodeVariableReferenceExpression("item")))));
    body.add(new CodeTryCatchFinallyStatement(
        List.of(new CodeExpressionStatement(new CodeApplicationExpression(
            new CodeMethodReferenceExpression(null, "Run"), List.of()))),
        List.of(new CodeCatchClause("e", CodeTypeReference.of("IOException"), List.of()),
            new CodeCatchClause(null, null, List.of())),
        List.of(new CodeCommentStatement(" done"))));
    body.add(new CodeUsingStatement(
        List.of(new CodeVariableDeclarationStatement(null, "f", x),
            new CodeExpressionStatement(new CodeVariableReferenceExpression("lockObj"))),
        List.of()));

    IndentingTextWriter out = new IndentingTextWriter();
    new CSharpStatementWriter(out).writeStatements(body);
    assertThat(out.toString()).isEqualTo("""
        if (x) {
            break;
        } else if (y) {
            continue;
        } else {
            throw;
        }
        foreach (var item in x) {
            yield return item;
        }
        try {
            Run();
        } catch (IOException e) {
        } catch {
        } finally {
            // done
        }
        using (var f = x)
        using (lockObj) {
        }
        """);
  }
}
