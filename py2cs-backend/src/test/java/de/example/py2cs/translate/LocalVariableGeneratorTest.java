package de.example.py2cs.translate;

import de.example.py2cs.codemodel.CodeApplicationExpression;
import de.example.py2cs.codemodel.CodeAssignStatement;
import de.example.py2cs.codemodel.CodeConditionStatement;
import de.example.py2cs.codemodel.CodeExpressionStatement;
import de.example.py2cs.codemodel.CodeLambdaExpression;
import de.example.py2cs.codemodel.CodeMethodReferenceExpression;
import de.example.py2cs.codemodel.CodeParameterDeclarationExpression;
import de.example.py2cs.codemodel.CodePrimitiveExpression;
import de.example.py2cs.codemodel.CodeStatement;
import de.example.py2cs.codemodel.CodeTypeReference;
import de.example.py2cs.codemodel.CodeVariableDeclarationStatement;
import de.example.py2cs.codemodel.CodeVariableReferenceExpression;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class LocalVariableGeneratorTest {

  private static final CodeVariableReferenceExpression X = new CodeVariableReferenceExpression("x");

  private static CodeAssignStatement assignX(Object value) {
    return new CodeAssignStatement(X, new CodePrimitiveExpression(value));
  }

  private static CodeExpressionStatement use(CodeVariableReferenceExpression v) {
    return new CodeExpressionStatement(new CodeApplicationExpression(
        new CodeMethodReferenceExpression(null, "Use"), List.of(v)));
  }

  private static SymbolGenerator symbolsWithX(CodeTypeReference type) {
    SymbolGenerator symbols = new SymbolGenerator();
    symbols.ensureLocalVariable("x", type, false);
    return symbols;
  }

  @Test
  void firstTopLevelAssignmentBecomesTheDeclaration() {
    List<CodeStatement> body = new ArrayList<>(List.of(assignX(1), use(X)));
    LocalVariableGenerator.generate(List.of(), body, Set.of(), symbolsWithX(TypeMapper.INT));

    assertThat(body).hasSize(2);
    assertThat(body.get(0)).isEqualTo(new CodeVariableDeclarationStatement(TypeMapper.INT, "x", new CodePrimitiveExpression(1)));
  }

  @Test
  void objectLocalsUseVarUnlessInitializedWithNull() {
    List<CodeStatement> body = new ArrayList<>(List.of(assignX("s")));
    LocalVariableGenerator.generate(List.of(), body, Set.of(), symbolsWithX(CodeTypeReference.OBJECT));
    assertThat(((CodeVariableDeclarationStatement) body.get(0)).type()).isNull();

    List<CodeStatement> nullBody = new ArrayList<>(List.of(assignX(null)));
    LocalVariableGenerator.generate(List.of(), nullBody, Set.of(), symbolsWithX(CodeTypeReference.OBJECT));
    assertThat(((CodeVariableDeclarationStatement) nullBody.get(0)).type()).isEqualTo(CodeTypeReference.OBJECT);
  }

  @Test
  void earlierReferenceHoistsTheDeclaration() {
    List<CodeStatement> body = new ArrayList<>(List.of(use(X), assignX(1)));
    LocalVariableGenerator.generate(List.of(), body, Set.of(), symbolsWithX(TypeMapper.INT));

    assertThat(body).hasSize(3);
    assertThat(body.get(0)).isEqualTo(new CodeVariableDeclarationStatement(TypeMapper.INT, "x", null));
    assertThat(body.get(2)).isInstanceOf(CodeAssignStatement.class);
  }

  @Test
  void nestedFirstAssignmentHoistsTheDeclaration() {
    CodeConditionStatement branch = new CodeConditionStatement(new CodeVariableReferenceExpression("c"),
        new ArrayList<>(List.of(assignX(1))), new ArrayList<>());
    List<CodeStatement> body = new ArrayList<>(List.of(branch, use(X)));
    LocalVariableGenerator.generate(List.of(), body, Set.of(), symbolsWithX(CodeTypeReference.OBJECT));

    assertThat(body).hasSize(3);
    assertThat(body.get(0)).isEqualTo(new CodeVariableDeclarationStatement(CodeTypeReference.OBJECT, "x", null));
    assertThat(branch.trueStatements()).containsExactly(assignX(1));
  }

  @Test
  void selfReferencingInitializerIsHoisted() {
    CodeAssignStatement grow = new CodeAssignStatement(X, new CodeApplicationExpression(
        new CodeMethodReferenceExpression(null, "Next"), List.of(X)));
    List<CodeStatement> body = new ArrayList<>(List.of(grow));
    LocalVariableGenerator.generate(List.of(), body, Set.of(), symbolsWithX(CodeTypeReference.OBJECT));

    assertThat(body).hasSize(2);
    assertThat(body.get(1)).isSameAs(grow);
  }

  @Test
  void parametersGlobalsAndDeclaredNamesAreSkipped() {
    SymbolGenerator symbols = new SymbolGenerator();
    symbols.ensureLocalVariable("p", CodeTypeReference.OBJECT, false);
    symbols.ensureLocalVariable("g", CodeTypeReference.OBJECT, false);
    symbols.ensureLocalVariable("d", CodeTypeReference.OBJECT, false);
    List<CodeStatement> body = new ArrayList<>(List.of(
        new CodeVariableDeclarationStatement(null, "d", new CodePrimitiveExpression(0)),
        new CodeAssignStatement(new CodeVariableReferenceExpression("p"), new CodePrimitiveExpression(1)),
        new CodeAssignStatement(new CodeVariableReferenceExpression("g"), new CodePrimitiveExpression(2)),
        new CodeAssignStatement(new CodeVariableReferenceExpression("d"), new CodePrimitiveExpression(3))));
    List<CodeStatement> before = List.copyOf(body);

    LocalVariableGenerator.generate(List.of(CodeParameterDeclarationExpression.of(CodeTypeReference.OBJECT, "p")),
        body, Set.of("g"), symbols);

    assertThat(body).containsExactlyElementsOf(before);
  }

  @Test
  void declarationsInsideLambdasDoNotCountAsOuterDeclarations() {
    CodeLambdaExpression lambda = new CodeLambdaExpression(List.of(), null,
        List.of(new CodeVariableDeclarationStatement(null, "x", new CodePrimitiveExpression(0))));
    List<CodeStatement> body = new ArrayList<>(List.of(
        new CodeVariableDeclarationStatement(null, "f", lambda),
        assignX(1)));
    LocalVariableGenerator.generate(List.of(), body, Set.of(), symbolsWithX(TypeMapper.INT));

    assertThat(body.get(1)).isEqualTo(new CodeVariableDeclarationStatement(TypeMapper.INT, "x", new CodePrimitiveExpression(1)));
  }
}
