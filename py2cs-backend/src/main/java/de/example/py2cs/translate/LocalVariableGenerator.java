package de.example.py2cs.translate;

import de.example.py2cs.codemodel.CodeAssignStatement;
import de.example.py2cs.codemodel.CodeCatchClause;
import de.example.py2cs.codemodel.CodeConditionStatement;
import de.example.py2cs.codemodel.CodeDoWhileStatement;
import de.example.py2cs.codemodel.CodeForeachStatement;
import de.example.py2cs.codemodel.CodeParameterDeclarationExpression;
import de.example.py2cs.codemodel.CodePrimitiveExpression;
import de.example.py2cs.codemodel.CodeStatement;
import de.example.py2cs.codemodel.CodeTryCatchFinallyStatement;
import de.example.py2cs.codemodel.CodeTypeReference;
import de.example.py2cs.codemodel.CodeUsingStatement;
import de.example.py2cs.codemodel.CodeVariableDeclarationStatement;
import de.example.py2cs.codemodel.CodeVariableReferenceExpression;
import de.example.py2cs.codemodel.CodeWhileStatement;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Declares the locals of a translated body. Runs once the body is complete.
 * A local whose first assignment is a top-level statement, with no earlier
 * mention of the name, is declared by that assignment; any other assigned
 * local gets a declaration at the top of the body.
 */
public final class LocalVariableGenerator {

  private LocalVariableGenerator() {
  }

  public static void generate(List<CodeParameterDeclarationExpression> parameters, List<CodeStatement> statements,
      Set<String> globals, SymbolGenerator symbols) {
    Set<String> skip = new HashSet<>(globals);
    for (CodeParameterDeclarationExpression p : parameters) skip.add(p.parameterName());
    skip.addAll(VariableReferenceFinder.declaredNames(statements));

    int hoisted = 0;
    for (SymbolGenerator.LocalSymbol local : symbols.locals()) {
      if (local.parameter() || skip.contains(local.name())) continue;
      CodeAssignStatement first = firstAssignment(statements, local.name());
      if (first == null) continue;

      int index = indexOfIdentical(statements, first);
      if (index >= 0 && !referencedBefore(statements, index, first, local.name())) {
        statements.set(index, new CodeVariableDeclarationStatement(
            declarationType(local.type(), first), local.name(), first.source()));
      } else {
        CodeTypeReference type = local.type() == null ? CodeTypeReference.OBJECT : local.type();
        statements.add(hoisted++, new CodeVariableDeclarationStatement(type, local.name(), null));
      }
    }
  }

  /** {@code var} for object-typed locals, unless the initializer is null, which {@code var} cannot type. */
  private static CodeTypeReference declarationType(CodeTypeReference type, CodeAssignStatement first) {
    if (type != null && !type.isObject()) return type;
    if (first.source() instanceof CodePrimitiveExpression p && p.value() == null) return CodeTypeReference.OBJECT;
    return null;
  }

  private static boolean referencedBefore(List<CodeStatement> statements, int index, CodeAssignStatement first, String name) {
    for (int i = 0; i < index; i++) {
      if (VariableReferenceFinder.references(statements.get(i), name)) return true;
    }
    return VariableReferenceFinder.references(first.source(), name);
  }

  private static int indexOfIdentical(List<CodeStatement> statements, CodeStatement s) {
    for (int i = 0; i < statements.size(); i++) {
      if (statements.get(i) == s) return i;
    }
    return -1;
  }

  static CodeAssignStatement firstAssignment(List<CodeStatement> statements, String name) {
    for (CodeStatement s : statements) {
      CodeAssignStatement found = firstAssignment(s, name);
      if (found != null) return found;
    }
    return null;
  }

  private static CodeAssignStatement firstAssignment(CodeStatement s, String name) {
    if (s instanceof CodeAssignStatement ass) {
      return ass.destination() instanceof CodeVariableReferenceExpression v && v.name().equals(name) ? ass : null;
    }
    if (s instanceof CodeConditionStatement c) {
      CodeAssignStatement found = firstAssignment(c.trueStatements(), name);
      return found != null ? found : firstAssignment(c.falseStatements(), name);
    }
    if (s instanceof CodeWhileStatement w) return firstAssignment(w.statements(), name);
    if (s instanceof CodeDoWhileStatement d) return firstAssignment(d.statements(), name);
    if (s instanceof CodeForeachStatement f) return firstAssignment(f.statements(), name);
    if (s instanceof CodeUsingStatement u) {
      CodeAssignStatement found = firstAssignment(u.initializers(), name);
      return found != null ? found : firstAssignment(u.statements(), name);
    }
    if (s instanceof CodeTryCatchFinallyStatement t) {
      CodeAssignStatement found = firstAssignment(t.tryStatements(), name);
      if (found != null) return found;
      for (CodeCatchClause c : t.catchClauses()) {
        found = firstAssignment(c.statements(), name);
        if (found != null) return found;
      }
      return firstAssignment(t.finallyStatements(), name);
    }
    return null;
  }
}
