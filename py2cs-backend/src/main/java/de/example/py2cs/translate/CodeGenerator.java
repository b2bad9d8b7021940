package de.example.py2cs.translate;

import de.example.py2cs.UnsupportedConstructException;
import de.example.py2cs.codemodel.CodeApplicationExpression;
import de.example.py2cs.codemodel.CodeAssignStatement;
import de.example.py2cs.codemodel.CodeAttributeArgument;
import de.example.py2cs.codemodel.CodeAttributeDeclaration;
import de.example.py2cs.codemodel.CodeBreakStatement;
import de.example.py2cs.codemodel.CodeCatchClause;
import de.example.py2cs.codemodel.CodeCommentMember;
import de.example.py2cs.codemodel.CodeCommentStatement;
import de.example.py2cs.codemodel.CodeCompileUnit;
import de.example.py2cs.codemodel.CodeConditionStatement;
import de.example.py2cs.codemodel.CodeConstructor;
import de.example.py2cs.codemodel.CodeContinueStatement;
import de.example.py2cs.codemodel.CodeDoWhileStatement;
import de.example.py2cs.codemodel.CodeExpression;
import de.example.py2cs.codemodel.CodeExpressionStatement;
import de.example.py2cs.codemodel.CodeFieldReferenceExpression;
import de.example.py2cs.codemodel.CodeForeachStatement;
import de.example.py2cs.codemodel.CodeLambdaExpression;
import de.example.py2cs.codemodel.CodeMemberField;
import de.example.py2cs.codemodel.CodeMemberMethod;
import de.example.py2cs.codemodel.CodeMemberProperty;
import de.example.py2cs.codemodel.CodeMethodReferenceExpression;
import de.example.py2cs.codemodel.CodeMethodReturnStatement;
import de.example.py2cs.codemodel.CodeNamespace;
import de.example.py2cs.codemodel.CodeNamespaceImport;
import de.example.py2cs.codemodel.CodeParameterDeclarationExpression;
import de.example.py2cs.codemodel.CodeStatement;
import de.example.py2cs.codemodel.CodeThrowExceptionStatement;
import de.example.py2cs.codemodel.CodeTryCatchFinallyStatement;
import de.example.py2cs.codemodel.CodeTypeDeclaration;
import de.example.py2cs.codemodel.CodeTypeMember;
import de.example.py2cs.codemodel.CodeTypeReference;
import de.example.py2cs.codemodel.CodeTypeReferenceExpression;
import de.example.py2cs.codemodel.CodeUsingStatement;
import de.example.py2cs.codemodel.CodeVariableReferenceExpression;
import de.example.py2cs.codemodel.CodeWhileStatement;
import de.example.py2cs.codemodel.CodeYieldStatement;
import de.example.py2cs.codemodel.IndentingTextWriter;
import de.example.py2cs.codemodel.MemberAttributes;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;

/**
 * Builds a code model incrementally. Keeps track of the type, the member and
 * the statement list currently under construction; statement primitives append
 * to that list.
 */
public final class CodeGenerator {
  private final CodeNamespace namespace;
  private final Deque<CodeTypeDeclaration> types = new ArrayDeque<>();
  private CodeTypeMember currentMember;
  private List<CodeStatement> currentStatements;

  public CodeGenerator(CodeCompileUnit unit, String namespaceName) {
    this.namespace = new CodeNamespace(namespaceName);
    unit.getNamespaces().add(namespace);
  }

  public CodeTypeDeclaration currentType() {
    return types.peek();
  }

  public CodeTypeMember currentMember() {
    return currentMember;
  }

  public List<CodeStatement> currentMemberStatements() {
    return currentStatements;
  }

  // ---------------------------------------------------------------------------
  // declarations

  public CodeTypeDeclaration classDef(String name, List<String> baseClasses, Runnable body) {
    CodeTypeDeclaration type = new CodeTypeDeclaration(name);
    type.getAttributes().add(MemberAttributes.PUBLIC);
    for (String base : baseClasses) {
      type.getBaseTypes().add(CodeTypeReference.of(base));
    }
    if (types.isEmpty()) namespace.getTypes().add(type);
    else types.peek().getMembers().add(type);

    CodeTypeMember oldMember = currentMember;
    List<CodeStatement> oldStatements = currentStatements;
    types.push(type);
    currentMember = null;
    currentStatements = null;
    try {
      body.run();
    } finally {
      types.pop();
      currentMember = oldMember;
      currentStatements = oldStatements;
    }
    return type;
  }

  public CodeMemberField field(CodeTypeReference type, String name) {
    CodeMemberField field = new CodeMemberField(type, name);
    field.getAttributes().add(MemberAttributes.PUBLIC);
    addMember(field);
    return field;
  }

  public CodeMemberMethod method(String name, List<CodeParameterDeclarationExpression> parameters,
      CodeTypeReference returnType, boolean isStatic, Runnable body) {
    CodeMemberMethod method = new CodeMemberMethod(name, parameters, returnType);
    method.getAttributes().add(MemberAttributes.PUBLIC);
    if (isStatic) method.getAttributes().add(MemberAttributes.STATIC);
    addMember(method);
    inMember(method, method.getStatements(), body);
    return method;
  }

  public CodeConstructor constructor(List<CodeParameterDeclarationExpression> parameters, Runnable body) {
    CodeConstructor ctor = new CodeConstructor(parameters);
    ctor.getAttributes().add(MemberAttributes.PUBLIC);
    addMember(ctor);
    inMember(ctor, ctor.getStatements(), body);
    return ctor;
  }

  /** Adds an empty static constructor to the current type; fill it with {@link #inMember}. */
  public CodeConstructor staticConstructor() {
    CodeConstructor ctor = new CodeConstructor(List.of());
    ctor.getAttributes().add(MemberAttributes.STATIC);
    addMember(ctor);
    return ctor;
  }

  /** @param setter null for a read-only property */
  public CodeMemberProperty propertyDef(String name, Runnable getter, Runnable setter) {
    CodeMemberProperty prop = new CodeMemberProperty(name, CodeTypeReference.OBJECT);
    prop.getAttributes().add(MemberAttributes.PUBLIC);
    addMember(prop);
    inMember(prop, prop.getGetStatements(), getter);
    if (setter != null) {
      inMember(prop, prop.enableSetter(), setter);
    }
    return prop;
  }

  private void addMember(CodeTypeMember member) {
    CodeTypeDeclaration type = types.peek();
    if (type == null) {
      throw new UnsupportedConstructException("member declared outside of a type", member.getName());
    }
    type.getMembers().add(member);
  }

  /** Runs {@code body} with emission redirected into {@code statements} of {@code member}. */
  public void inMember(CodeTypeMember member, List<CodeStatement> statements, Runnable body) {
    CodeTypeMember oldMember = currentMember;
    List<CodeStatement> oldStatements = currentStatements;
    currentMember = member;
    currentStatements = statements;
    try {
      body.run();
    } finally {
      currentMember = oldMember;
      currentStatements = oldStatements;
    }
  }

  /** Runs {@code body} with emission redirected into {@code statements} of the current member. */
  public void inStatements(List<CodeStatement> statements, Runnable body) {
    inMember(currentMember, statements, body);
  }

  public CodeLambdaExpression lambda(List<CodeVariableReferenceExpression> args, List<CodeStatement> statements) {
    return new CodeLambdaExpression(args, null, statements);
  }

  // ---------------------------------------------------------------------------
  // statements

  private List<CodeStatement> statements() {
    if (currentStatements == null) {
      throw new UnsupportedConstructException("statement emitted outside of a member body");
    }
    return currentStatements;
  }

  public void emit(CodeStatement s) {
    statements().add(s);
  }

  public void assign(CodeExpression lhs, CodeExpression rhs) {
    emit(new CodeAssignStatement(lhs, rhs));
  }

  public void sideEffect(CodeExpression e) {
    emit(new CodeExpressionStatement(e));
  }

  public CodeConditionStatement ifStmt(CodeExpression condition, Runnable then, Runnable orElse) {
    CodeConditionStatement s = new CodeConditionStatement(condition, new ArrayList<>(), new ArrayList<>());
    emit(s);
    nested(s.trueStatements(), then);
    if (orElse != null) nested(s.falseStatements(), orElse);
    return s;
  }

  public CodeWhileStatement whileStmt(CodeExpression test, Runnable body) {
    CodeWhileStatement s = new CodeWhileStatement(test, new ArrayList<>());
    emit(s);
    nested(s.statements(), body);
    return s;
  }

  public CodeDoWhileStatement doWhile(Runnable body, CodeExpression test) {
    CodeDoWhileStatement s = new CodeDoWhileStatement(new ArrayList<>(), test);
    emit(s);
    nested(s.statements(), body);
    return s;
  }

  public CodeForeachStatement foreach(CodeExpression variable, CodeExpression collection, Runnable body) {
    CodeForeachStatement s = new CodeForeachStatement(variable, collection, new ArrayList<>());
    emit(s);
    nested(s.statements(), body);
    return s;
  }

  /** Catch clauses are produced after the try body, so nested symbols keep source order. */
  public CodeTryCatchFinallyStatement tryStmt(Runnable body, Supplier<List<CodeCatchClause>> clauses, Runnable finallyBody) {
    CodeTryCatchFinallyStatement s = new CodeTryCatchFinallyStatement(new ArrayList<>(), new ArrayList<>(), new ArrayList<>());
    emit(s);
    nested(s.tryStatements(), body);
    s.catchClauses().addAll(clauses.get());
    if (finallyBody != null) nested(s.finallyStatements(), finallyBody);
    return s;
  }

  /**
   * @param localName null when the exception is not bound
   * @param type null for a catch-all
   */
  public CodeCatchClause catchClause(String localName, CodeTypeReference type, Runnable body) {
    CodeCatchClause clause = new CodeCatchClause(localName, type, new ArrayList<>());
    nested(clause.statements(), body);
    return clause;
  }

  public void throwStmt(CodeExpression e) {
    emit(new CodeThrowExceptionStatement(e));
  }

  public void returnStmt(CodeExpression e) {
    emit(new CodeMethodReturnStatement(e));
  }

  public void yieldStmt(CodeExpression e) {
    emit(new CodeYieldStatement(e));
  }

  public void breakStmt() {
    emit(new CodeBreakStatement());
  }

  public void continueStmt() {
    emit(new CodeContinueStatement());
  }

  /** Emits a comment; between members of a type it becomes a free-standing comment member. */
  public void comment(String text) {
    if (currentStatements != null) {
      emit(new CodeCommentStatement(text));
    } else {
      addMember(new CodeCommentMember(text));
    }
  }

  public CodeUsingStatement usingScope(List<CodeStatement> initializers, Runnable body) {
    CodeUsingStatement s = new CodeUsingStatement(List.copyOf(initializers), new ArrayList<>());
    emit(s);
    nested(s.statements(), body);
    return s;
  }

  private void nested(List<CodeStatement> target, Runnable body) {
    List<CodeStatement> old = currentStatements;
    currentStatements = target;
    try {
      body.run();
    } finally {
      currentStatements = old;
    }
  }

  // ---------------------------------------------------------------------------
  // imports

  public void using(String ns) {
    addImport(new CodeNamespaceImport(null, ns));
  }

  public void using(String alias, String ns) {
    addImport(new CodeNamespaceImport(alias, ns));
  }

  public void ensureImport(String ns) {
    using(ns);
  }

  private void addImport(CodeNamespaceImport imp) {
    if (!namespace.getImports().contains(imp)) namespace.getImports().add(imp);
  }

  // ---------------------------------------------------------------------------
  // expression helpers

  public CodeApplicationExpression appl(CodeExpression method, CodeExpression... args) {
    return new CodeApplicationExpression(method, Arrays.asList(args));
  }

  public CodeApplicationExpression appl(CodeExpression method, List<CodeExpression> args) {
    return new CodeApplicationExpression(method, args);
  }

  public CodeMethodReferenceExpression methodRef(CodeExpression target, String name) {
    return new CodeMethodReferenceExpression(target, name);
  }

  public CodeFieldReferenceExpression access(CodeExpression target, String field) {
    return new CodeFieldReferenceExpression(target, field);
  }

  public CodeTypeReference typeRef(String name, CodeTypeReference... typeArgs) {
    return CodeTypeReference.of(name, typeArgs);
  }

  public CodeTypeReferenceExpression typeRefExpr(String name) {
    return new CodeTypeReferenceExpression(CodeTypeReference.of(name));
  }

  public CodeAttributeDeclaration customAttr(CodeTypeReference type, List<CodeAttributeArgument> args) {
    return new CodeAttributeDeclaration(type, args);
  }

  public String escapeKeywordName(String name) {
    return IndentingTextWriter.escapeName(name);
  }
}
