package de.example.py2cs.translate;

import de.example.py2cs.UnsupportedConstructException;
import de.example.py2cs.codemodel.CodeBinaryOperatorExpression;
import de.example.py2cs.codemodel.CodeCommentStatement;
import de.example.py2cs.codemodel.CodeConstructor;
import de.example.py2cs.codemodel.CodeExpression;
import de.example.py2cs.codemodel.CodeLambdaExpression;
import de.example.py2cs.codemodel.CodeMemberMethod;
import de.example.py2cs.codemodel.CodeMemberProperty;
import de.example.py2cs.codemodel.CodeOperatorType;
import de.example.py2cs.codemodel.CodeParameterDeclarationExpression;
import de.example.py2cs.codemodel.CodePrimitiveExpression;
import de.example.py2cs.codemodel.CodeStatement;
import de.example.py2cs.codemodel.CodeTypeReference;
import de.example.py2cs.codemodel.CodeVariableDeclarationStatement;
import de.example.py2cs.codemodel.CodeVariableReferenceExpression;
import de.example.py2cs.codemodel.MemberAttributes;
import de.example.py2cs.syntax.AsyncStatement;
import de.example.py2cs.syntax.ClassDef;
import de.example.py2cs.syntax.Decorated;
import de.example.py2cs.syntax.ExceptHandler;
import de.example.py2cs.syntax.ForStatement;
import de.example.py2cs.syntax.FunctionDef;
import de.example.py2cs.syntax.IfStatement;
import de.example.py2cs.syntax.Parameter;
import de.example.py2cs.syntax.ReturnStatement;
import de.example.py2cs.syntax.Statement;
import de.example.py2cs.syntax.SuiteStatement;
import de.example.py2cs.syntax.TryStatement;
import de.example.py2cs.syntax.WhileStatement;
import de.example.py2cs.syntax.WithStatement;
import de.example.py2cs.syntax.YieldStatement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Signatures and bodies of methods, constructors, property accessors and local functions. */
public final class MethodGenerator {
  private static final CodeTypeReference ENUMERABLE =
      CodeTypeReference.of("IEnumerable", CodeTypeReference.OBJECT);

  private final CodeGenerator gen;
  private final TypeMapper typeMapper;
  private final ExpressionTranslator xlat;
  private final StatementTranslator stmtXlat;

  public MethodGenerator(CodeGenerator gen, TypeMapper typeMapper, ExpressionTranslator xlat, StatementTranslator stmtXlat) {
    this.gen = gen;
    this.typeMapper = typeMapper;
    this.xlat = xlat;
    this.stmtXlat = stmtXlat;
  }

  public CodeMemberMethod method(FunctionDef f, String name, List<Parameter> ps, boolean isStatic, ClassDef currentClass) {
    SymbolGenerator symbols = new SymbolGenerator();
    List<DeferredDefault> deferred = new ArrayList<>();
    List<CodeParameterDeclarationExpression> params = parameters(ps, symbols, deferred);
    Docstring doc = Docstring.split(f.body());
    CodeTypeReference returnType = returnType(doc.statements());
    CodeMemberMethod m = gen.method(name, params, returnType, isStatic,
        () -> body(deferred, doc.statements(), params, symbols, currentClass));
    m.getComments().addAll(doc.comments());
    return m;
  }

  /** {@code __str__} as an override of {@code ToString()}. */
  public CodeMemberMethod toStringOverride(FunctionDef f, ClassDef currentClass) {
    Docstring doc = Docstring.split(f.body());
    SymbolGenerator symbols = new SymbolGenerator();
    CodeMemberMethod m = gen.method("ToString", List.of(), TypeMapper.STRING, false,
        () -> body(doc.statements(), List.of(), symbols, currentClass));
    m.getAttributes().add(MemberAttributes.OVERRIDE);
    m.getComments().addAll(doc.comments());
    return m;
  }

  public CodeConstructor constructor(FunctionDef f, List<Parameter> ps, ClassDef currentClass) {
    SymbolGenerator symbols = new SymbolGenerator();
    List<DeferredDefault> deferred = new ArrayList<>();
    List<CodeParameterDeclarationExpression> params = parameters(ps, symbols, deferred);
    Docstring doc = Docstring.split(f.body());
    CodeConstructor ctor = gen.constructor(params, () -> body(deferred, doc.statements(), params, symbols, currentClass));
    ctor.getComments().addAll(doc.comments());
    return ctor;
  }

  /**
   * Emits a local function as a delegate-typed local initialized with a
   * statement lambda. Returns the declaration.
   */
  public CodeVariableDeclarationStatement localFunction(FunctionDef f, ClassDef currentClass) {
    Docstring doc = Docstring.split(f.body());
    BodyShape shape = BodyShape.of(doc.statements());
    if (shape.yields) {
      throw new UnsupportedConstructException("generator functions cannot be local", "def " + f.name().name());
    }
    SymbolGenerator symbols = new SymbolGenerator();
    List<DeferredDefault> deferred = new ArrayList<>();
    List<CodeParameterDeclarationExpression> params = parameters(f.parameters(), symbols, deferred);
    List<CodeStatement> statements = new ArrayList<>();
    gen.inStatements(statements, () -> body(deferred, doc.statements(), params, symbols, currentClass));

    List<CodeVariableReferenceExpression> args = params.stream()
        .map(p -> new CodeVariableReferenceExpression(p.parameterName()))
        .toList();
    CodeLambdaExpression lambda = gen.lambda(args, statements);
    CodeVariableDeclarationStatement decl =
        new CodeVariableDeclarationStatement(delegateType(params.size(), shape.returnsValue), f.name().name(), lambda);
    for (CodeCommentStatement comment : doc.comments()) gen.emit(comment);
    gen.emit(decl);
    return decl;
  }

  static CodeTypeReference delegateType(int arity, boolean returnsValue) {
    List<CodeTypeReference> typeArgs = new ArrayList<>(Collections.nCopies(arity, CodeTypeReference.OBJECT));
    if (returnsValue) {
      typeArgs.add(CodeTypeReference.OBJECT);
      return new CodeTypeReference("Func", typeArgs, 0);
    }
    return new CodeTypeReference("Action", typeArgs, 0);
  }

  /** A property from a {@code @property} getter and its optional {@code @x.setter}. */
  public CodeMemberProperty property(PropertyDefinition def, ClassDef currentClass) {
    FunctionDef getter = (FunctionDef) def.getGetter().statement();
    Docstring getDoc = Docstring.split(getter.body());
    Runnable getBody = () -> body(getDoc.statements(), List.of(), new SymbolGenerator(), currentClass);

    Decorated setterDecorated = def.getSetter();
    FunctionDef setter = setterDecorated == null ? null : (FunctionDef) setterDecorated.statement();
    Docstring setDoc = setter == null ? null : Docstring.split(setter.body());
    Runnable setBody = setter == null ? null : () -> {
      SymbolGenerator symbols = new SymbolGenerator();
      symbols.ensureLocalVariable("value", CodeTypeReference.OBJECT, true);
      List<Parameter> ps = StatementTranslator.withoutSelf(setter.parameters());
      if (!ps.isEmpty() && !ps.get(0).id().name().equals("value")) {
        String name = ps.get(0).id().name();
        symbols.ensureLocalVariable(name, CodeTypeReference.OBJECT, false);
        gen.assign(new CodeVariableReferenceExpression(name), new CodeVariableReferenceExpression("value"));
      }
      body(setDoc.statements(), List.of(), symbols, currentClass);
    };

    CodeMemberProperty prop = gen.propertyDef(def.getName(), getBody, setBody);
    prop.getComments().addAll(getDoc.comments());
    if (setDoc != null) prop.getComments().addAll(setDoc.comments());
    return prop;
  }

  /**
   * Parameter declarations. C# defaults must be constants, so a computed
   * default is declared as {@code null} and recorded in {@code deferred}
   * for assignment on entry to the body.
   */
  List<CodeParameterDeclarationExpression> parameters(List<Parameter> ps, SymbolGenerator symbols,
      List<DeferredDefault> deferred) {
    List<CodeParameterDeclarationExpression> out = new ArrayList<>();
    for (Parameter p : ps) {
      CodeTypeReference type = typeMapper.parameterType(p);
      String name = p.id().name();
      CodeExpression defaultValue = null;
      if (p.defaultValue() != null) {
        CodeExpression lowered = xlat.lower(p.defaultValue());
        if (lowered instanceof CodePrimitiveExpression) {
          defaultValue = lowered;
        } else {
          type = TypeMapper.nullable(type);
          defaultValue = new CodePrimitiveExpression(null);
          deferred.add(new DeferredDefault(new CodeVariableReferenceExpression(name), lowered));
        }
      }
      symbols.ensureLocalVariable(name, type, true);
      out.add(new CodeParameterDeclarationExpression(type, name, defaultValue, p.varArgs()));
    }
    return out;
  }

  private void body(List<Statement> statements, List<CodeParameterDeclarationExpression> params,
      SymbolGenerator symbols, ClassDef currentClass) {
    body(List.of(), statements, params, symbols, currentClass);
  }

  private void body(List<DeferredDefault> deferred, List<Statement> statements,
      List<CodeParameterDeclarationExpression> params, SymbolGenerator symbols, ClassDef currentClass) {
    for (DeferredDefault d : deferred) {
      gen.ifStmt(new CodeBinaryOperatorExpression(d.parameter(), CodeOperatorType.IDENTITY_EQUALITY,
          new CodePrimitiveExpression(null)), () -> gen.assign(d.parameter(), d.value()), null);
    }
    TranslationScope scope = TranslationScope.forBody(currentClass, symbols);
    stmtXlat.translateAll(statements, scope);
    LocalVariableGenerator.generate(params, gen.currentMemberStatements(), scope.globals(), symbols);
  }

  /** A parameter whose Python default is assigned in the body. */
  record DeferredDefault(CodeVariableReferenceExpression parameter, CodeExpression value) {
  }

  CodeTypeReference returnType(List<Statement> body) {
    BodyShape shape = BodyShape.of(body);
    if (shape.yields) {
      gen.ensureImport("System.Collections.Generic");
      return ENUMERABLE;
    }
    return shape.returnsValue ? CodeTypeReference.OBJECT : CodeTypeReference.VOID;
  }

  /** Whether a body returns a value or yields, not counting nested functions and classes. */
  private static final class BodyShape {
    boolean returnsValue;
    boolean yields;

    static BodyShape of(List<Statement> body) {
      BodyShape shape = new BodyShape();
      shape.scan(body);
      return shape;
    }

    private void scan(List<Statement> statements) {
      for (Statement s : statements) scan(s);
    }

    private void scan(Statement s) {
      if (s instanceof ReturnStatement r) {
        if (r.expression() != null) returnsValue = true;
      } else if (s instanceof YieldStatement) {
        yields = true;
      } else if (s instanceof IfStatement i) {
        scan(i.then());
        scan(i.orElse());
      } else if (s instanceof WhileStatement w) {
        scan(w.body());
        scan(w.orElse());
      } else if (s instanceof ForStatement f) {
        scan(f.body());
      } else if (s instanceof TryStatement t) {
        scan(t.body());
        for (ExceptHandler h : t.handlers()) scan(h.body());
        scan(t.finallyBody());
      } else if (s instanceof WithStatement w) {
        scan(w.body());
      } else if (s instanceof SuiteStatement suite) {
        scan(suite.statements());
      } else if (s instanceof AsyncStatement a) {
        scan(a.statement());
      }
    }
  }
}
