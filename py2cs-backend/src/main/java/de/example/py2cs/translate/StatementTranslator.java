package de.example.py2cs.translate;

import de.example.py2cs.UnsupportedConstructException;
import de.example.py2cs.codemodel.CodeArrayIndexerExpression;
import de.example.py2cs.codemodel.CodeAssignStatement;
import de.example.py2cs.codemodel.CodeAttributeArgument;
import de.example.py2cs.codemodel.CodeAttributeDeclaration;
import de.example.py2cs.codemodel.CodeCatchClause;
import de.example.py2cs.codemodel.CodeConstructor;
import de.example.py2cs.codemodel.CodeExpression;
import de.example.py2cs.codemodel.CodeExpressionStatement;
import de.example.py2cs.codemodel.CodeMemberField;
import de.example.py2cs.codemodel.CodeMemberProperty;
import de.example.py2cs.codemodel.CodeStatement;
import de.example.py2cs.codemodel.CodeTypeDeclaration;
import de.example.py2cs.codemodel.CodeTypeMember;
import de.example.py2cs.codemodel.CodeTypeReference;
import de.example.py2cs.codemodel.CodeVariableDeclarationStatement;
import de.example.py2cs.codemodel.CodeVariableReferenceExpression;
import de.example.py2cs.codemodel.MemberAttributes;
import de.example.py2cs.syntax.AliasedName;
import de.example.py2cs.syntax.Argument;
import de.example.py2cs.syntax.ArrayRef;
import de.example.py2cs.syntax.AssertStatement;
import de.example.py2cs.syntax.AssignExp;
import de.example.py2cs.syntax.AsyncStatement;
import de.example.py2cs.syntax.AttributeAccess;
import de.example.py2cs.syntax.BreakStatement;
import de.example.py2cs.syntax.ClassDef;
import de.example.py2cs.syntax.CommentStatement;
import de.example.py2cs.syntax.ContinueStatement;
import de.example.py2cs.syntax.Decorated;
import de.example.py2cs.syntax.Decorator;
import de.example.py2cs.syntax.DelStatement;
import de.example.py2cs.syntax.DottedName;
import de.example.py2cs.syntax.ExceptHandler;
import de.example.py2cs.syntax.ExecStatement;
import de.example.py2cs.syntax.Exp;
import de.example.py2cs.syntax.ExpList;
import de.example.py2cs.syntax.ExpStatement;
import de.example.py2cs.syntax.ForStatement;
import de.example.py2cs.syntax.FromStatement;
import de.example.py2cs.syntax.FunctionDef;
import de.example.py2cs.syntax.GlobalStatement;
import de.example.py2cs.syntax.Identifier;
import de.example.py2cs.syntax.IfStatement;
import de.example.py2cs.syntax.ImportStatement;
import de.example.py2cs.syntax.NonlocalStatement;
import de.example.py2cs.syntax.Op;
import de.example.py2cs.syntax.Parameter;
import de.example.py2cs.syntax.PassStatement;
import de.example.py2cs.syntax.PrintStatement;
import de.example.py2cs.syntax.PyList;
import de.example.py2cs.syntax.PyTuple;
import de.example.py2cs.syntax.RaiseStatement;
import de.example.py2cs.syntax.ReturnStatement;
import de.example.py2cs.syntax.StarExp;
import de.example.py2cs.syntax.Statement;
import de.example.py2cs.syntax.StatementVisitor;
import de.example.py2cs.syntax.Str;
import de.example.py2cs.syntax.SuiteStatement;
import de.example.py2cs.syntax.SyntaxPrinter;
import de.example.py2cs.syntax.TryStatement;
import de.example.py2cs.syntax.WhileStatement;
import de.example.py2cs.syntax.WithItem;
import de.example.py2cs.syntax.WithStatement;
import de.example.py2cs.syntax.YieldStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Lowers Python statements into the code model through a {@link CodeGenerator}.
 * Statements that need a member body but occur directly in a module or class
 * body go into that type's static constructor.
 */
public final class StatementTranslator implements StatementVisitor<TranslationScope> {
  private static final Logger log = LoggerFactory.getLogger(StatementTranslator.class);

  private final CodeGenerator gen;
  private final TypeMapper typeMapper;
  private final ExpressionTranslator xlat;
  private final MethodGenerator methods;

  public StatementTranslator(CodeGenerator gen, TypeMapper typeMapper) {
    this.gen = gen;
    this.typeMapper = typeMapper;
    this.xlat = new ExpressionTranslator();
    this.methods = new MethodGenerator(gen, typeMapper, xlat, this);
  }

  public void translate(Statement s, TranslationScope scope) {
    s.accept(this, scope);
  }

  public void translateAll(List<Statement> statements, TranslationScope scope) {
    for (Statement s : statements) {
      translate(s, scope);
    }
  }

  /** Runs {@code r} in the current member, or in the static constructor when there is none. */
  private void inCodeContext(TranslationScope scope, Runnable r) {
    if (gen.currentMember() != null) {
      r.run();
      return;
    }
    CodeConstructor cctor = scope.ensureClassConstructor(gen);
    gen.inMember(cctor, cctor.getStatements(), r);
  }

  // ---------------------------------------------------------------------------
  // classes, functions, decorators

  @Override
  public void visit(ClassDef c, TranslationScope scope) {
    List<CodeAttributeDeclaration> attrs = scope.takePendingAttributes();
    List<String> bases = new ArrayList<>();
    for (Exp b : c.bases()) {
      String name = baseClassName(b);
      if (name != null) bases.add(name);
    }
    Docstring doc = Docstring.split(c.body());
    TranslationScope classScope = TranslationScope.forClass(c, findProperties(doc.statements()));
    log.debug("Translating class {}", c.name().name());

    CodeTypeDeclaration type = gen.classDef(c.name().name(), bases, () -> {
      translateAll(doc.statements(), classScope);
      classScope.classConstructor().ifPresent(cctor -> LocalVariableGenerator.generate(
          List.of(), cctor.getStatements(), classScope.globals(), classScope.symbols()));
    });
    type.getComments().addAll(doc.comments());
    type.getCustomAttributes().addAll(attrs);
  }

  private static String baseClassName(Exp b) {
    if (b instanceof Identifier id) return id.name().equals("object") ? null : id.name();
    if (b instanceof AttributeAccess) return SyntaxPrinter.print(b);
    // metaclass=..., and other keyword bases have no C# counterpart
    return null;
  }

  /** Pairs up {@code @property} getters and {@code @x.setter} setters of a class body. */
  static Map<Decorated, PropertyDefinition> findProperties(List<Statement> body) {
    Map<String, PropertyDefinition> byName = new LinkedHashMap<>();
    Map<Decorated, PropertyDefinition> result = new IdentityHashMap<>();
    for (Statement s : body) {
      if (!(s instanceof Decorated dec) || !(dec.statement() instanceof FunctionDef def)) continue;
      String fnName = def.name().name();
      for (Decorator d : dec.decorations()) {
        DecoratorKind kind = DecoratorKind.classify(d, fnName);
        if (kind instanceof DecoratorKind.Getter) {
          PropertyDefinition pd = byName.computeIfAbsent(fnName, PropertyDefinition::new);
          pd.setGetter(dec, d);
          result.put(dec, pd);
        } else if (kind instanceof DecoratorKind.Setter setter) {
          PropertyDefinition pd = byName.computeIfAbsent(setter.propertyName(), PropertyDefinition::new);
          pd.setSetter(dec, d);
          result.put(dec, pd);
        }
      }
    }
    for (PropertyDefinition pd : byName.values()) {
      if (pd.getGetter() == null) {
        throw new UnsupportedConstructException("property setter without a getter", pd.getName());
      }
    }
    return result;
  }

  @Override
  public void visit(Decorated d, TranslationScope scope) {
    PropertyDefinition def = scope.property(d);
    if (def == null) {
      scope.setPendingAttributes(d.decorations().stream().map(this::customAttribute).toList());
      translate(d.statement(), scope);
      return;
    }
    if (def.isTranslated()) return;

    CodeMemberProperty prop = methods.property(def, scope.currentClass());
    prop.getCustomAttributes().addAll(otherAttributes(def));
    def.markTranslated();
  }

  private List<CodeAttributeDeclaration> otherAttributes(PropertyDefinition def) {
    List<CodeAttributeDeclaration> attrs = new ArrayList<>();
    for (Decorator x : def.getGetter().decorations()) {
      if (x != def.getGetterDecoration()) attrs.add(customAttribute(x));
    }
    if (def.getSetter() != null) {
      for (Decorator x : def.getSetter().decorations()) {
        if (x != def.getSetterDecoration()) attrs.add(customAttribute(x));
      }
    }
    return attrs;
  }

  private CodeAttributeDeclaration customAttribute(Decorator d) {
    List<CodeAttributeArgument> args = new ArrayList<>();
    for (Argument a : d.arguments()) {
      args.add(new CodeAttributeArgument(a.name() == null ? null : a.name().name(), xlat.lower(a.value())));
    }
    return gen.customAttr(gen.typeRef(d.className().toString()), args);
  }

  @Override
  public void visit(FunctionDef f, TranslationScope scope) {
    List<CodeAttributeDeclaration> attrs = scope.takePendingAttributes();
    if (gen.currentMember() != null) {
      if (!attrs.isEmpty()) {
        log.warn("Decorators on local function '{}' have no C# counterpart; kept as a comment", f.name().name());
        gen.comment(" " + attrs.stream()
            .map(a -> "[" + a.attributeType().typeName() + "]")
            .collect(Collectors.joining(" ")));
      }
      methods.localFunction(f, scope.currentClass());
      return;
    }

    String name = f.name().name();
    CodeTypeMember member;
    if (scope.currentClass() != null && isInstanceMethod(f)) {
      List<Parameter> ps = withoutSelf(f.parameters());
      if (name.equals("__init__")) {
        member = methods.constructor(f, ps, scope.currentClass());
      } else if (name.equals("__str__")) {
        member = methods.toStringOverride(f, scope.currentClass());
      } else {
        member = methods.method(f, name, ps, false, scope.currentClass());
      }
    } else {
      member = methods.method(f, name, f.parameters(), true, scope.currentClass());
    }
    member.getCustomAttributes().addAll(attrs);
  }

  private static boolean isInstanceMethod(FunctionDef f) {
    return !f.parameters().isEmpty() && f.parameters().get(0).id().name().equals("self");
  }

  static List<Parameter> withoutSelf(List<Parameter> ps) {
    if (!ps.isEmpty() && ps.get(0).id().name().equals("self")) return ps.subList(1, ps.size());
    return ps;
  }

  @Override
  public void visit(AsyncStatement a, TranslationScope scope) {
    throw new UnsupportedConstructException("async statements are not supported", SyntaxPrinter.describe(a));
  }

  // ---------------------------------------------------------------------------
  // assignments

  @Override
  public void visit(ExpStatement e, TranslationScope scope) {
    if (e.expression() instanceof AssignExp ass) {
      assignment(ass, scope);
      return;
    }
    inCodeContext(scope, () -> gen.sideEffect(xlat.lower(e.expression())));
  }

  private void assignment(AssignExp ass, TranslationScope scope) {
    List<Exp> targets = tupleElements(ass.dst());
    if (targets != null) {
      if (ass.op() != Op.ASSIGN) {
        throw new UnsupportedConstructException("augmented assignment to a tuple", SyntaxPrinter.print(ass));
      }
      inCodeContext(scope, () -> {
        List<Exp> sources = tupleElements(ass.src());
        if (sources != null) tupleToTuple(targets, sources, scope);
        else tupleFromExpression(targets, xlat.lower(ass.src()), scope);
      });
      return;
    }

    if (gen.currentMember() == null
        && ass.dst() instanceof Identifier id
        && ass.op() == Op.ASSIGN
        && findField(id.name()) == null) {
      classField(id, ass, scope);
      return;
    }

    inCodeContext(scope, () -> {
      if (ass.dst() instanceof Identifier id && ass.op() == Op.ASSIGN) {
        bindTarget(id, typeMapper.inferType(ass.src()), scope);
      }
      if (ass.op() == Op.ASSIGN) {
        gen.assign(xlat.lower(ass.dst()), xlat.lower(ass.src()));
      } else {
        gen.sideEffect(xlat.lower(ass));
      }
    });
  }

  private static List<Exp> tupleElements(Exp e) {
    if (e instanceof ExpList l) return l.expressions();
    if (e instanceof PyTuple t) return t.values();
    return null;
  }

  /**
   * Records {@code id} as a local of the body being translated, or as a static
   * field when the assignment runs in a static constructor.
   */
  private void bindTarget(Identifier id, CodeTypeReference type, TranslationScope scope) {
    if (id.name().equals("self") || scope.globals().contains(id.name())) return;
    if (scope.isInitializing(gen)) {
      if (findField(id.name()) == null) {
        CodeMemberField field = gen.field(CodeTypeReference.OBJECT, id.name());
        field.getAttributes().add(MemberAttributes.STATIC);
      }
      return;
    }
    scope.symbols().ensureLocalVariable(id.name(), type, false);
  }

  private CodeMemberField findField(String name) {
    CodeTypeDeclaration type = gen.currentType();
    if (type == null) return null;
    for (CodeTypeMember m : type.getMembers()) {
      if (m instanceof CodeMemberField f && name.equals(f.getName())) return f;
    }
    return null;
  }

  private void classField(Identifier id, AssignExp ass, TranslationScope scope) {
    if (id.name().equals("__slots__")) {
      slots(ass, scope);
      return;
    }
    CodeMemberField field = gen.field(typeMapper.inferType(ass.src()), id.name());
    field.getAttributes().add(MemberAttributes.STATIC);
    field.setInitExpression(xlat.lower(ass.src()));
  }

  private void slots(AssignExp ass, TranslationScope scope) {
    List<Exp> names = ass.src() instanceof PyList l ? l.elements() : tupleElements(ass.src());
    if (names == null) {
      log.warn("__slots__ is computed dynamically; emitting it as a comment");
      gen.comment(" " + SyntaxPrinter.print(ass));
      return;
    }
    for (Exp n : names) {
      if (n instanceof Str s) gen.field(CodeTypeReference.OBJECT, s.s());
    }
  }

  private void tupleToTuple(List<Exp> targets, List<Exp> sources, TranslationScope scope) {
    if (targets.size() != sources.size()) {
      throw new UnsupportedConstructException("tuple assignment with mismatched sizes",
          targets.size() + " targets, " + sources.size() + " values");
    }
    for (int i = 0; i < targets.size(); i++) {
      Exp dst = targets.get(i);
      if (dst instanceof Identifier id) bindTarget(id, typeMapper.inferType(sources.get(i)), scope);
      gen.assign(xlat.lower(dst), xlat.lower(sources.get(i)));
    }
  }

  private void tupleFromExpression(List<Exp> targets, CodeExpression value, TranslationScope scope) {
    CodeVariableReferenceExpression tup = scope.symbols().genSymLocal("_tup_", CodeTypeReference.OBJECT);
    gen.assign(tup, value);
    tupleItems(targets, tup, scope);
  }

  private void tupleItems(List<Exp> targets, CodeExpression tup, TranslationScope scope) {
    for (int i = 0; i < targets.size(); i++) {
      Exp dst = targets.get(i);
      if (dst instanceof Identifier id && id.isWildcard()) continue;
      if (dst instanceof StarExp) {
        throw new UnsupportedConstructException("starred assignment target", SyntaxPrinter.print(dst));
      }
      CodeExpression item = gen.access(tup, "Item" + (i + 1));
      List<Exp> nested = tupleElements(dst);
      if (nested != null) {
        tupleFromExpression(nested, item, scope);
        continue;
      }
      if (dst instanceof Identifier id) bindTarget(id, CodeTypeReference.OBJECT, scope);
      gen.assign(xlat.lower(dst), item);
    }
  }

  // ---------------------------------------------------------------------------
  // control flow

  @Override
  public void visit(IfStatement i, TranslationScope scope) {
    inCodeContext(scope, () -> gen.ifStmt(xlat.lower(i.test()),
        () -> translateAll(i.then(), scope),
        () -> translateAll(i.orElse(), scope)));
  }

  @Override
  public void visit(WhileStatement w, TranslationScope scope) {
    inCodeContext(scope, () -> {
      CodeExpression test = xlat.lower(w.test());
      if (w.orElse().isEmpty()) {
        gen.whileStmt(test, () -> translateAll(w.body(), scope));
        return;
      }
      // the else branch runs when the test is false on entry
      gen.ifStmt(test,
          () -> gen.doWhile(() -> translateAll(w.body(), scope), test),
          () -> translateAll(w.orElse(), scope));
    });
  }

  @Override
  public void visit(ForStatement f, TranslationScope scope) {
    inCodeContext(scope, () -> {
      Exp target = f.exprs();
      CodeExpression collection = xlat.lower(f.tests());
      if (target instanceof Identifier id) {
        gen.foreach(xlat.lower(id), collection, () -> translateAll(f.body(), scope));
        return;
      }
      List<Exp> targets = tupleElements(target);
      if (targets != null) {
        CodeVariableReferenceExpression tup = scope.symbols().genSymLocal("_tup_", CodeTypeReference.OBJECT);
        gen.foreach(tup, collection, () -> {
          tupleItems(targets, tup, scope);
          translateAll(f.body(), scope);
        });
        return;
      }
      if (target instanceof AttributeAccess || target instanceof ArrayRef) {
        CodeVariableReferenceExpression it = scope.symbols().genSymLocal("_it_", CodeTypeReference.OBJECT);
        gen.foreach(it, collection, () -> {
          gen.assign(xlat.lower(target), it);
          translateAll(f.body(), scope);
        });
        return;
      }
      throw new UnsupportedConstructException("unsupported for-loop target", SyntaxPrinter.print(target));
    });
  }

  @Override
  public void visit(TryStatement t, TranslationScope scope) {
    inCodeContext(scope, () -> gen.tryStmt(
        () -> translateAll(t.body(), scope),
        () -> t.handlers().stream().map(h -> catchClause(h, scope)).toList(),
        t.finallyBody().isEmpty() ? null : () -> translateAll(t.finallyBody(), scope)));
  }

  private CodeCatchClause catchClause(ExceptHandler h, TranslationScope scope) {
    String local = h.name() == null ? null : h.name().name();
    Runnable body = () -> translateAll(h.body(), scope);
    if (h.type() instanceof Identifier ex) {
      return gen.catchClause(local, gen.typeRef(ex.name()), body);
    }
    if (local != null) {
      return gen.catchClause(local, gen.typeRef("Exception"), body);
    }
    return gen.catchClause(null, null, body);
  }

  @Override
  public void visit(WithStatement w, TranslationScope scope) {
    inCodeContext(scope, () -> {
      List<CodeStatement> initializers = new ArrayList<>();
      for (WithItem item : w.items()) {
        CodeExpression ctx = xlat.lower(item.context());
        if (item.target() == null) {
          initializers.add(new CodeExpressionStatement(ctx));
        } else if (item.target() instanceof Identifier id) {
          initializers.add(new CodeVariableDeclarationStatement(null, id.name(), ctx));
        } else {
          initializers.add(new CodeAssignStatement(xlat.lower(item.target()), ctx));
        }
      }
      gen.usingScope(initializers, () -> translateAll(w.body(), scope));
    });
  }

  @Override
  public void visit(RaiseStatement r, TranslationScope scope) {
    inCodeContext(scope, () -> gen.throwStmt(xlat.lower(r.exToRaise())));
  }

  @Override
  public void visit(ReturnStatement r, TranslationScope scope) {
    inCodeContext(scope, () -> gen.returnStmt(xlat.lower(r.expression())));
  }

  @Override
  public void visit(YieldStatement y, TranslationScope scope) {
    inCodeContext(scope, () -> gen.yieldStmt(xlat.lower(y.expression())));
  }

  @Override
  public void visit(BreakStatement b, TranslationScope scope) {
    inCodeContext(scope, gen::breakStmt);
  }

  @Override
  public void visit(ContinueStatement c, TranslationScope scope) {
    inCodeContext(scope, gen::continueStmt);
  }

  @Override
  public void visit(PassStatement p, TranslationScope scope) {
  }

  @Override
  public void visit(SuiteStatement s, TranslationScope scope) {
    translateAll(s.statements(), scope);
  }

  @Override
  public void visit(CommentStatement c, TranslationScope scope) {
    gen.comment(c.comment());
  }

  // ---------------------------------------------------------------------------
  // builtin statements

  @Override
  public void visit(PrintStatement p, TranslationScope scope) {
    inCodeContext(scope, () -> {
      CodeExpression target = p.outputStream() == null ? gen.typeRefExpr("Console") : xlat.lower(p.outputStream());
      List<CodeExpression> args = p.args().stream().map(xlat::argument).toList();
      gen.sideEffect(gen.appl(gen.methodRef(target, "WriteLine"), args));
    });
  }

  @Override
  public void visit(ExecStatement e, TranslationScope scope) {
    inCodeContext(scope, () -> {
      List<CodeExpression> args = new ArrayList<>();
      args.add(xlat.lower(e.code()));
      if (e.globals() != null) {
        args.add(xlat.lower(e.globals()));
        if (e.locals() != null) args.add(xlat.lower(e.locals()));
      }
      gen.sideEffect(gen.appl(gen.methodRef(null, "Python_Exec"), args));
    });
  }

  @Override
  public void visit(AssertStatement a, TranslationScope scope) {
    gen.ensureImport("System.Diagnostics");
    inCodeContext(scope, () -> {
      for (Exp test : a.tests()) {
        gen.sideEffect(gen.appl(gen.methodRef(gen.typeRefExpr("Debug"), "Assert"), xlat.lower(test)));
      }
    });
  }

  @Override
  public void visit(DelStatement d, TranslationScope scope) {
    inCodeContext(scope, () -> {
      List<Exp> exps = d.expressions().size() == 1 && d.expressions().get(0) instanceof ExpList l
          ? l.expressions()
          : d.expressions();
      if (exps.size() == 1) {
        CodeExpression lowered = xlat.lower(exps.get(0));
        if (lowered instanceof CodeArrayIndexerExpression aref && aref.indices().size() == 1) {
          gen.sideEffect(gen.appl(gen.methodRef(aref.targetObject(), "Remove"), aref.indices().get(0)));
          return;
        }
      }
      for (Exp e : exps) {
        log.warn("No C# equivalent for 'del {}'; emitting WONKO_del", SyntaxPrinter.print(e));
        gen.sideEffect(gen.appl(gen.methodRef(null, "WONKO_del"), xlat.lower(e)));
      }
    });
  }

  // ---------------------------------------------------------------------------
  // scoping and imports

  @Override
  public void visit(GlobalStatement g, TranslationScope scope) {
    for (Identifier id : g.names()) scope.addGlobal(id.name());
  }

  @Override
  public void visit(NonlocalStatement n, TranslationScope scope) {
    String names = n.names().stream().map(id -> gen.escapeKeywordName(id.name())).collect(Collectors.joining(", "));
    log.warn("nonlocal {} has no C# counterpart; emitting a comment", names);
    gen.comment("LOCAL " + names);
  }

  @Override
  public void visit(ImportStatement imp, TranslationScope scope) {
    for (AliasedName name : imp.names()) {
      if (name.alias() == null) gen.using(name.orig().toString());
      else gen.using(name.alias().name(), name.orig().toString());
    }
  }

  @Override
  public void visit(FromStatement from, TranslationScope scope) {
    DottedName module = from.dottedName();
    if (from.aliasedNames().isEmpty()) {
      if (module == null) throw new UnsupportedConstructException("relative wildcard import", "from . import *");
      gen.using(module.toString());
      return;
    }
    for (AliasedName name : from.aliasedNames()) {
      String imported = name.orig().toString();
      String alias = name.alias() != null ? name.alias().name() : null;
      if (module == null) {
        if (alias == null) gen.using(imported);
        else gen.using(alias, imported);
      } else {
        String qualified = module + "." + imported;
        gen.using(alias != null ? alias : name.orig().segs().get(name.orig().segs().size() - 1).name(), qualified);
      }
    }
  }
}
