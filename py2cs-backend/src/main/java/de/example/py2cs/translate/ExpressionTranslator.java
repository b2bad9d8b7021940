package de.example.py2cs.translate;

import de.example.py2cs.UnsupportedConstructException;
import de.example.py2cs.codemodel.CodeApplicationExpression;
import de.example.py2cs.codemodel.CodeArrayCreateExpression;
import de.example.py2cs.codemodel.CodeArrayIndexerExpression;
import de.example.py2cs.codemodel.CodeBinaryOperatorExpression;
import de.example.py2cs.codemodel.CodeByteLiteral;
import de.example.py2cs.codemodel.CodeCollectionInitializer;
import de.example.py2cs.codemodel.CodeConditionExpression;
import de.example.py2cs.codemodel.CodeExpression;
import de.example.py2cs.codemodel.CodeFieldReferenceExpression;
import de.example.py2cs.codemodel.CodeLambdaExpression;
import de.example.py2cs.codemodel.CodeMethodReferenceExpression;
import de.example.py2cs.codemodel.CodeNamedArgument;
import de.example.py2cs.codemodel.CodeObjectCreateExpression;
import de.example.py2cs.codemodel.CodeOperatorType;
import de.example.py2cs.codemodel.CodePrimitiveExpression;
import de.example.py2cs.codemodel.CodeStringLiteral;
import de.example.py2cs.codemodel.CodeThisReferenceExpression;
import de.example.py2cs.codemodel.CodeTypeReference;
import de.example.py2cs.codemodel.CodeTypeReferenceExpression;
import de.example.py2cs.codemodel.CodeUnaryOperatorExpression;
import de.example.py2cs.codemodel.CodeVariableReferenceExpression;
import de.example.py2cs.syntax.Application;
import de.example.py2cs.syntax.Argument;
import de.example.py2cs.syntax.ArrayRef;
import de.example.py2cs.syntax.AssignExp;
import de.example.py2cs.syntax.AttributeAccess;
import de.example.py2cs.syntax.BigLiteral;
import de.example.py2cs.syntax.BinExp;
import de.example.py2cs.syntax.BooleanLiteral;
import de.example.py2cs.syntax.Bytes;
import de.example.py2cs.syntax.Exp;
import de.example.py2cs.syntax.ExpList;
import de.example.py2cs.syntax.ExpressionVisitor;
import de.example.py2cs.syntax.Identifier;
import de.example.py2cs.syntax.IntLiteral;
import de.example.py2cs.syntax.Lambda;
import de.example.py2cs.syntax.LongLiteral;
import de.example.py2cs.syntax.NoneExp;
import de.example.py2cs.syntax.Op;
import de.example.py2cs.syntax.PyDictionary;
import de.example.py2cs.syntax.PyList;
import de.example.py2cs.syntax.PySet;
import de.example.py2cs.syntax.PyTuple;
import de.example.py2cs.syntax.RealLiteral;
import de.example.py2cs.syntax.Slice;
import de.example.py2cs.syntax.StarExp;
import de.example.py2cs.syntax.Str;
import de.example.py2cs.syntax.SyntaxPrinter;
import de.example.py2cs.syntax.TestExp;
import de.example.py2cs.syntax.UnaryExp;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Lowers Python expressions to code model expressions. */
public final class ExpressionTranslator implements ExpressionVisitor<CodeExpression> {

  private static final Map<Op, CodeOperatorType> BINARY_OPS = new EnumMap<>(Op.class);
  private static final Map<Op, CodeOperatorType> UNARY_OPS = new EnumMap<>(Op.class);
  private static final Map<Op, CodeOperatorType> COMPOUND_ASSIGN_OPS = new EnumMap<>(Op.class);

  static {
    BINARY_OPS.put(Op.ADD, CodeOperatorType.ADD);
    BINARY_OPS.put(Op.SUB, CodeOperatorType.SUB);
    BINARY_OPS.put(Op.MUL, CodeOperatorType.MUL);
    BINARY_OPS.put(Op.DIV, CodeOperatorType.DIV);
    BINARY_OPS.put(Op.FLOOR_DIV, CodeOperatorType.FLOORING_DIV);
    BINARY_OPS.put(Op.MOD, CodeOperatorType.MOD);
    BINARY_OPS.put(Op.SHL, CodeOperatorType.SHL);
    BINARY_OPS.put(Op.SHR, CodeOperatorType.SHR);
    BINARY_OPS.put(Op.BIT_AND, CodeOperatorType.BIT_AND);
    BINARY_OPS.put(Op.BIT_OR, CodeOperatorType.BIT_OR);
    BINARY_OPS.put(Op.XOR, CodeOperatorType.BIT_XOR);
    BINARY_OPS.put(Op.AND, CodeOperatorType.LOG_AND);
    BINARY_OPS.put(Op.OR, CodeOperatorType.LOG_OR);
    BINARY_OPS.put(Op.EQ, CodeOperatorType.EQUAL);
    BINARY_OPS.put(Op.NE, CodeOperatorType.NOT_EQUAL);
    BINARY_OPS.put(Op.LT, CodeOperatorType.LT);
    BINARY_OPS.put(Op.LE, CodeOperatorType.LE);
    BINARY_OPS.put(Op.GT, CodeOperatorType.GT);
    BINARY_OPS.put(Op.GE, CodeOperatorType.GE);
    BINARY_OPS.put(Op.IS, CodeOperatorType.IDENTITY_EQUALITY);
    BINARY_OPS.put(Op.IS_NOT, CodeOperatorType.IDENTITY_INEQUALITY);

    UNARY_OPS.put(Op.NOT, CodeOperatorType.NOT);
    UNARY_OPS.put(Op.SUB, CodeOperatorType.NEGATE);
    UNARY_OPS.put(Op.ADD, CodeOperatorType.UNARY_PLUS);
    UNARY_OPS.put(Op.INVERT, CodeOperatorType.COMPLEMENT);

    COMPOUND_ASSIGN_OPS.put(Op.AUG_ADD, CodeOperatorType.ADD_EQ);
    COMPOUND_ASSIGN_OPS.put(Op.AUG_SUB, CodeOperatorType.SUB_EQ);
    COMPOUND_ASSIGN_OPS.put(Op.AUG_MUL, CodeOperatorType.MUL_EQ);
    COMPOUND_ASSIGN_OPS.put(Op.AUG_DIV, CodeOperatorType.DIV_EQ);
    COMPOUND_ASSIGN_OPS.put(Op.AUG_MOD, CodeOperatorType.MOD_EQ);
    COMPOUND_ASSIGN_OPS.put(Op.AUG_AND, CodeOperatorType.AND_EQ);
    COMPOUND_ASSIGN_OPS.put(Op.AUG_OR, CodeOperatorType.OR_EQ);
    COMPOUND_ASSIGN_OPS.put(Op.AUG_XOR, CodeOperatorType.XOR_EQ);
    COMPOUND_ASSIGN_OPS.put(Op.AUG_SHL, CodeOperatorType.SHL_EQ);
    COMPOUND_ASSIGN_OPS.put(Op.AUG_SHR, CodeOperatorType.SHR_EQ);
  }

  private static final CodeTypeReference LIST = CodeTypeReference.of("List", CodeTypeReference.OBJECT);
  private static final CodeTypeReference DICTIONARY =
      CodeTypeReference.of("Dictionary", CodeTypeReference.OBJECT, CodeTypeReference.OBJECT);
  private static final CodeTypeReference HASH_SET = CodeTypeReference.of("HashSet", CodeTypeReference.OBJECT);

  public CodeExpression lower(Exp e) {
    if (e == null) return null;
    return e.accept(this);
  }

  public List<CodeExpression> lowerAll(List<Exp> exps) {
    List<CodeExpression> out = new ArrayList<>(exps.size());
    for (Exp e : exps) out.add(lower(e));
    return out;
  }

  public CodeExpression argument(Argument a) {
    // *args is passed on as the params array
    CodeExpression value = a.value() instanceof StarExp star ? lower(star.expression()) : lower(a.value());
    if (a.name() == null) return value;
    return new CodeNamedArgument(new CodeVariableReferenceExpression(a.name().name()), value);
  }

  @Override
  public CodeExpression visit(Identifier n) {
    if (n.name().equals("self")) return new CodeThisReferenceExpression();
    return new CodeVariableReferenceExpression(n.name());
  }

  @Override
  public CodeExpression visit(AttributeAccess n) {
    return new CodeFieldReferenceExpression(lower(n.expression()), n.fieldName().name());
  }

  @Override
  public CodeExpression visit(ArrayRef n) {
    CodeExpression target = lower(n.array());
    boolean anyRange = n.subs().stream().anyMatch(Slice::range);
    if (!anyRange) {
      List<CodeExpression> indices = new ArrayList<>();
      for (Slice s : n.subs()) indices.add(lower(s.lower()));
      return new CodeArrayIndexerExpression(target, indices);
    }
    if (n.subs().size() != 1) {
      throw new UnsupportedConstructException("multi-dimensional slices are not supported", SyntaxPrinter.print(n));
    }
    Slice s = n.subs().get(0);
    return new CodeApplicationExpression(
        new CodeMethodReferenceExpression(target, "Slice"),
        List.of(orNull(s.lower()), orNull(s.upper()), orNull(s.step())));
  }

  private CodeExpression orNull(Exp e) {
    return e == null ? new CodePrimitiveExpression(null) : lower(e);
  }

  @Override
  public CodeExpression visit(Application n) {
    CodeExpression fn = n.function() instanceof AttributeAccess attr
        ? new CodeMethodReferenceExpression(lower(attr.expression()), attr.fieldName().name())
        : lower(n.function());
    List<CodeExpression> args = new ArrayList<>();
    for (Argument a : n.args()) args.add(argument(a));
    return new CodeApplicationExpression(fn, args);
  }

  @Override
  public CodeExpression visit(BinExp n) {
    CodeExpression l = lower(n.left());
    CodeExpression r = lower(n.right());
    switch (n.op()) {
      case POW:
        return pow(l, r);
      case IN:
        return contains(r, l);
      case NOT_IN:
        return new CodeUnaryOperatorExpression(CodeOperatorType.NOT, contains(r, l));
      default:
        CodeOperatorType op = BINARY_OPS.get(n.op());
        if (op == null) throw new UnsupportedConstructException("unsupported binary operator", SyntaxPrinter.print(n));
        return new CodeBinaryOperatorExpression(l, op, r);
    }
  }

  private static CodeExpression pow(CodeExpression l, CodeExpression r) {
    return new CodeApplicationExpression(
        new CodeMethodReferenceExpression(new CodeTypeReferenceExpression(CodeTypeReference.of("Math")), "Pow"),
        List.of(l, r));
  }

  private static CodeExpression contains(CodeExpression collection, CodeExpression item) {
    return new CodeApplicationExpression(new CodeMethodReferenceExpression(collection, "Contains"), List.of(item));
  }

  @Override
  public CodeExpression visit(UnaryExp n) {
    CodeOperatorType op = UNARY_OPS.get(n.op());
    if (op == null) throw new UnsupportedConstructException("unsupported unary operator", SyntaxPrinter.print(n));
    return new CodeUnaryOperatorExpression(op, lower(n.expression()));
  }

  @Override
  public CodeExpression visit(TestExp n) {
    return new CodeConditionExpression(lower(n.condition()), lower(n.consequent()), lower(n.alternative()));
  }

  @Override
  public CodeExpression visit(Lambda n) {
    List<CodeVariableReferenceExpression> args = n.parameters().stream()
        .map(p -> new CodeVariableReferenceExpression(p.id().name()))
        .toList();
    return CodeLambdaExpression.of(args, lower(n.body()));
  }

  @Override
  public CodeExpression visit(PyList n) {
    return new CodeObjectCreateExpression(LIST, List.of(), lowerAll(n.elements()), null);
  }

  @Override
  public CodeExpression visit(PyTuple n) {
    return tuple(n.values());
  }

  @Override
  public CodeExpression visit(ExpList n) {
    return tuple(n.expressions());
  }

  private CodeExpression tuple(List<Exp> values) {
    if (values.isEmpty()) return new CodeArrayCreateExpression(CodeTypeReference.OBJECT, List.of());
    return new CodeApplicationExpression(
        new CodeMethodReferenceExpression(new CodeTypeReferenceExpression(CodeTypeReference.of("Tuple")), "Create"),
        lowerAll(values));
  }

  @Override
  public CodeExpression visit(PyDictionary n) {
    List<CodeExpression> items = n.items().stream()
        .map(kv -> (CodeExpression) new CodeCollectionInitializer(List.of(lower(kv.key()), lower(kv.value()))))
        .toList();
    return new CodeObjectCreateExpression(DICTIONARY, List.of(), items, null);
  }

  @Override
  public CodeExpression visit(PySet n) {
    return new CodeObjectCreateExpression(HASH_SET, List.of(), lowerAll(n.elements()), null);
  }

  @Override
  public CodeExpression visit(Str n) {
    return new CodePrimitiveExpression(new CodeStringLiteral(n.s(), n.raw(), n.longForm()));
  }

  @Override
  public CodeExpression visit(Bytes n) {
    return new CodePrimitiveExpression(new CodeByteLiteral(n.s()));
  }

  @Override
  public CodeExpression visit(IntLiteral n) {
    return new CodePrimitiveExpression(n.value());
  }

  @Override
  public CodeExpression visit(LongLiteral n) {
    return new CodePrimitiveExpression(n.value());
  }

  @Override
  public CodeExpression visit(BigLiteral n) {
    return new CodePrimitiveExpression(n.value());
  }

  @Override
  public CodeExpression visit(RealLiteral n) {
    return new CodePrimitiveExpression(n.value());
  }

  @Override
  public CodeExpression visit(NoneExp n) {
    return new CodePrimitiveExpression(null);
  }

  @Override
  public CodeExpression visit(BooleanLiteral n) {
    return new CodePrimitiveExpression(n.value());
  }

  @Override
  public CodeExpression visit(AssignExp n) {
    CodeExpression dst = lower(n.dst());
    if (n.op() == Op.ASSIGN) {
      return new CodeBinaryOperatorExpression(dst, CodeOperatorType.ASSIGN, lower(n.src()));
    }
    if (!n.op().isAugmented()) {
      throw new UnsupportedConstructException("not an assignment operator", SyntaxPrinter.print(n));
    }
    CodeOperatorType compound = COMPOUND_ASSIGN_OPS.get(n.op());
    if (compound != null) {
      return new CodeBinaryOperatorExpression(dst, compound, lower(n.src()));
    }
    // no compound form: dst = dst op src
    CodeExpression value = lower(new BinExp(n.op().binaryOf(), n.dst(), n.src()));
    return new CodeBinaryOperatorExpression(dst, CodeOperatorType.ASSIGN, value);
  }

  @Override
  public CodeExpression visit(StarExp n) {
    throw new UnsupportedConstructException("starred expression outside of an argument list", SyntaxPrinter.print(n));
  }
}
