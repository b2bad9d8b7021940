package de.example.py2cs.codemodel;

import de.example.py2cs.UnsupportedConstructException;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Writes code model expressions as C# source. Each call carries the ambient
 * precedence of its parent; a node is parenthesized when its own precedence is
 * lower, or equal and the parent asks for parentheses on ties.
 */
public final class CSharpExpressionWriter implements CodeExpressionVisitor<CSharpExpressionWriter.Ambient> {

  public static final int PREC_BASE = 0;
  public static final int PREC_ASSIGNMENT = 1;
  public static final int PREC_CONDITIONAL = 2;
  public static final int PREC_LOGICAL_OR = 3;
  public static final int PREC_LOGICAL_AND = 4;
  public static final int PREC_BIT_OR = 5;
  public static final int PREC_BIT_XOR = 6;
  public static final int PREC_BIT_AND = 7;
  public static final int PREC_EQUALITY = 8;
  public static final int PREC_RELATIONAL = 9;
  public static final int PREC_SHIFT = 10;
  public static final int PREC_ADDITIVE = 11;
  public static final int PREC_MULTIPLICATIVE = 12;
  public static final int PREC_UNARY = 13;
  public static final int PREC_POSTFIX = 14;
  public static final int PREC_PRIMARY = 15;

  /** Precedence context handed down from the parent node. */
  public record Ambient(int precedence, boolean parensOnTie) {
  }

  private static final Map<CodeOperatorType, Integer> PRECEDENCE = new EnumMap<>(CodeOperatorType.class);
  private static final Map<CodeOperatorType, String> BINARY_TEXT = new EnumMap<>(CodeOperatorType.class);
  private static final Map<CodeOperatorType, String> UNARY_TEXT = new EnumMap<>(CodeOperatorType.class);
  private static final Map<String, String> BUILTIN_TYPES = Map.ofEntries(
      Map.entry("System.Object", "object"),
      Map.entry("System.String", "string"),
      Map.entry("System.Int32", "int"),
      Map.entry("System.Int64", "long"),
      Map.entry("System.Double", "double"),
      Map.entry("System.Boolean", "bool"),
      Map.entry("System.Byte", "byte"),
      Map.entry("System.Void", "void"));

  static {
    for (CodeOperatorType op : List.of(CodeOperatorType.COMPLEMENT, CodeOperatorType.NOT,
        CodeOperatorType.NEGATE, CodeOperatorType.UNARY_PLUS)) {
      PRECEDENCE.put(op, PREC_UNARY);
    }
    binary(CodeOperatorType.MUL, "*", PREC_MULTIPLICATIVE);
    binary(CodeOperatorType.DIV, "/", PREC_MULTIPLICATIVE);
    binary(CodeOperatorType.FLOORING_DIV, "/", PREC_MULTIPLICATIVE);
    binary(CodeOperatorType.MOD, "%", PREC_MULTIPLICATIVE);
    binary(CodeOperatorType.ADD, "+", PREC_ADDITIVE);
    binary(CodeOperatorType.SUB, "-", PREC_ADDITIVE);
    binary(CodeOperatorType.SHL, "<<", PREC_SHIFT);
    binary(CodeOperatorType.SHR, ">>", PREC_SHIFT);
    binary(CodeOperatorType.LT, "<", PREC_RELATIONAL);
    binary(CodeOperatorType.GT, ">", PREC_RELATIONAL);
    binary(CodeOperatorType.LE, "<=", PREC_RELATIONAL);
    binary(CodeOperatorType.GE, ">=", PREC_RELATIONAL);
    binary(CodeOperatorType.IS, "is", PREC_EQUALITY);
    binary(CodeOperatorType.EQUAL, "==", PREC_EQUALITY);
    binary(CodeOperatorType.NOT_EQUAL, "!=", PREC_EQUALITY);
    binary(CodeOperatorType.IDENTITY_EQUALITY, "==", PREC_EQUALITY);
    binary(CodeOperatorType.IDENTITY_INEQUALITY, "!=", PREC_EQUALITY);
    binary(CodeOperatorType.BIT_AND, "&", PREC_BIT_AND);
    binary(CodeOperatorType.BIT_XOR, "^", PREC_BIT_XOR);
    binary(CodeOperatorType.BIT_OR, "|", PREC_BIT_OR);
    binary(CodeOperatorType.LOG_AND, "&&", PREC_LOGICAL_AND);
    binary(CodeOperatorType.LOG_OR, "||", PREC_LOGICAL_OR);
    PRECEDENCE.put(CodeOperatorType.CONDITIONAL, PREC_CONDITIONAL);
    binary(CodeOperatorType.ASSIGN, "=", PREC_ASSIGNMENT);
    binary(CodeOperatorType.ADD_EQ, "+=", PREC_ASSIGNMENT);
    binary(CodeOperatorType.SUB_EQ, "-=", PREC_ASSIGNMENT);
    binary(CodeOperatorType.MUL_EQ, "*=", PREC_ASSIGNMENT);
    binary(CodeOperatorType.DIV_EQ, "/=", PREC_ASSIGNMENT);
    binary(CodeOperatorType.FLOORING_DIV_EQ, "/=", PREC_ASSIGNMENT);
    binary(CodeOperatorType.MOD_EQ, "%=", PREC_ASSIGNMENT);
    binary(CodeOperatorType.AND_EQ, "&=", PREC_ASSIGNMENT);
    binary(CodeOperatorType.OR_EQ, "|=", PREC_ASSIGNMENT);
    binary(CodeOperatorType.XOR_EQ, "^=", PREC_ASSIGNMENT);
    binary(CodeOperatorType.SHL_EQ, "<<=", PREC_ASSIGNMENT);
    binary(CodeOperatorType.SHR_EQ, ">>=", PREC_ASSIGNMENT);

    UNARY_TEXT.put(CodeOperatorType.COMPLEMENT, "~");
    UNARY_TEXT.put(CodeOperatorType.NOT, "!");
    UNARY_TEXT.put(CodeOperatorType.NEGATE, "-");
    UNARY_TEXT.put(CodeOperatorType.UNARY_PLUS, "+");
  }

  private static void binary(CodeOperatorType op, String text, int precedence) {
    BINARY_TEXT.put(op, text);
    PRECEDENCE.put(op, precedence);
  }

  private final IndentingTextWriter writer;

  public CSharpExpressionWriter(IndentingTextWriter writer) {
    this.writer = writer;
  }

  public void write(CodeExpression e) {
    write(e, PREC_BASE, false);
  }

  /**
   * Writes {@code e} in a context of the given precedence. On failure nothing
   * of {@code e} remains in the output.
   */
  public void write(CodeExpression e, int precedence, boolean parensOnTie) {
    IndentingTextWriter.Mark mark = writer.mark();
    try {
      e.accept(this, new Ambient(precedence, parensOnTie));
    } catch (RuntimeException ex) {
      writer.reset(mark);
      throw ex;
    }
  }

  public static int precedenceOf(CodeOperatorType op) {
    Integer p = PRECEDENCE.get(op);
    if (p == null) throw new UnsupportedConstructException("operator has no precedence", String.valueOf(op));
    return p;
  }

  public static String binaryText(CodeOperatorType op) {
    String s = BINARY_TEXT.get(op);
    if (s == null) throw new UnsupportedConstructException("not a binary operator", String.valueOf(op));
    return s;
  }

  public static String unaryText(CodeOperatorType op) {
    String s = UNARY_TEXT.get(op);
    if (s == null) throw new UnsupportedConstructException("not a unary operator", String.valueOf(op));
    return s;
  }

  private static boolean needsParens(int precedence, Ambient a) {
    return precedence < a.precedence() || (precedence == a.precedence() && a.parensOnTie());
  }

  @Override
  public void visit(CodeVariableReferenceExpression e, Ambient a) {
    writer.writeName(e.name());
  }

  @Override
  public void visit(CodeFieldReferenceExpression e, Ambient a) {
    write(e.expression(), PREC_POSTFIX, false);
    writer.write(".");
    writer.writeName(e.fieldName());
  }

  @Override
  public void visit(CodeMethodReferenceExpression e, Ambient a) {
    if (e.targetObject() != null) {
      write(e.targetObject(), PREC_POSTFIX, false);
      writer.write(".");
    }
    writer.writeName(e.methodName());
  }

  @Override
  public void visit(CodeArrayIndexerExpression e, Ambient a) {
    write(e.targetObject(), PREC_POSTFIX, false);
    writer.write("[");
    writeList(e.indices());
    writer.write("]");
  }

  @Override
  public void visit(CodeApplicationExpression e, Ambient a) {
    write(e.method(), PREC_POSTFIX, false);
    writer.write("(");
    writeList(e.arguments());
    writer.write(")");
  }

  @Override
  public void visit(CodeBinaryOperatorExpression e, Ambient a) {
    String op = binaryText(e.operator());
    int prec = precedenceOf(e.operator());
    boolean parens = needsParens(prec, a);
    // assignments group to the right, everything else to the left
    boolean rightAssoc = prec == PREC_ASSIGNMENT;
    if (parens) writer.write("(");
    write(e.left(), prec, rightAssoc);
    writer.write(" " + op + " ");
    write(e.right(), prec, !rightAssoc);
    if (parens) writer.write(")");
  }

  @Override
  public void visit(CodeUnaryOperatorExpression e, Ambient a) {
    String op = unaryText(e.operator());
    boolean parens = needsParens(PREC_UNARY, a);
    if (parens) writer.write("(");
    writer.write(op);
    if (startsWithSign(e.expression(), op)) writer.write(" ");
    write(e.expression(), PREC_UNARY, false);
    if (parens) writer.write(")");
  }

  /** {@code - -x} and {@code + +x} must not fuse into {@code --x} or {@code ++x}. */
  private static boolean startsWithSign(CodeExpression operand, String op) {
    if (!"-".equals(op) && !"+".equals(op)) return false;
    if (operand instanceof CodeUnaryOperatorExpression u) {
      String inner = UNARY_TEXT.get(u.operator());
      return op.equals(inner);
    }
    if (operand instanceof CodePrimitiveExpression p) {
      return "-".equals(op) && CSharpLiterals.isNegativeNumber(p.value());
    }
    return false;
  }

  @Override
  public void visit(CodeConditionExpression e, Ambient a) {
    boolean parens = needsParens(PREC_CONDITIONAL, a);
    if (parens) writer.write("(");
    write(e.condition(), PREC_CONDITIONAL, true);
    writer.write(" ? ");
    write(e.consequent(), PREC_CONDITIONAL, false);
    writer.write(" : ");
    write(e.alternative(), PREC_CONDITIONAL, false);
    if (parens) writer.write(")");
  }

  @Override
  public void visit(CodeLambdaExpression e, Ambient a) {
    boolean parens = needsParens(PREC_ASSIGNMENT, a);
    if (parens) writer.write("(");
    if (e.arguments().size() == 1) {
      writer.writeName(e.arguments().get(0).name());
    } else {
      writer.write("(");
      for (int i = 0; i < e.arguments().size(); i++) {
        if (i > 0) writer.write(", ");
        writer.writeName(e.arguments().get(i).name());
      }
      writer.write(")");
    }
    writer.write(" =>");
    if (e.hasStatementBody()) {
      new CSharpStatementWriter(writer).writeBlock(e.statements());
    } else {
      writer.write(" ");
      write(e.body(), PREC_ASSIGNMENT, false);
    }
    if (parens) writer.write(")");
  }

  @Override
  public void visit(CodeObjectCreateExpression e, Ambient a) {
    writer.write("new ");
    writeType(e.type());
    if (!e.arguments().isEmpty() || (e.initializers().isEmpty() && e.initializer() == null)) {
      writer.write("(");
      writeList(e.arguments());
      writer.write(")");
    }
    if (!e.initializers().isEmpty()) {
      writer.write(" {");
      writer.writeLine();
      writer.indent(() -> {
        for (int i = 0; i < e.initializers().size(); i++) {
          write(e.initializers().get(i));
          if (i < e.initializers().size() - 1) writer.write(",");
          writer.writeLine();
        }
      });
      writer.write("}");
    } else if (e.initializer() != null) {
      writer.write(" ");
      write(e.initializer());
    }
  }

  @Override
  public void visit(CodeArrayCreateExpression e, Ambient a) {
    writer.write("new ");
    writeType(e.elementType());
    if (e.initializers().isEmpty()) {
      writer.write("[0]");
      return;
    }
    writer.write("[] { ");
    writeList(e.initializers());
    writer.write(" }");
  }

  @Override
  public void visit(CodeCollectionInitializer e, Ambient a) {
    writer.write("{ ");
    writeList(e.values());
    writer.write(" }");
  }

  @Override
  public void visit(CodePrimitiveExpression e, Ambient a) {
    String text = CSharpLiterals.format(e.value());
    boolean parens = CSharpLiterals.isNegativeNumber(e.value()) && a.precedence() > PREC_UNARY;
    writer.write(parens ? "(" + text + ")" : text);
  }

  @Override
  public void visit(CodeNamedArgument e, Ambient a) {
    write(e.name());
    writer.write(": ");
    write(e.value());
  }

  @Override
  public void visit(CodeThisReferenceExpression e, Ambient a) {
    writer.write("this");
  }

  @Override
  public void visit(CodeTypeReferenceExpression e, Ambient a) {
    writeType(e.type());
  }

  public void writeType(CodeTypeReference type) {
    if (type == null || type.typeName() == null) {
      writer.write("void");
    } else {
      String name = BUILTIN_TYPES.getOrDefault(type.typeName(), type.typeName());
      if (IndentingTextWriter.isKeyword(name)) writer.write(name);
      else writer.writeName(name);
    }
    if (type != null && !type.typeArguments().isEmpty()) {
      writer.write("<");
      for (int i = 0; i < type.typeArguments().size(); i++) {
        if (i > 0) writer.write(", ");
        writeType(type.typeArguments().get(i));
      }
      writer.write(">");
    }
    if (type != null) {
      for (int i = 0; i < type.arrayRank(); i++) writer.write("[]");
    }
  }

  private void writeList(List<CodeExpression> exps) {
    for (int i = 0; i < exps.size(); i++) {
      if (i > 0) writer.write(", ");
      write(exps.get(i));
    }
  }
}
