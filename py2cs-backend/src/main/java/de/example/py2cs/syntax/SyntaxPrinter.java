package de.example.py2cs.syntax;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders expressions back to Python-like source text. Used for fallback
 * comments in the generated code and for error messages, so it favours
 * readability over exact reproduction (no precedence-driven parentheses).
 */
public final class SyntaxPrinter implements ExpressionVisitor<String> {

  private static final SyntaxPrinter INSTANCE = new SyntaxPrinter();

  public static String print(Exp e) {
    return e == null ? "" : e.accept(INSTANCE);
  }

  public static String describe(Statement s) {
    if (s == null) return "<null>";
    if (s instanceof ExpStatement es) return print(es.expression());
    if (s instanceof FunctionDef f) return "def " + f.name().name() + "(...)";
    if (s instanceof ClassDef c) return "class " + c.name().name();
    if (s instanceof AsyncStatement a) return "async " + describe(a.statement());
    return s.getClass().getSimpleName();
  }

  @Override
  public String visit(Identifier n) {
    return n.name();
  }

  @Override
  public String visit(AttributeAccess n) {
    return print(n.expression()) + "." + n.fieldName().name();
  }

  @Override
  public String visit(ArrayRef n) {
    String subs = n.subs().stream().map(this::slice).collect(Collectors.joining(", "));
    return print(n.array()) + "[" + subs + "]";
  }

  private String slice(Slice s) {
    if (!s.range()) return print(s.lower());
    String out = print(s.lower()) + ":" + print(s.upper());
    return s.step() == null ? out : out + ":" + print(s.step());
  }

  @Override
  public String visit(Application n) {
    return print(n.function()) + "(" + args(n.args()) + ")";
  }

  static String args(List<Argument> args) {
    return args.stream()
        .map(a -> a.name() == null ? print(a.value()) : a.name().name() + "=" + print(a.value()))
        .collect(Collectors.joining(", "));
  }

  @Override
  public String visit(BinExp n) {
    return print(n.left()) + " " + opText(n.op()) + " " + print(n.right());
  }

  @Override
  public String visit(UnaryExp n) {
    String op = opText(n.op());
    return n.op() == Op.NOT ? op + " " + print(n.expression()) : op + print(n.expression());
  }

  @Override
  public String visit(TestExp n) {
    return print(n.consequent()) + " if " + print(n.condition()) + " else " + print(n.alternative());
  }

  @Override
  public String visit(Lambda n) {
    String ps = n.parameters().stream().map(p -> p.id().name()).collect(Collectors.joining(", "));
    return "lambda " + ps + ": " + print(n.body());
  }

  @Override
  public String visit(PyList n) {
    return "[" + join(n.elements()) + "]";
  }

  @Override
  public String visit(PyTuple n) {
    if (n.values().size() == 1) return "(" + print(n.values().get(0)) + ",)";
    return "(" + join(n.values()) + ")";
  }

  @Override
  public String visit(ExpList n) {
    return join(n.expressions());
  }

  @Override
  public String visit(PyDictionary n) {
    return "{" + n.items().stream()
        .map(kv -> print(kv.key()) + ": " + print(kv.value()))
        .collect(Collectors.joining(", ")) + "}";
  }

  @Override
  public String visit(PySet n) {
    return "{" + join(n.elements()) + "}";
  }

  @Override
  public String visit(Str n) {
    String q = n.longForm() ? "\"\"\"" : "\"";
    return (n.raw() ? "r" : "") + q + n.s() + q;
  }

  @Override
  public String visit(Bytes n) {
    return "b\"" + n.s() + "\"";
  }

  @Override
  public String visit(IntLiteral n) {
    return Integer.toString(n.value());
  }

  @Override
  public String visit(LongLiteral n) {
    return Long.toString(n.value());
  }

  @Override
  public String visit(BigLiteral n) {
    return n.value().toString();
  }

  @Override
  public String visit(RealLiteral n) {
    return Double.toString(n.value());
  }

  @Override
  public String visit(NoneExp n) {
    return "None";
  }

  @Override
  public String visit(BooleanLiteral n) {
    return n.value() ? "True" : "False";
  }

  @Override
  public String visit(AssignExp n) {
    return print(n.dst()) + " " + opText(n.op()) + " " + print(n.src());
  }

  @Override
  public String visit(StarExp n) {
    return "*" + print(n.expression());
  }

  private String join(List<Exp> exps) {
    return exps.stream().map(SyntaxPrinter::print).collect(Collectors.joining(", "));
  }

  static String opText(Op op) {
    return switch (op) {
      case ADD -> "+";
      case SUB -> "-";
      case MUL -> "*";
      case DIV -> "/";
      case FLOOR_DIV -> "//";
      case MOD -> "%";
      case POW -> "**";
      case MAT_MUL -> "@";
      case SHL -> "<<";
      case SHR -> ">>";
      case BIT_AND -> "&";
      case BIT_OR -> "|";
      case XOR -> "^";
      case AND -> "and";
      case OR -> "or";
      case NOT -> "not";
      case INVERT -> "~";
      case EQ -> "==";
      case NE -> "!=";
      case LT -> "<";
      case LE -> "<=";
      case GT -> ">";
      case GE -> ">=";
      case IS -> "is";
      case IS_NOT -> "is not";
      case IN -> "in";
      case NOT_IN -> "not in";
      case ASSIGN -> "=";
      default -> opText(op.binaryOf()) + "=";
    };
  }
}
