package de.example.py2cs.codemodel;

import de.example.py2cs.UnsupportedConstructException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CSharpExpressionWriterTest {

  private static CodeVariableReferenceExpression v(String name) {
    return new CodeVariableReferenceExpression(name);
  }

  private static CodePrimitiveExpression lit(Object value) {
    return new CodePrimitiveExpression(value);
  }

  private static CodeBinaryOperatorExpression bin(CodeExpression l, CodeOperatorType op, CodeExpression r) {
    return new CodeBinaryOperatorExpression(l, op, r);
  }

  private static CodeUnaryOperatorExpression un(CodeOperatorType op, CodeExpression e) {
    return new CodeUnaryOperatorExpression(op, e);
  }

  private static CodeApplicationExpression call(CodeExpression target, String method, CodeExpression... args) {
    return new CodeApplicationExpression(new CodeMethodReferenceExpression(target, method), List.of(args));
  }

  private static String render(CodeExpression e) {
    IndentingTextWriter out = new IndentingTextWriter();
    new CSharpExpressionWriter(out).write(e);
    return out.toString();
  }

  @Test
  void leftAssociativeOperatorsKeepGrouping() {
    assertThat(render(bin(bin(v("a"), CodeOperatorType.SUB, v("b")), CodeOperatorType.SUB, v("c"))))
        .isEqualTo("a - b - c");
    assertThat(render(bin(v("a"), CodeOperatorType.SUB, bin(v("b"), CodeOperatorType.SUB, v("c")))))
        .isEqualTo("a - (b - c)");
  }

  @Test
  void lowerPrecedenceOperandIsParenthesized() {
    assertThat(render(bin(v("a"), CodeOperatorType.MUL, bin(v("b"), CodeOperatorType.ADD, v("c")))))
        .isEqualTo("a * (b + c)");
    assertThat(render(bin(v("a"), CodeOperatorType.ADD, bin(v("b"), CodeOperatorType.MUL, v("c")))))
        .isEqualTo("a + b * c");
    assertThat(render(bin(bin(v("a"), CodeOperatorType.LOG_OR, v("b")), CodeOperatorType.LOG_AND, v("c"))))
        .isEqualTo("(a || b) && c");
  }

  @Test
  void assignmentGroupsToTheRight() {
    assertThat(render(bin(v("a"), CodeOperatorType.ASSIGN, bin(v("b"), CodeOperatorType.ASSIGN, v("c")))))
        .isEqualTo("a = b = c");
    assertThat(render(bin(bin(v("a"), CodeOperatorType.ASSIGN, v("b")), CodeOperatorType.ADD_EQ, v("c"))))
        .isEqualTo("(a = b) += c");
  }

  @Test
  void typeTestSharesEqualityLevel() {
    assertThat(render(bin(bin(v("a"), CodeOperatorType.IS, v("b")), CodeOperatorType.EQUAL, v("c"))))
        .isEqualTo("a is b == c");
    assertThat(render(bin(v("a"), CodeOperatorType.EQUAL, bin(v("b"), CodeOperatorType.IS, v("c")))))
        .isEqualTo("a == (b is c)");
    assertThat(render(bin(bin(v("a"), CodeOperatorType.LT, v("b")), CodeOperatorType.IS, v("c"))))
        .isEqualTo("a < b is c");
    assertThat(render(bin(v("a"), CodeOperatorType.IS, bin(v("b"), CodeOperatorType.BIT_AND, v("c")))))
        .isEqualTo("a is (b & c)");
  }

  @Test
  void adjacentSignsAreSeparated() {
    assertThat(render(un(CodeOperatorType.NEGATE, un(CodeOperatorType.NEGATE, v("x"))))).isEqualTo("- -x");
    assertThat(render(un(CodeOperatorType.UNARY_PLUS, un(CodeOperatorType.UNARY_PLUS, v("x"))))).isEqualTo("+ +x");
    assertThat(render(un(CodeOperatorType.NEGATE, lit(-1)))).isEqualTo("- -1");
    assertThat(render(un(CodeOperatorType.NEGATE, un(CodeOperatorType.NOT, v("x"))))).isEqualTo("-!x");
  }

  @Test
  void negativeLiteralIsParenthesizedAsPostfixTarget() {
    assertThat(render(call(lit(-1), "ToString"))).isEqualTo("(-1).ToString()");
    assertThat(render(bin(v("a"), CodeOperatorType.SUB, lit(-2)))).isEqualTo("a - -2");
  }

  @Test
  void conditionalNesting() {
    CodeConditionExpression inner = new CodeConditionExpression(v("a"), v("b"), v("c"));
    assertThat(render(new CodeConditionExpression(inner, v("d"), v("e")))).isEqualTo("(a ? b : c) ? d : e");
    assertThat(render(new CodeConditionExpression(v("d"), v("e"), inner))).isEqualTo("d ? e : a ? b : c");
    assertThat(render(bin(inner, CodeOperatorType.ADD, v("x")))).isEqualTo("(a ? b : c) + x");
  }

  @Test
  void lambdas() {
    CodeLambdaExpression one = CodeLambdaExpression.of(List.of(v("x")), bin(v("x"), CodeOperatorType.ADD, lit(1)));
    CodeLambdaExpression two = CodeLambdaExpression.of(List.of(v("x"), v("y")), v("x"));
    assertThat(render(call(null, "Map", one))).isEqualTo("Map(x => x + 1)");
    assertThat(render(two)).isEqualTo("(x, y) => x");
    assertThat(render(bin(two, CodeOperatorType.LOG_OR, v("z")))).isEqualTo("((x, y) => x) || z");
  }

  @Test
  void statementLambdaWritesABlock() {
    CodeLambdaExpression l = new CodeLambdaExpression(List.of(), null,
        List.of(new CodeMethodReturnStatement(lit(1))));
    assertThat(render(l)).isEqualTo("() => {\n    return 1;\n}");
  }

  @Test
  void keywordNamesAreEscaped() {
    assertThat(render(v("class"))).isEqualTo("@class");
    assertThat(render(v("a.params.b"))).isEqualTo("a.@params.b");
    assertThat(render(new CodeFieldReferenceExpression(new CodeThisReferenceExpression(), "event"))).isEqualTo("this.@event");
  }

  @Test
  void numericLiterals() {
    assertThat(render(lit(42))).isEqualTo("42");
    assertThat(render(lit(5L))).isEqualTo("5L");
    assertThat(render(lit(1.0))).isEqualTo("1.0");
    assertThat(render(lit(100.0))).isEqualTo("100.0");
    assertThat(render(lit(0.5))).isEqualTo("0.5");
    assertThat(render(lit(0.0))).isEqualTo("0.0");
    assertThat(render(lit(1e20))).isEqualTo("1.0E20");
    assertThat(render(lit(1e-7))).isEqualTo("1.0E-7");
    assertThat(render(lit(Double.NaN))).isEqualTo("double.NaN");
    assertThat(render(lit(Double.NEGATIVE_INFINITY))).isEqualTo("double.NegativeInfinity");
    assertThat(render(lit(new BigInteger("123456789012345678901234567890"))))
        .isEqualTo("new BigInteger(123456789012345678901234567890)");
  }

  @Test
  void otherLiterals() {
    assertThat(render(lit(null))).isEqualTo("null");
    assertThat(render(lit(true))).isEqualTo("true");
    assertThat(render(lit("a\"b\n"))).isEqualTo("\"a\\\"b\\n\"");
  }

  @Test
  void stringLiteralEscapes() {
    assertThat(render(lit(new CodeStringLiteral("a\\nb", false, false)))).isEqualTo("\"a\\nb\"");
    assertThat(render(lit(new CodeStringLiteral("\\x41", false, false)))).isEqualTo("\"\\u0041\"");
    assertThat(render(lit(new CodeStringLiteral("\\101", false, false)))).isEqualTo("\"\\u0041\"");
    assertThat(render(lit(new CodeStringLiteral("\\d", false, false)))).isEqualTo("\"\\\\d\"");
    assertThat(render(lit(new CodeStringLiteral("a\\\nb", false, false)))).isEqualTo("\"ab\"");
  }

  @Test
  void rawAndLongStringsAreVerbatim() {
    assertThat(render(lit(new CodeStringLiteral("a\\d", true, false)))).isEqualTo("@\"a\\d\"");
    assertThat(render(lit(new CodeStringLiteral("say \"hi\"", true, false)))).isEqualTo("@\"say \"\"hi\"\"\"");
    assertThat(render(lit(new CodeStringLiteral("a\\nb", false, true)))).isEqualTo("@\"a\" + \"\\n\" + @\"b\"");
    assertThat(render(lit(new CodeStringLiteral("he said \"no\"\nbye", false, true))))
        .isEqualTo("@\"he said \"\"no\"\"\nbye\"");
  }

  @Test
  void namedUnicodeEscapeIsUnsupported() {
    assertThatThrownBy(() -> render(lit(new CodeStringLiteral("\\N{DASH}", false, false))))
        .isInstanceOf(UnsupportedConstructException.class);
    assertThatThrownBy(() -> render(lit(new CodeStringLiteral("\\u0041", false, true))))
        .isInstanceOf(UnsupportedConstructException.class);
  }

  @Test
  void byteLiterals() {
    assertThat(render(lit(new CodeByteLiteral("")))).isEqualTo("new byte[0]");
    assertThat(render(lit(new CodeByteLiteral("ab")))).isEqualTo("new byte[] { (byte)'a', (byte)'b' }");
    assertThat(render(lit(new CodeByteLiteral("\\x7f\\0\\n"))))
        .isEqualTo("new byte[] { 0x7f, 0x00, (byte)'\\n' }");
    assertThatThrownBy(() -> render(lit(new CodeByteLiteral("\\q"))))
        .isInstanceOf(UnsupportedConstructException.class);
  }

  @Test
  void octalByteEscapesAreOneByteEach() {
    assertThat(render(lit(new CodeByteLiteral("\\012")))).isEqualTo("new byte[] { 0x0A }");
    assertThat(render(lit(new CodeByteLiteral("\\1")))).isEqualTo("new byte[] { 0x01 }");
    assertThat(render(lit(new CodeByteLiteral("\\3779")))).isEqualTo("new byte[] { 0xFF, (byte)'9' }");
    assertThatThrownBy(() -> render(lit(new CodeByteLiteral("\\400"))))
        .isInstanceOf(UnsupportedConstructException.class);
  }

  @Test
  void objectAndArrayCreation() {
    CodeTypeReference list = CodeTypeReference.of("List", CodeTypeReference.OBJECT);
    assertThat(render(new CodeObjectCreateExpression(list, List.of(), List.of(), null)))
        .isEqualTo("new List<object>()");
    assertThat(render(new CodeObjectCreateExpression(list, List.of(), List.of(lit(1), lit(2)), null)))
        .isEqualTo("new List<object> {\n    1,\n    2\n}");
    assertThat(render(new CodeArrayCreateExpression(CodeTypeReference.OBJECT, List.of())))
        .isEqualTo("new object[0]");
    assertThat(render(new CodeArrayCreateExpression(CodeTypeReference.OBJECT, List.of(lit(1), v("x")))))
        .isEqualTo("new object[] { 1, x }");
  }

  @Test
  void typesUseBuiltinNames() {
    IndentingTextWriter out = new IndentingTextWriter();
    CSharpExpressionWriter w = new CSharpExpressionWriter(out);
    w.writeType(CodeTypeReference.of("Dictionary", CodeTypeReference.of("System.String"), CodeTypeReference.OBJECT));
    out.write(" ");
    w.writeType(CodeTypeReference.arrayOf(CodeTypeReference.of("byte")));
    assertThat(out.toString()).isEqualTo("Dictionary<string, object> byte[]");
  }

  @Test
  void failedNodeLeavesNoOutput() {
    IndentingTextWriter out = new IndentingTextWriter();
    out.write("x = ");
    CSharpExpressionWriter w = new CSharpExpressionWriter(out);
    CodeExpression broken = call(v("f"), "Apply", v("a"), lit(new Object()));
    assertThatThrownBy(() -> w.write(broken)).isInstanceOf(UnsupportedConstructException.class);
    assertThat(out.toString()).isEqualTo("x = ");
  }

  @Test
  void operatorsWithoutTextAreRejected() {
    assertThatThrownBy(() -> render(bin(v("a"), CodeOperatorType.CONDITIONAL, v("b"))))
        .isInstanceOf(UnsupportedConstructException.class)
        .hasMessageContaining("CONDITIONAL");
    assertThatThrownBy(() -> render(un(CodeOperatorType.ADD, v("a"))))
        .isInstanceOf(UnsupportedConstructException.class);
    assertThatThrownBy(() -> render(bin(v("a"), CodeOperatorType.NOT, v("b"))))
        .isInstanceOf(UnsupportedConstructException.class);
  }
}
