package de.example.py2cs.codemodel;

import de.example.py2cs.UnsupportedConstructException;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Literal text for C#. Every method builds the complete literal before
 * returning, so a failure never leaves half a literal in the output.
 */
public final class CSharpLiterals {

  private CSharpLiterals() {
  }

  public static String format(Object value) {
    if (value == null) return "null";
    if (value instanceof String s) return quote(s);
    if (value instanceof Boolean b) return b ? "true" : "false";
    if (value instanceof Integer i) return i.toString();
    if (value instanceof Long l) return l + "L";
    if (value instanceof Double d) return formatDouble(d);
    if (value instanceof BigInteger big) return "new BigInteger(" + big + ")";
    if (value instanceof CodeStringLiteral str) return formatString(str);
    if (value instanceof CodeByteLiteral bytes) return formatBytes(bytes.text());
    throw new UnsupportedConstructException("no literal form for value",
        value.getClass().getSimpleName() + " " + value);
  }

  /** True for numeric values whose text starts with a minus sign. */
  static boolean isNegativeNumber(Object value) {
    if (value instanceof Integer i) return i < 0;
    if (value instanceof Long l) return l < 0;
    if (value instanceof Double d) return d < 0 && !d.isInfinite();
    return false;
  }

  /** A plain Java string as a regular C# string literal. */
  public static String quote(String s) {
    StringBuilder sb = new StringBuilder("\"");
    for (int i = 0; i < s.length(); i++) {
      char ch = s.charAt(i);
      switch (ch) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        case '\0' -> sb.append("\\0");
        default -> sb.append(ch);
      }
    }
    return sb.append('"').toString();
  }

  public static String formatDouble(double d) {
    if (Double.isNaN(d)) return "double.NaN";
    if (Double.isInfinite(d)) return d > 0 ? "double.PositiveInfinity" : "double.NegativeInfinity";
    double abs = Math.abs(d);
    String s = d == 0 || (abs >= 1e-5 && abs < 1e16)
        ? BigDecimal.valueOf(d).stripTrailingZeros().toPlainString()
        : Double.toString(d);
    if (s.indexOf('.') < 0 && s.indexOf('e') < 0 && s.indexOf('E') < 0) s += ".0";
    return s;
  }

  static String formatString(CodeStringLiteral lit) {
    String s = lit.text();
    boolean verbatim = lit.raw() || lit.longForm();
    StringBuilder sb = new StringBuilder(verbatim ? "@\"" : "\"");
    int i = 0;
    while (i < s.length()) {
      char ch = s.charAt(i);
      if (ch == '"') {
        sb.append(verbatim ? "\"\"" : "\\\"");
        ++i;
      } else if (ch != '\\' || lit.raw()) {
        sb.append(ch);
        ++i;
      } else if (i + 1 >= s.length()) {
        throw new UnsupportedConstructException("string literal ends in a lone backslash", s);
      } else if (lit.longForm()) {
        i = longFormEscape(s, i, sb);
      } else {
        i = escape(s, i, sb);
      }
    }
    return sb.append('"').toString();
  }

  /**
   * Translates the escape sequence starting at the backslash {@code s[i]} into
   * regular-string form and returns the index just past it.
   */
  private static int escape(String s, int i, StringBuilder sb) {
    char c = s.charAt(i + 1);
    switch (c) {
      case '\\', '\'', '"', 'a', 'b', 'f', 'n', 'r', 't', 'v' -> {
        sb.append('\\').append(c);
        return i + 2;
      }
      case '\n' -> {
        return i + 2;
      }
      case '\r' -> {
        return i + 2 < s.length() && s.charAt(i + 2) == '\n' ? i + 3 : i + 2;
      }
      case 'x' -> {
        int end = hexEnd(s, i + 2, 2);
        if (end != i + 4) throw new UnsupportedConstructException("truncated \\x escape", s);
        sb.append("\\u00").append(s, i + 2, end);
        return end;
      }
      case 'u' -> {
        int end = hexEnd(s, i + 2, 4);
        if (end != i + 6) throw new UnsupportedConstructException("truncated \\u escape", s);
        sb.append(s, i, end);
        return end;
      }
      case 'U' -> {
        int end = hexEnd(s, i + 2, 8);
        if (end != i + 10) throw new UnsupportedConstructException("truncated \\U escape", s);
        sb.append(s, i, end);
        return end;
      }
      case 'N' -> throw new UnsupportedConstructException("named unicode escapes are not supported", s);
      default -> {
        if (c >= '0' && c <= '7') {
          int end = i + 1;
          int value = 0;
          while (end < s.length() && end < i + 4 && s.charAt(end) >= '0' && s.charAt(end) <= '7') {
            value = value * 8 + (s.charAt(end) - '0');
            ++end;
          }
          sb.append(String.format("\\u%04x", value));
          return end;
        }
        // unknown escapes keep their backslash
        sb.append("\\\\").append(c);
        return i + 2;
      }
    }
  }

  private static int longFormEscape(String s, int i, StringBuilder sb) {
    char c = s.charAt(i + 1);
    switch (c) {
      case '"' -> {
        sb.append("\"\"");
        return i + 2;
      }
      case '\\', '\'' -> {
        sb.append(c);
        return i + 2;
      }
      case '\n' -> {
        return i + 2;
      }
      case '\r' -> {
        return i + 2 < s.length() && s.charAt(i + 2) == '\n' ? i + 3 : i + 2;
      }
      case 'u', 'U', 'N' -> throw new UnsupportedConstructException(
          "unicode escapes in triple-quoted strings are not supported", s);
      default -> {
        if (c == 'x' || "abfnrtv".indexOf(c) >= 0 || (c >= '0' && c <= '7')) {
          StringBuilder esc = new StringBuilder();
          int end = escape(s, i, esc);
          sb.append("\" + \"").append(esc).append("\" + @\"");
          return end;
        }
        sb.append('\\').append(c);
        return i + 2;
      }
    }
  }

  private static int hexEnd(String s, int from, int max) {
    int end = from;
    while (end < s.length() && end < from + max && Character.digit(s.charAt(end), 16) >= 0) ++end;
    return end;
  }

  static String formatBytes(String s) {
    if (s.isEmpty()) return "new byte[0]";
    StringBuilder sb = new StringBuilder("new byte[] { ");
    boolean first = true;
    int i = 0;
    while (i < s.length()) {
      if (!first) sb.append(", ");
      first = false;
      char ch = s.charAt(i);
      if (ch != '\\') {
        sb.append(byteChar(ch, s));
        ++i;
        continue;
      }
      if (i + 1 >= s.length()) throw new UnsupportedConstructException("bytes literal ends in a lone backslash", s);
      char c = s.charAt(i + 1);
      switch (c) {
        case 'x' -> {
          int end = hexEnd(s, i + 2, 2);
          if (end != i + 4) throw new UnsupportedConstructException("truncated \\x escape", s);
          sb.append("0x").append(s, i + 2, end);
          i = end;
        }
        case '0', '1', '2', '3', '4', '5', '6', '7' -> {
          int end = i + 1;
          int value = 0;
          while (end < s.length() && end < i + 4 && s.charAt(end) >= '0' && s.charAt(end) <= '7') {
            value = value * 8 + (s.charAt(end) - '0');
            ++end;
          }
          if (value > 0xFF) throw new UnsupportedConstructException("octal escape out of byte range", s.substring(i, end));
          sb.append(String.format("0x%02X", value));
          i = end;
        }
        case '\\' -> {
          sb.append("(byte)'\\\\'");
          i += 2;
        }
        case 'n' -> {
          sb.append("(byte)'\\n'");
          i += 2;
        }
        case 'r' -> {
          sb.append("(byte)'\\r'");
          i += 2;
        }
        case 't' -> {
          sb.append("(byte)'\\t'");
          i += 2;
        }
        case '\'' -> {
          sb.append("(byte)'\\''");
          i += 2;
        }
        case '"' -> {
          sb.append("(byte)'\"'");
          i += 2;
        }
        default -> throw new UnsupportedConstructException("unrecognized escape in bytes literal", "\\" + c);
      }
    }
    return sb.append(" }").toString();
  }

  private static String byteChar(char ch, String s) {
    if (ch > 0xFF) throw new UnsupportedConstructException("non-byte character in bytes literal", s);
    if (ch == '\'') return "(byte)'\\''";
    if (ch >= 0x20 && ch < 0x7F) return "(byte)'" + ch + "'";
    return String.format("0x%02X", (int) ch);
  }
}
