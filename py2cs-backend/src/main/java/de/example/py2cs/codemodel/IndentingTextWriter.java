package de.example.py2cs.codemodel;

import java.util.Set;

public final class IndentingTextWriter {
  private static final Set<String> KEYWORDS = Set.of(
      "abstract", "as", "base", "bool", "break", "byte", "case", "catch", "char", "checked",
      "class", "const", "continue", "decimal", "default", "delegate", "do", "double", "else",
      "enum", "event", "explicit", "extern", "false", "finally", "fixed", "float", "for",
      "foreach", "goto", "if", "implicit", "in", "int", "interface", "internal", "is", "lock",
      "long", "namespace", "new", "null", "object", "operator", "out", "override", "params",
      "private", "protected", "public", "readonly", "ref", "return", "sbyte", "sealed", "short",
      "sizeof", "stackalloc", "static", "string", "struct", "switch", "this", "throw", "true",
      "try", "typeof", "uint", "ulong", "unchecked", "unsafe", "ushort", "using", "virtual",
      "void", "volatile", "while");

  /** Position in the output, used to roll back a node that failed half way. */
  public record Mark(int length, boolean atLineStart) {
  }

  private final StringBuilder sb = new StringBuilder();
  private final String indentUnit;
  private int indent = 0;
  private boolean atLineStart = true;

  public IndentingTextWriter() {
    this(4);
  }

  public IndentingTextWriter(int indentWidth) {
    if (indentWidth < 0) throw new IllegalArgumentException("indentWidth must be >= 0");
    this.indentUnit = " ".repeat(indentWidth);
  }

  public void indent(Runnable r) {
    indent++;
    try { r.run(); }
    finally { indent--; }
  }

  public void write(String s) {
    if (s.isEmpty()) return;
    if (atLineStart) {
      sb.append(indentUnit.repeat(indent));
      atLineStart = false;
    }
    sb.append(s);
  }

  /** Writes a possibly dotted name, escaping every segment that is a keyword. */
  public void writeName(String name) {
    write(escapeName(name));
  }

  public void writeLine(String s) {
    write(s);
    writeLine();
  }

  public void writeLine() {
    sb.append('\n');
    atLineStart = true;
  }

  public Mark mark() {
    return new Mark(sb.length(), atLineStart);
  }

  public void reset(Mark mark) {
    sb.setLength(mark.length());
    atLineStart = mark.atLineStart();
  }

  public static boolean isKeyword(String name) {
    return KEYWORDS.contains(name);
  }

  public static String escapeName(String name) {
    if (name.indexOf('.') < 0) return isKeyword(name) ? "@" + name : name;
    StringBuilder out = new StringBuilder();
    String[] segs = name.split("\\.", -1);
    for (int i = 0; i < segs.length; i++) {
      String seg = segs[i];
      if (i > 0) out.append('.');
      out.append(isKeyword(seg) ? "@" + seg : seg);
    }
    return out.toString();
  }

  @Override
  public String toString() {
    return sb.toString();
  }
}
