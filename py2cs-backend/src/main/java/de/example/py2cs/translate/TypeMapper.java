package de.example.py2cs.translate;

import de.example.py2cs.codemodel.CodeTypeReference;
import de.example.py2cs.syntax.BigLiteral;
import de.example.py2cs.syntax.BooleanLiteral;
import de.example.py2cs.syntax.Bytes;
import de.example.py2cs.syntax.Exp;
import de.example.py2cs.syntax.Identifier;
import de.example.py2cs.syntax.IntLiteral;
import de.example.py2cs.syntax.LongLiteral;
import de.example.py2cs.syntax.Parameter;
import de.example.py2cs.syntax.RealLiteral;
import de.example.py2cs.syntax.Str;

public final class TypeMapper {

  public static final CodeTypeReference INT = CodeTypeReference.of("int");
  public static final CodeTypeReference LONG = CodeTypeReference.of("long");
  public static final CodeTypeReference DOUBLE = CodeTypeReference.of("double");
  public static final CodeTypeReference STRING = CodeTypeReference.of("string");
  public static final CodeTypeReference BOOL = CodeTypeReference.of("bool");
  public static final CodeTypeReference BIG_INTEGER = CodeTypeReference.of("BigInteger");
  public static final CodeTypeReference BYTES = CodeTypeReference.arrayOf(CodeTypeReference.of("byte"));

  public CodeTypeReference inferType(Exp e) {
    if (e instanceof IntLiteral) return INT;
    if (e instanceof LongLiteral) return LONG;
    if (e instanceof RealLiteral) return DOUBLE;
    if (e instanceof Str) return STRING;
    if (e instanceof BooleanLiteral) return BOOL;
    if (e instanceof BigLiteral) return BIG_INTEGER;
    if (e instanceof Bytes) return BYTES;
    return CodeTypeReference.OBJECT;
  }

  /** The nullable form of a value type; reference types are returned unchanged. */
  static CodeTypeReference nullable(CodeTypeReference type) {
    if (type.equals(INT) || type.equals(DOUBLE) || type.equals(BOOL)) {
      return CodeTypeReference.of(type.typeName() + "?");
    }
    return type;
  }

  public CodeTypeReference parameterType(Parameter p) {
    if (p.varArgs()) return CodeTypeReference.arrayOf(CodeTypeReference.OBJECT);
    if (p.keyArgs()) return CodeTypeReference.of("Dictionary", STRING, CodeTypeReference.OBJECT);

    if (p.annotation() instanceof Identifier id) {
      String name = id.name();
      if (name.equals("int")) return INT;
      if (name.equals("str")) return STRING;
      if (name.equals("float")) return DOUBLE;
      if (name.equals("bool")) return BOOL;
      if (name.equals("bytes")) return BYTES;
      if (name.equals("object")) return CodeTypeReference.OBJECT;
    }
    return inferType(p.defaultValue());
  }
}
