package de.example.py2cs.syntax;

public interface ExpressionVisitor<R> {
  R visit(Identifier n);
  R visit(AttributeAccess n);
  R visit(ArrayRef n);
  R visit(Application n);
  R visit(BinExp n);
  R visit(UnaryExp n);
  R visit(TestExp n);
  R visit(Lambda n);
  R visit(PyList n);
  R visit(PyTuple n);
  R visit(ExpList n);
  R visit(PyDictionary n);
  R visit(PySet n);
  R visit(Str n);
  R visit(Bytes n);
  R visit(IntLiteral n);
  R visit(LongLiteral n);
  R visit(BigLiteral n);
  R visit(RealLiteral n);
  R visit(NoneExp n);
  R visit(BooleanLiteral n);
  R visit(AssignExp n);
  R visit(StarExp n);
}
