package de.example.py2cs.syntax;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/** A Python expression. The set of kinds is closed; see {@link ExpressionVisitor}. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Identifier.class, name = "id"),
    @JsonSubTypes.Type(value = AttributeAccess.class, name = "attr"),
    @JsonSubTypes.Type(value = ArrayRef.class, name = "subscript"),
    @JsonSubTypes.Type(value = Application.class, name = "call"),
    @JsonSubTypes.Type(value = BinExp.class, name = "bin"),
    @JsonSubTypes.Type(value = UnaryExp.class, name = "unary"),
    @JsonSubTypes.Type(value = TestExp.class, name = "test"),
    @JsonSubTypes.Type(value = Lambda.class, name = "lambda"),
    @JsonSubTypes.Type(value = PyList.class, name = "list"),
    @JsonSubTypes.Type(value = PyTuple.class, name = "tuple"),
    @JsonSubTypes.Type(value = ExpList.class, name = "explist"),
    @JsonSubTypes.Type(value = PyDictionary.class, name = "dict"),
    @JsonSubTypes.Type(value = PySet.class, name = "set"),
    @JsonSubTypes.Type(value = Str.class, name = "str"),
    @JsonSubTypes.Type(value = Bytes.class, name = "bytes"),
    @JsonSubTypes.Type(value = IntLiteral.class, name = "int"),
    @JsonSubTypes.Type(value = LongLiteral.class, name = "long"),
    @JsonSubTypes.Type(value = BigLiteral.class, name = "bigint"),
    @JsonSubTypes.Type(value = RealLiteral.class, name = "real"),
    @JsonSubTypes.Type(value = NoneExp.class, name = "none"),
    @JsonSubTypes.Type(value = BooleanLiteral.class, name = "bool"),
    @JsonSubTypes.Type(value = AssignExp.class, name = "assign"),
    @JsonSubTypes.Type(value = StarExp.class, name = "star")
})
public interface Exp {
  <R> R accept(ExpressionVisitor<R> v);
}
