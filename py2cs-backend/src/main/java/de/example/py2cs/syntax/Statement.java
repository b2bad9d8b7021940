package de.example.py2cs.syntax;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/** A Python statement. The set of kinds is closed; see {@link StatementVisitor}. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = AssertStatement.class, name = "assert"),
    @JsonSubTypes.Type(value = AsyncStatement.class, name = "async"),
    @JsonSubTypes.Type(value = BreakStatement.class, name = "break"),
    @JsonSubTypes.Type(value = ClassDef.class, name = "class"),
    @JsonSubTypes.Type(value = CommentStatement.class, name = "comment"),
    @JsonSubTypes.Type(value = ContinueStatement.class, name = "continue"),
    @JsonSubTypes.Type(value = Decorated.class, name = "decorated"),
    @JsonSubTypes.Type(value = DelStatement.class, name = "del"),
    @JsonSubTypes.Type(value = ExecStatement.class, name = "exec"),
    @JsonSubTypes.Type(value = ExpStatement.class, name = "exp"),
    @JsonSubTypes.Type(value = ForStatement.class, name = "for"),
    @JsonSubTypes.Type(value = FromStatement.class, name = "from"),
    @JsonSubTypes.Type(value = FunctionDef.class, name = "def"),
    @JsonSubTypes.Type(value = GlobalStatement.class, name = "global"),
    @JsonSubTypes.Type(value = IfStatement.class, name = "if"),
    @JsonSubTypes.Type(value = ImportStatement.class, name = "import"),
    @JsonSubTypes.Type(value = NonlocalStatement.class, name = "nonlocal"),
    @JsonSubTypes.Type(value = PassStatement.class, name = "pass"),
    @JsonSubTypes.Type(value = PrintStatement.class, name = "print"),
    @JsonSubTypes.Type(value = RaiseStatement.class, name = "raise"),
    @JsonSubTypes.Type(value = ReturnStatement.class, name = "return"),
    @JsonSubTypes.Type(value = SuiteStatement.class, name = "suite"),
    @JsonSubTypes.Type(value = TryStatement.class, name = "try"),
    @JsonSubTypes.Type(value = WhileStatement.class, name = "while"),
    @JsonSubTypes.Type(value = WithStatement.class, name = "with"),
    @JsonSubTypes.Type(value = YieldStatement.class, name = "yield")
})
public interface Statement {
  <A> void accept(StatementVisitor<A> v, A arg);
}
