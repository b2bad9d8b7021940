package de.example.py2cs.syntax;

import java.util.List;

/**
 * {@code from a.b import c as d}. A relative import has no {@code dottedName};
 * an empty {@code aliasedNames} list stands for {@code import *}.
 */
public record FromStatement(DottedName dottedName, List<AliasedName> aliasedNames) implements Statement {
  public FromStatement {
    aliasedNames = Nodes.copy(aliasedNames);
  }

  @Override
  public <A> void accept(StatementVisitor<A> v, A arg) {
    v.visit(this, arg);
  }
}
