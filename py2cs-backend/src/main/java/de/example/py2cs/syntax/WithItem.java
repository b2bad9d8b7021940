package de.example.py2cs.syntax;

/** {@code with context as target}; target may be absent. */
public record WithItem(Exp context, Exp target) {
  public WithItem {
    Nodes.require(context, "WithItem", "context");
  }

}
