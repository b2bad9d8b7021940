package de.example.py2cs.syntax;

public record AliasedName(DottedName orig, Identifier alias) {
  public AliasedName {
    Nodes.require(orig, "AliasedName", "orig");
  }

}
