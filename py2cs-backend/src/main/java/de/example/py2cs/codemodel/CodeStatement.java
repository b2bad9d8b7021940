package de.example.py2cs.codemodel;

public interface CodeStatement {

  void accept(CodeStatementVisitor v);
}
