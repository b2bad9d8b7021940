package de.example.py2cs.codemodel;

public interface CodeMemberVisitor {

  void visit(CodeMemberField m);

  void visit(CodeMemberMethod m);

  void visit(CodeConstructor m);

  void visit(CodeMemberProperty m);

  void visit(CodeTypeDeclaration m);

  void visit(CodeCommentMember m);
}
