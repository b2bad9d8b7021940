package de.example.py2cs.syntax;

public interface StatementVisitor<A> {
  void visit(AssertStatement n, A arg);
  void visit(AsyncStatement n, A arg);
  void visit(BreakStatement n, A arg);
  void visit(ClassDef n, A arg);
  void visit(CommentStatement n, A arg);
  void visit(ContinueStatement n, A arg);
  void visit(Decorated n, A arg);
  void visit(DelStatement n, A arg);
  void visit(ExecStatement n, A arg);
  void visit(ExpStatement n, A arg);
  void visit(ForStatement n, A arg);
  void visit(FromStatement n, A arg);
  void visit(FunctionDef n, A arg);
  void visit(GlobalStatement n, A arg);
  void visit(IfStatement n, A arg);
  void visit(ImportStatement n, A arg);
  void visit(NonlocalStatement n, A arg);
  void visit(PassStatement n, A arg);
  void visit(PrintStatement n, A arg);
  void visit(RaiseStatement n, A arg);
  void visit(ReturnStatement n, A arg);
  void visit(SuiteStatement n, A arg);
  void visit(TryStatement n, A arg);
  void visit(WhileStatement n, A arg);
  void visit(WithStatement n, A arg);
  void visit(YieldStatement n, A arg);
}
