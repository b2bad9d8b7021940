package de.example.py2cs.syntax;

import java.util.Arrays;
import java.util.List;

/** Terse constructors for syntax trees in tests. */
public final class Trees {

  private Trees() {
  }

  public static Module module(String name, Statement... statements) {
    return new Module(name, List.of(statements));
  }

  public static Identifier id(String name) {
    return new Identifier(name);
  }

  public static IntLiteral num(int value) {
    return new IntLiteral(value);
  }

  public static Str str(String s) {
    return new Str(s, false, false);
  }

  public static AttributeAccess attr(Exp target, String field) {
    return new AttributeAccess(target, id(field));
  }

  public static BinExp bin(Op op, Exp left, Exp right) {
    return new BinExp(op, left, right);
  }

  public static Application call(Exp function, Exp... args) {
    return new Application(function, Arrays.stream(args).map(Argument::of).toList());
  }

  public static ExpStatement exp(Exp e) {
    return new ExpStatement(e);
  }

  public static ExpStatement assign(Exp dst, Exp src) {
    return new ExpStatement(new AssignExp(dst, Op.ASSIGN, src));
  }

  public static ExpStatement augAssign(Exp dst, Op op, Exp src) {
    return new ExpStatement(new AssignExp(dst, op, src));
  }

  public static ExpList tuple(Exp... values) {
    return new ExpList(List.of(values));
  }

  public static ReturnStatement ret(Exp e) {
    return new ReturnStatement(e);
  }

  public static List<Parameter> params(String... names) {
    return Arrays.stream(names).map(Parameter::of).toList();
  }

  public static FunctionDef def(String name, List<Parameter> parameters, Statement... body) {
    return new FunctionDef(id(name), parameters, List.of(body), null);
  }

  public static ClassDef classDef(String name, Statement... body) {
    return new ClassDef(id(name), List.of(), List.of(body));
  }

  public static Decorated decorated(Statement target, String... decoratorNames) {
    List<Decorator> decorators = Arrays.stream(decoratorNames)
        .map(n -> new Decorator(DottedName.of(n.split("\\.")), List.of()))
        .toList();
    return new Decorated(decorators, target);
  }

  public static IfStatement ifStmt(Exp test, List<Statement> then, List<Statement> orElse) {
    return new IfStatement(test, then, orElse);
  }

  public static PrintStatement print(Exp... args) {
    return new PrintStatement(null, Arrays.stream(args).map(Argument::of).toList());
  }
}
