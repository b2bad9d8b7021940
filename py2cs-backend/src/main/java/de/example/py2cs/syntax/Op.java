package de.example.py2cs.syntax;

public enum Op {
  ADD, SUB, MUL, DIV, FLOOR_DIV, MOD, POW, MAT_MUL,
  SHL, SHR, BIT_AND, BIT_OR, XOR,
  AND, OR, NOT, INVERT,
  EQ, NE, LT, LE, GT, GE, IS, IS_NOT, IN, NOT_IN,
  ASSIGN,
  AUG_ADD, AUG_SUB, AUG_MUL, AUG_DIV, AUG_FLOOR_DIV, AUG_MOD, AUG_POW, AUG_MAT_MUL,
  AUG_SHL, AUG_SHR, AUG_AND, AUG_OR, AUG_XOR;

  public boolean isAugmented() {
    return name().startsWith("AUG_");
  }

  /** The binary operator behind an augmented assignment, e.g. {@code AUG_ADD -> ADD}. */
  public Op binaryOf() {
    if (!isAugmented()) return this;
    return valueOf(name().substring(4));
  }
}
