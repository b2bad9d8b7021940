package de.example.py2cs.codemodel;

public enum CodeOperatorType {
  COMPLEMENT,
  NOT,
  NEGATE,
  UNARY_PLUS,

  MUL,
  DIV,
  FLOORING_DIV,
  MOD,
  ADD,
  SUB,
  SHL,
  SHR,
  LT,
  GT,
  LE,
  GE,
  EQUAL,
  NOT_EQUAL,
  IDENTITY_EQUALITY,
  IDENTITY_INEQUALITY,
  IS,
  BIT_AND,
  BIT_XOR,
  BIT_OR,
  LOG_AND,
  LOG_OR,
  CONDITIONAL,

  ASSIGN,
  ADD_EQ,
  SUB_EQ,
  MUL_EQ,
  DIV_EQ,
  FLOORING_DIV_EQ,
  MOD_EQ,
  AND_EQ,
  OR_EQ,
  XOR_EQ,
  SHL_EQ,
  SHR_EQ
}
