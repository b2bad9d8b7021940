package de.example.py2cs.codemodel;

public enum MemberAttributes {
  PUBLIC("public"),
  PRIVATE("private"),
  STATIC("static"),
  OVERRIDE("override"),
  ABSTRACT("abstract");

  private final String keyword;

  MemberAttributes(String keyword) {
    this.keyword = keyword;
  }

  public String keyword() {
    return keyword;
  }
}
