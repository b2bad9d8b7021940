package de.example.py2cs.codemodel;

/** A free-standing comment between the members of a type. */
public final class CodeCommentMember extends CodeTypeMember {
  private final String comment;

  public CodeCommentMember(String comment) {
    super(null);
    this.comment = comment;
  }

  public String getComment() {
    return comment;
  }

  @Override
  public void accept(CodeMemberVisitor v) {
    v.visit(this);
  }
}
