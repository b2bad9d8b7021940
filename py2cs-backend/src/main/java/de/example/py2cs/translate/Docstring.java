package de.example.py2cs.translate;

import de.example.py2cs.codemodel.CodeCommentStatement;
import de.example.py2cs.syntax.CommentStatement;
import de.example.py2cs.syntax.ExpStatement;
import de.example.py2cs.syntax.Statement;
import de.example.py2cs.syntax.Str;

import java.util.ArrayList;
import java.util.List;

/** A body split into its leading docstring (as comments) and the remaining statements. */
public record Docstring(List<CodeCommentStatement> comments, List<Statement> statements) {

  public static Docstring split(List<Statement> body) {
    for (int i = 0; i < body.size(); i++) {
      Statement s = body.get(i);
      if (s instanceof CommentStatement) continue;
      if (s instanceof ExpStatement es && es.expression() instanceof Str str) {
        List<CodeCommentStatement> comments = new ArrayList<>();
        for (String line : str.s().split("\r\n|\r|\n", -1)) {
          comments.add(new CodeCommentStatement(" " + line));
        }
        List<Statement> rest = new ArrayList<>(body);
        rest.remove(i);
        return new Docstring(comments, rest);
      }
      break;
    }
    return new Docstring(List.of(), body);
  }
}
