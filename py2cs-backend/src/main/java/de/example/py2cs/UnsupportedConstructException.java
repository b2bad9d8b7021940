package de.example.py2cs;

/**
 * A construct with no lowering or rendering rule, or a source tree that breaks
 * a structural invariant. Aborts the translation unit it occurs in.
 */
public class UnsupportedConstructException extends TranslationException {

  private final String nodeDescription;

  public UnsupportedConstructException(String message, String nodeDescription) {
    super(nodeDescription == null ? message : message + ": " + nodeDescription);
    this.nodeDescription = nodeDescription;
  }

  public UnsupportedConstructException(String message) {
    this(message, null);
  }

  public String getNodeDescription() {
    return nodeDescription;
  }
}
