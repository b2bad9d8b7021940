package de.example.py2cs;

/** Outcome of one module in a batch: either {@code output} or {@code error} is set. */
public record TranslationResult(String name, String output, String error) {

  public static TranslationResult success(String name, String output) {
    return new TranslationResult(name, output, null);
  }

  public static TranslationResult failure(String name, String error) {
    return new TranslationResult(name, null, error);
  }

  public boolean isSuccess() {
    return error == null;
  }
}
