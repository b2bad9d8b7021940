package de.example.py2cs.syntax;

/**
 * One subscript of an {@link ArrayRef}. A plain index only has {@code lower};
 * {@code range} is set for {@code lower:upper:step} forms.
 */
public record Slice(Exp lower, Exp upper, Exp step, boolean range) {

  public static Slice index(Exp index) {
    return new Slice(index, null, null, false);
  }
}
