package de.example.py2cs.translate;

import de.example.py2cs.UnsupportedConstructException;
import de.example.py2cs.syntax.Decorator;
import de.example.py2cs.syntax.Identifier;

import java.util.List;

/** What a decorator means to the translator. */
public sealed interface DecoratorKind {

  /** {@code @property} */
  record Getter() implements DecoratorKind {
  }

  /** {@code @name.setter} on a function called {@code name}. */
  record Setter(String propertyName) implements DecoratorKind {
  }

  /** Anything else; it becomes a custom attribute. */
  record Unknown(String name) implements DecoratorKind {
  }

  /**
   * @param functionName name of the decorated function, or null when the
   *     decorated statement is not a function
   */
  static DecoratorKind classify(Decorator d, String functionName) {
    List<Identifier> segs = d.className().segs();
    if (segs.size() == 1 && segs.get(0).name().equals("property")) {
      return new Getter();
    }
    if (segs.size() == 2 && segs.get(1).name().equals("setter")) {
      String property = segs.get(0).name();
      if (!property.equals(functionName)) {
        throw new UnsupportedConstructException(
            "setter decorator does not match the function it decorates",
            "@" + d.className() + " on " + functionName);
      }
      return new Setter(property);
    }
    return new Unknown(d.className().toString());
  }
}
