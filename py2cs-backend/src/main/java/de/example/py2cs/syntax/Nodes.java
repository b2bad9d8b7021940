package de.example.py2cs.syntax;

import de.example.py2cs.UnsupportedConstructException;

import java.util.List;

final class Nodes {
  private Nodes() {}

  static <T> List<T> copy(List<T> list) {
    if (list == null) return List.of();
    for (T element : list) {
      if (element == null) {
        throw new UnsupportedConstructException("malformed syntax tree", "list with a missing element");
      }
    }
    return List.copyOf(list);
  }

  /** Rejects a missing required component of a node. */
  static <T> T require(T value, String node, String component) {
    if (value == null) {
      throw new UnsupportedConstructException("malformed syntax tree", node + " without " + component);
    }
    return value;
  }
}
