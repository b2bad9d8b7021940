package de.example.py2cs.syntax;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

public record DottedName(List<Identifier> segs) {
  public DottedName {
    segs = Nodes.copy(segs);
  }

  public static DottedName of(String... names) {
    return new DottedName(Arrays.stream(names).map(Identifier::new).toList());
  }

  @Override
  public String toString() {
    return segs.stream().map(Identifier::name).collect(Collectors.joining("."));
  }
}
