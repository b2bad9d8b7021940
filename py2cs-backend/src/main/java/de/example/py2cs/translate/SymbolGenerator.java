package de.example.py2cs.translate;

import de.example.py2cs.codemodel.CodeTypeReference;
import de.example.py2cs.codemodel.CodeVariableReferenceExpression;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Locals of one class or method scope, plus collision-free synthetic names. */
public final class SymbolGenerator {

  public record LocalSymbol(String name, CodeTypeReference type, boolean parameter) {
  }

  private final Map<String, LocalSymbol> symbols = new LinkedHashMap<>();
  private int counter = 0;

  /** Declares {@code name} unless it already is; returns true if it was new. */
  public boolean ensureLocalVariable(String name, CodeTypeReference type, boolean isParameter) {
    if (symbols.containsKey(name)) return false;
    symbols.put(name, new LocalSymbol(name, type, isParameter));
    return true;
  }

  public CodeVariableReferenceExpression genSymLocal(String prefix, CodeTypeReference type) {
    return genSymAutomatic(prefix, type, false);
  }

  public CodeVariableReferenceExpression genSymAutomatic(String prefix, CodeTypeReference type, boolean isParameter) {
    String name;
    do {
      name = prefix + (++counter);
    } while (symbols.containsKey(name));
    symbols.put(name, new LocalSymbol(name, type, isParameter));
    return new CodeVariableReferenceExpression(name);
  }

  public Optional<LocalSymbol> lookup(String name) {
    return Optional.ofNullable(symbols.get(name));
  }

  /** Declared symbols in declaration order. */
  public Collection<LocalSymbol> locals() {
    return Collections.unmodifiableCollection(symbols.values());
  }
}
