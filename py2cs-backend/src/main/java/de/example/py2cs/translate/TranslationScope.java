package de.example.py2cs.translate;

import de.example.py2cs.codemodel.CodeAttributeDeclaration;
import de.example.py2cs.codemodel.CodeConstructor;
import de.example.py2cs.syntax.ClassDef;
import de.example.py2cs.syntax.Decorated;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-scope translation state. A new instance is created for every module,
 * class and function body, so nothing leaks between translations.
 */
public final class TranslationScope {
  private final ClassDef currentClass;
  private final Map<Decorated, PropertyDefinition> properties;
  private final Set<String> globals = new LinkedHashSet<>();
  private final SymbolGenerator symbols;
  private List<CodeAttributeDeclaration> pendingAttributes = List.of();
  private CodeConstructor classConstructor;

  private TranslationScope(ClassDef currentClass, Map<Decorated, PropertyDefinition> properties, SymbolGenerator symbols) {
    this.currentClass = currentClass;
    this.properties = properties;
    this.symbols = symbols;
  }

  public static TranslationScope forModule() {
    return new TranslationScope(null, Map.of(), new SymbolGenerator());
  }

  public static TranslationScope forClass(ClassDef currentClass, Map<Decorated, PropertyDefinition> properties) {
    Map<Decorated, PropertyDefinition> byIdentity = new IdentityHashMap<>(properties);
    return new TranslationScope(currentClass, Collections.unmodifiableMap(byIdentity), new SymbolGenerator());
  }

  /** Scope of a function body inside {@code currentClass} (null at module level). */
  public static TranslationScope forBody(ClassDef currentClass, SymbolGenerator symbols) {
    return new TranslationScope(currentClass, Map.of(), symbols);
  }

  public ClassDef currentClass() {
    return currentClass;
  }

  public PropertyDefinition property(Decorated d) {
    return properties.get(d);
  }

  public SymbolGenerator symbols() {
    return symbols;
  }

  public Set<String> globals() {
    return Collections.unmodifiableSet(globals);
  }

  void addGlobal(String name) {
    globals.add(name);
  }

  void setPendingAttributes(List<CodeAttributeDeclaration> attributes) {
    pendingAttributes = List.copyOf(attributes);
  }

  /** Returns the custom attributes waiting for the next declaration and clears them. */
  List<CodeAttributeDeclaration> takePendingAttributes() {
    List<CodeAttributeDeclaration> attrs = pendingAttributes;
    pendingAttributes = List.of();
    return attrs;
  }

  public Optional<CodeConstructor> classConstructor() {
    return Optional.ofNullable(classConstructor);
  }

  CodeConstructor ensureClassConstructor(CodeGenerator gen) {
    if (classConstructor == null) classConstructor = gen.staticConstructor();
    return classConstructor;
  }

  /** True while statements are being routed into this scope's static constructor. */
  boolean isInitializing(CodeGenerator gen) {
    return classConstructor != null && gen.currentMember() == classConstructor;
  }
}
