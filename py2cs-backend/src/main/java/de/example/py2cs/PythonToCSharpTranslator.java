package de.example.py2cs;

import de.example.py2cs.codemodel.CSharpUnitWriter;
import de.example.py2cs.codemodel.CodeCompileUnit;
import de.example.py2cs.codemodel.CodeTypeDeclaration;
import de.example.py2cs.codemodel.IndentingTextWriter;
import de.example.py2cs.codemodel.MemberAttributes;
import de.example.py2cs.config.TranslatorProperties;
import de.example.py2cs.syntax.Module;
import de.example.py2cs.translate.CodeGenerator;
import de.example.py2cs.translate.Docstring;
import de.example.py2cs.translate.LocalVariableGenerator;
import de.example.py2cs.translate.StatementTranslator;
import de.example.py2cs.translate.TranslationScope;
import de.example.py2cs.translate.TypeMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Python module -> C# source. Stateless between calls: every translation gets
 * its own generator, scopes and output buffer, so the service can run modules
 * in parallel.
 */
@Service
public class PythonToCSharpTranslator {
  private static final Logger log = LoggerFactory.getLogger(PythonToCSharpTranslator.class);
  private static final Pattern NAMESPACE = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*");

  private final TranslatorProperties properties;

  public PythonToCSharpTranslator(TranslatorProperties properties) {
    this.properties = properties;
  }

  // =========================================================
  // Public API
  // =========================================================
  public String translate(Module module) {
    return translate(module, properties.defaultNamespace());
  }

  public String translate(Module module, String namespace) {
    if (module == null) throw new UnsupportedConstructException("malformed syntax tree", "missing module");
    String ns = namespace == null || namespace.isBlank() ? properties.defaultNamespace() : namespace.trim();
    if (!NAMESPACE.matcher(ns).matches()) {
      throw new IllegalArgumentException("Not a valid namespace: " + ns);
    }
    CodeCompileUnit unit = lower(module, ns);
    IndentingTextWriter out = new IndentingTextWriter(properties.indentWidth());
    new CSharpUnitWriter(out).write(unit);
    return out.toString();
  }

  /**
   * Translates independent modules in parallel. A module that fails yields an
   * error entry; the others are unaffected. Results keep the input order.
   */
  public List<TranslationResult> translateAll(List<Module> modules, String namespace) {
    return translateAll(modules, namespace, Function.identity(), PythonToCSharpTranslator::moduleName);
  }

  /**
   * Same as {@link #translateAll(List, String)} for sources that still have to
   * be decoded into a {@link Module}; a source that fails to decode becomes an
   * error entry named by {@code nameOf}.
   */
  public <T> List<TranslationResult> translateAll(List<T> sources, String namespace,
      Function<T, Module> decode, Function<T, String> nameOf) {
    List<TranslationResult> results = sources.parallelStream()
        .map(source -> translateOne(source, namespace, decode, nameOf))
        .toList();
    long failed = results.stream().filter(r -> !r.isSuccess()).count();
    log.info("Translated {} modules, {} failed", results.size(), failed);
    return results;
  }

  private <T> TranslationResult translateOne(T source, String namespace,
      Function<T, Module> decode, Function<T, String> nameOf) {
    String name = nameOf.apply(source);
    try {
      return TranslationResult.success(name, translate(decode.apply(source), namespace));
    } catch (TranslationException | IllegalArgumentException e) {
      log.warn("Module {} failed: {}", name, e.getMessage());
      return TranslationResult.failure(name, e.getMessage());
    }
  }

  // =========================================================
  // Lowering
  // =========================================================
  public CodeCompileUnit lower(Module module, String namespace) {
    String className = moduleName(module);
    log.debug("Translating module {} into namespace {}", className, namespace);

    CodeCompileUnit unit = new CodeCompileUnit();
    CodeGenerator gen = new CodeGenerator(unit, namespace);
    StatementTranslator xlat = new StatementTranslator(gen, new TypeMapper());
    TranslationScope scope = TranslationScope.forModule();

    Docstring doc = Docstring.split(module.statements());
    CodeTypeDeclaration type = gen.classDef(className, List.of(), () -> {
      xlat.translateAll(doc.statements(), scope);
      scope.classConstructor().ifPresent(cctor -> LocalVariableGenerator.generate(
          List.of(), cctor.getStatements(), scope.globals(), scope.symbols()));
    });
    type.getAttributes().add(MemberAttributes.STATIC);
    type.getComments().addAll(doc.comments());
    return unit;
  }

  static String moduleName(Module module) {
    return moduleName(module == null ? null : module.name());
  }

  /** The C# class name for a module name: non-identifier characters become {@code _}. */
  public static String moduleName(String name) {
    if (name == null || name.isBlank()) return "module";
    String cleaned = name.replaceAll("[^A-Za-z0-9_]", "_");
    return Character.isDigit(cleaned.charAt(0)) ? "_" + cleaned : cleaned;
  }
}
