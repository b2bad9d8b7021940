package de.example.py2cs;

import de.example.py2cs.config.TranslatorProperties;
import de.example.py2cs.syntax.AsyncStatement;
import de.example.py2cs.syntax.ExpStatement;
import de.example.py2cs.syntax.Module;
import de.example.py2cs.syntax.Op;
import de.example.py2cs.syntax.PassStatement;
import de.example.py2cs.syntax.RealLiteral;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static de.example.py2cs.syntax.Trees.assign;
import static de.example.py2cs.syntax.Trees.bin;
import static de.example.py2cs.syntax.Trees.def;
import static de.example.py2cs.syntax.Trees.id;
import static de.example.py2cs.syntax.Trees.module;
import static de.example.py2cs.syntax.Trees.num;
import static de.example.py2cs.syntax.Trees.params;
import static de.example.py2cs.syntax.Trees.ret;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PythonToCSharpTranslatorTest {

  private final PythonToCSharpTranslator translator = new PythonToCSharpTranslator(TranslatorProperties.defaults());

  @Test
  void translatesAWholeModule() {
    Module m = module("geometry.shapes",
        assign(id("PI"), new RealLiteral(3.14)),
        def("area", params("r"), ret(bin(Op.MUL, bin(Op.MUL, id("PI"), id("r")), id("r")))));

    assertThat(translator.translate(m, "App.Models")).isEqualTo("""
        namespace App.Models {

            public static class geometry_shapes {

                public static double PI = 3.14;

                public static object area(object r) {
                    return PI * r * r;
                }
            }
        }
        """);
  }

  @Test
  void blankNamespaceFallsBackToTheDefault() {
    assertThat(translator.translate(module("m"), " ")).startsWith("namespace Translated {");
  }

  @Test
  void indentWidthIsConfigurable() {
    PythonToCSharpTranslator narrow = new PythonToCSharpTranslator(
        new TranslatorProperties("N", 2, 50, TranslatorProperties.defaults().cors()));
    assertThat(narrow.translate(module("m", assign(id("x"), num(1)))))
        .contains("\n  public static class m {\n\n    public static int x = 1;\n");
  }

  @Test
  void invalidNamespaceIsRejected() {
    assertThatThrownBy(() -> translator.translate(module("m"), "1bad..ns"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("1bad..ns");
  }

  @Test
  void moduleNamesBecomeIdentifiers() {
    assertThat(PythonToCSharpTranslator.moduleName(module("my-module"))).isEqualTo("my_module");
    assertThat(PythonToCSharpTranslator.moduleName(module("2fast"))).isEqualTo("_2fast");
    assertThat(PythonToCSharpTranslator.moduleName(module(null))).isEqualTo("module");
  }

  @Test
  void failingModuleDoesNotAffectTheOthers() {
    List<Module> modules = List.of(
        module("a", assign(id("x"), num(1))),
        module("b", new AsyncStatement(def("f", params()))),
        module("c", assign(id("y"), num(2))));

    List<TranslationResult> results = translator.translateAll(modules, "Batch");

    assertThat(results).extracting(TranslationResult::name).containsExactly("a", "b", "c");
    assertThat(results.get(0).isSuccess()).isTrue();
    assertThat(results.get(0).output()).contains("public static int x = 1;");
    assertThat(results.get(1).isSuccess()).isFalse();
    assertThat(results.get(1).error()).contains("async");
    assertThat(results.get(1).output()).isNull();
    assertThat(results.get(2).output()).contains("public static int y = 2;").doesNotContain("x = 1");
  }

  @Test
  void nodesWithMissingRequiredPartsAreRejected() {
    assertThatThrownBy(() -> new ExpStatement(null))
        .isInstanceOf(UnsupportedConstructException.class)
        .hasMessageContaining("ExpStatement without expression");
    assertThatThrownBy(() -> new Module("m", Arrays.asList(new PassStatement(), null)))
        .isInstanceOf(UnsupportedConstructException.class)
        .hasMessageContaining("malformed syntax tree");
    assertThatThrownBy(() -> translator.translate(null, "N"))
        .isInstanceOf(UnsupportedConstructException.class)
        .hasMessageContaining("missing module");
  }

  @Test
  void undecodableSourceBecomesAnErrorEntry() {
    List<TranslationResult> results = translator.translateAll(List.of("ok", "bad", "also-ok"), "N",
        source -> source.equals("bad")
            ? module(source, new ExpStatement(null))
            : module(source, assign(id("x"), num(1))),
        source -> PythonToCSharpTranslator.moduleName(source));

    assertThat(results).extracting(TranslationResult::name).containsExactly("ok", "bad", "also_ok");
    assertThat(results.get(0).output()).contains("public static int x = 1;");
    assertThat(results.get(1).isSuccess()).isFalse();
    assertThat(results.get(1).error()).contains("ExpStatement without expression");
    assertThat(results.get(2).isSuccess()).isTrue();
  }

  @Test
  void repeatedTranslationsAreIndependent() {
    Module m = module("m", def("f", params(), assign(id("t"), num(1))));
    assertThat(translator.translate(m)).isEqualTo(translator.translate(m));
  }
}
