package de.example.py2cs.translate;

import de.example.py2cs.UnsupportedConstructException;
import de.example.py2cs.syntax.Decorated;
import de.example.py2cs.syntax.Decorator;
import de.example.py2cs.syntax.DottedName;
import de.example.py2cs.syntax.Statement;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static de.example.py2cs.syntax.Trees.attr;
import static de.example.py2cs.syntax.Trees.decorated;
import static de.example.py2cs.syntax.Trees.def;
import static de.example.py2cs.syntax.Trees.id;
import static de.example.py2cs.syntax.Trees.params;
import static de.example.py2cs.syntax.Trees.ret;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DecoratorKindTest {

  private static Decorator decorator(String... segs) {
    return new Decorator(DottedName.of(segs), List.of());
  }

  @Test
  void classifiesPropertyDecorators() {
    assertThat(DecoratorKind.classify(decorator("property"), "size")).isEqualTo(new DecoratorKind.Getter());
    assertThat(DecoratorKind.classify(decorator("size", "setter"), "size")).isEqualTo(new DecoratorKind.Setter("size"));
    assertThat(DecoratorKind.classify(decorator("functools", "wraps"), "size"))
        .isEqualTo(new DecoratorKind.Unknown("functools.wraps"));
  }

  @Test
  void setterMustDecorateTheSameName() {
    assertThatThrownBy(() -> DecoratorKind.classify(decorator("size", "setter"), "width"))
        .isInstanceOf(UnsupportedConstructException.class)
        .hasMessageContaining("width");
  }

  @Test
  void findPropertiesPairsGetterAndSetter() {
    Statement getter = decorated(def("size", params("self"), ret(attr(id("self"), "_size"))), "property");
    Statement setter = decorated(def("size", params("self", "v")), "size.setter");
    Statement plain = def("other", params("self"));

    Map<Decorated, PropertyDefinition> found = StatementTranslator.findProperties(List.of(getter, plain, setter));

    assertThat(found).hasSize(2);
    PropertyDefinition def = found.get(getter);
    assertThat(def).isSameAs(found.get(setter));
    assertThat(def.getName()).isEqualTo("size");
    assertThat(def.getGetter()).isSameAs(getter);
    assertThat(def.getSetter()).isSameAs(setter);
  }

  @Test
  void setterWithoutGetterIsRejected() {
    Statement setter = decorated(def("size", params("self", "v")), "size.setter");
    assertThatThrownBy(() -> StatementTranslator.findProperties(List.of(setter)))
        .isInstanceOf(UnsupportedConstructException.class)
        .hasMessageContaining("size");
  }
}
