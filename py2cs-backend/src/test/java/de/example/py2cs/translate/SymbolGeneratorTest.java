package de.example.py2cs.translate;

import de.example.py2cs.codemodel.CodeTypeReference;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SymbolGeneratorTest {

  @Test
  void ensureLocalVariableKeepsTheFirstDeclaration() {
    SymbolGenerator symbols = new SymbolGenerator();
    assertThat(symbols.ensureLocalVariable("x", TypeMapper.INT, false)).isTrue();
    assertThat(symbols.ensureLocalVariable("x", TypeMapper.STRING, false)).isFalse();
    assertThat(symbols.lookup("x")).hasValueSatisfying(s -> assertThat(s.type()).isEqualTo(TypeMapper.INT));
    assertThat(symbols.lookup("y")).isEmpty();
  }

  @Test
  void generatedNamesShareOneCounterAndSkipTakenNames() {
    SymbolGenerator symbols = new SymbolGenerator();
    symbols.ensureLocalVariable("_it_2", CodeTypeReference.OBJECT, false);

    assertThat(symbols.genSymLocal("_tup_", CodeTypeReference.OBJECT).name()).isEqualTo("_tup_1");
    assertThat(symbols.genSymLocal("_it_", CodeTypeReference.OBJECT).name()).isEqualTo("_it_3");
    assertThat(symbols.genSymAutomatic("_tup_", CodeTypeReference.OBJECT, true).name()).isEqualTo("_tup_4");
    assertThat(symbols.lookup("_tup_4")).hasValueSatisfying(s -> assertThat(s.parameter()).isTrue());
  }

  @Test
  void localsKeepDeclarationOrder() {
    SymbolGenerator symbols = new SymbolGenerator();
    symbols.ensureLocalVariable("b", CodeTypeReference.OBJECT, false);
    symbols.ensureLocalVariable("a", CodeTypeReference.OBJECT, true);
    symbols.genSymLocal("_t", CodeTypeReference.OBJECT);
    assertThat(symbols.locals()).extracting(SymbolGenerator.LocalSymbol::name).containsExactly("b", "a", "_t1");
  }
}
