package io.intellixity.typegraph.lower;

import io.intellixity.typegraph.graph.EnumTag;
import io.intellixity.typegraph.graph.TypeDef;
import io.intellixity.typegraph.graph.TypeName;
import io.intellixity.typegraph.naming.NamingResolver;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class EnumSynthesizerTest {
  private final EnumSynthesizer enums = new EnumSynthesizer(NamingResolver.defaults());
  private final TypeName name = TypeName.parse("G.Type");

  @Test
  void oneTagPerOptionInOrderWithUnchangedLiterals() {
    TypeDef.EnumType e = enums.synthesize(name, "g", "type", List.of("five", "four"));

    assertEquals(name, e.name());
    assertEquals("type", e.serializedName());
    assertEquals(List.of(new EnumTag("FIVE", "five"), new EnumTag("FOUR", "four")), e.tags());
  }

  @Test
  void punctuatedAndNumericOptions() {
    TypeDef.EnumType e = enums.synthesize(name, "sense", "pos", List.of("adj-na", "vs-c", "1"));

    assertEquals(List.of("ADJ_NA", "VS_C", "_1"), e.tags().stream().map(EnumTag::identifier).toList());
    assertEquals(List.of("adj-na", "vs-c", "1"), e.tags().stream().map(EnumTag::literal).toList());
    assertEquals("vs-c", e.tagForLiteral("vs-c").literal());
  }

  @Test
  void optionsNormalizingToOneIdentifierAreRejected() {
    DuplicateOptionException ex = assertThrows(DuplicateOptionException.class,
        () -> enums.synthesize(name, "g", "type", List.of("Five", "four", "five")));

    assertEquals("g", ex.elementName());
    assertEquals("type", ex.attributeName());
    assertEquals("FIVE", ex.identifier());
    assertEquals(List.of("Five", "five"), ex.literals());
  }

  @Test
  void separatorVariantsAlsoClash() {
    assertThrows(DuplicateOptionException.class,
        () -> enums.synthesize(name, "g", "type", List.of("a-b", "a_b")));
  }

  @Test
  void optionWithoutIdentifierCharactersIsUnsupported() {
    assertThrows(UnsupportedGrammarException.class,
        () -> enums.synthesize(name, "g", "type", List.of("ok", "--")));
  }
}
