package io.intellixity.typegraph.naming;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class IdentifiersTest {

  @Test
  void splitsOnSeparatorsAndCaseBoundaries() {
    assertEquals(List.of("re", "ele"), Identifiers.words("re_ele"));
    assertEquals(List.of("xml", "lang"), Identifiers.words("xml:lang"));
    assertEquals(List.of("camel", "Case"), Identifiers.words("camelCase"));
    assertEquals(List.of(), Identifiers.words("-:_"));
  }

  @Test
  void pascalCase() {
    assertEquals("ReEle", Identifiers.pascal("re_ele"));
    assertEquals("KEle", Identifiers.pascal("k-ele"));
    assertEquals("XmlLang", Identifiers.pascal("xml:lang"));
    assertEquals("Jmdict", Identifiers.pascal("JMdict"));
    assertEquals("CamelCase", Identifiers.pascal("camelCase"));
    assertEquals("_1st", Identifiers.pascal("1st"));
  }

  @Test
  void camelCase() {
    assertEquals("reEle", Identifiers.camel("re_ele"));
    assertEquals("xmlLang", Identifiers.camel("xml:lang"));
    assertEquals("gType", Identifiers.camel("g_type"));
    assertEquals("_1st", Identifiers.camel("1st"));
    assertEquals("", Identifiers.camel("-"));
  }

  @Test
  void upperSnakeCase() {
    assertEquals("FIVE", Identifiers.upperSnake("five"));
    assertEquals("VS_C", Identifiers.upperSnake("vs-c"));
    assertEquals("ADJ_NA", Identifiers.upperSnake("adj-na"));
    assertEquals("ICHI1", Identifiers.upperSnake("ichi1"));
    assertEquals("FOO_BAR", Identifiers.upperSnake("fooBar"));
    assertEquals("_1", Identifiers.upperSnake("1"));
  }

  @Test
  void decapKeepsInnerWordBoundaries() {
    assertEquals("reEle", Identifiers.decap("ReEle"));
    assertEquals("kEle", Identifiers.decap("KEle"));
    assertEquals("aOrB", Identifiers.decap("AOrB"));
    assertEquals("abc", Identifiers.decap("ABC"));
    assertEquals("", Identifiers.decap(""));
  }

  @Test
  void plurals() {
    assertEquals("senses", Plurals.plural("sense"));
    assertEquals("glosses", Plurals.plural("gloss"));
    assertEquals("entries", Plurals.plural("entry"));
    assertEquals("keys", Plurals.plural("key"));
    assertEquals("boxes", Plurals.plural("box"));
    assertEquals("matches", Plurals.plural("match"));
    assertEquals("poses", Plurals.plural("pos"));
    assertEquals("aOrBs", Plurals.plural("aOrB"));
  }
}
