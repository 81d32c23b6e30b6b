package io.intellixity.typegraph.graph;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class TypeGraphTest {
  private final TypeName a = TypeName.of("A");
  private final TypeName b = TypeName.of("B");
  private final TypeName sum = TypeName.of("AOrB");
  private final TypeName root = TypeName.of("Root");
  private final TypeName rootKind = root.nested("Kind");

  @Test
  void typeNames() {
    TypeName n = TypeName.parse("Note.Content");
    assertEquals("Content", n.simpleName());
    assertTrue(n.isNested());
    assertEquals(TypeName.of("Note"), n.owner());
    assertEquals(TypeName.of("Note"), n.topLevel());
    assertEquals("Note.Content", n.qualified());
    assertEquals("NoteContent", n.flatName());
    assertFalse(TypeName.of("Note").isNested());
  }

  @Test
  void queriesFollowEmissionOrder() {
    TypeGraph g = new TypeGraph(root, graph());

    assertEquals(List.of(a, b, sum, rootKind, root), List.copyOf(g.definitions().keySet()));
    assertEquals(List.of(a, b, sum, root), g.topLevel().stream().map(TypeDef::name).toList());
    assertEquals(List.of(rootKind), g.nestedIn(root).stream().map(TypeDef::name).toList());
    assertEquals(List.of(sum), g.sumsContaining(a).stream().map(TypeDef::name).toList());
    assertTrue(g.sumsContaining(root).isEmpty());
    assertEquals(Set.of(sum, rootKind), TypeGraph.references(g.get(root)));
  }

  @Test
  void typedLookup() {
    TypeGraph g = new TypeGraph(root, graph());
    assertEquals(sum, g.get("AOrB", TypeDef.SumType.class).name());
    assertThrows(IllegalArgumentException.class, () -> g.get("AOrB", TypeDef.RecordType.class));
    assertThrows(IllegalArgumentException.class, () -> g.get("Missing"));
  }

  @Test
  void danglingReferencesAreRejected() {
    Map<TypeName, TypeDef> defs = graph();
    defs.remove(b);
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> new TypeGraph(root, defs));
    assertTrue(ex.getMessage().contains("undefined type B"), ex.getMessage());
  }

  @Test
  void rootMustBeDefined() {
    assertThrows(IllegalArgumentException.class, () -> new TypeGraph(TypeName.of("Other"), graph()));
  }

  @Test
  void equalityIsOrderSensitive() {
    Map<TypeName, TypeDef> reordered = new LinkedHashMap<>();
    List<TypeName> order = List.of(b, a, sum, rootKind, root);
    Map<TypeName, TypeDef> defs = graph();
    for (TypeName n : order) reordered.put(n, defs.get(n));

    assertEquals(new TypeGraph(root, graph()), new TypeGraph(root, graph()));
    assertNotEquals(new TypeGraph(root, graph()), new TypeGraph(root, reordered));
  }

  @Test
  void fieldInvariants() {
    assertThrows(IllegalArgumentException.class,
        () -> Field.element("a", null, Cardinality.REQUIRED, ValueType.ref(a)));
    assertThrows(IllegalArgumentException.class,
        () -> Field.value(Cardinality.REQUIRED, ValueType.text()).asConstant("x"));
    Field f = Field.attribute("v", "v", Cardinality.REQUIRED, ValueType.text()).asConstant("1");
    assertFalse(f.constructorInput());
    assertFalse(f.hasDefault());
  }

  private Map<TypeName, TypeDef> graph() {
    Map<TypeName, TypeDef> defs = new LinkedHashMap<>();
    defs.put(a, new TypeDef.RecordType(a, "a", List.of()));
    defs.put(b, new TypeDef.RecordType(b, "b", List.of()));
    defs.put(sum, new TypeDef.SumType(sum, List.of(Variant.of("A", "a", a), Variant.of("B", "b", b))));
    defs.put(rootKind, new TypeDef.EnumType(rootKind, "kind", List.of(new EnumTag("X", "x"))));
    defs.put(root, new TypeDef.RecordType(root, "root", List.of(
        Field.attribute("kind", "kind", Cardinality.OPTIONAL, ValueType.ref(rootKind)),
        Field.choice("aOrBs", Cardinality.LIST, sum))));
    return defs;
  }
}
