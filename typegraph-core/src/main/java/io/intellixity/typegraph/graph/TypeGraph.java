package io.intellixity.typegraph.graph;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.intellixity.typegraph.json.TypeGraphJsonSerializer;

import java.util.*;

/**
 * Result of one lowering run: every emitted definition keyed by qualified name,
 * in emission order, plus the root type. Immutable.
 */
@JsonSerialize(using = TypeGraphJsonSerializer.class)
public final class TypeGraph {
  private final TypeName root;
  private final Map<TypeName, TypeDef> definitions;

  public TypeGraph(TypeName root, Map<TypeName, TypeDef> definitions) {
    this.root = Objects.requireNonNull(root, "root");
    this.definitions = Collections.unmodifiableMap(new LinkedHashMap<>(definitions));
    if (!this.definitions.containsKey(root)) throw new IllegalArgumentException("Root type is not defined: " + root);
    for (var e : this.definitions.entrySet()) {
      if (!e.getKey().equals(e.getValue().name())) {
        throw new IllegalArgumentException("Definition keyed as " + e.getKey() + " is named " + e.getValue().name());
      }
      for (TypeName ref : references(e.getValue())) {
        if (!this.definitions.containsKey(ref)) {
          throw new IllegalArgumentException(e.getKey() + " references undefined type " + ref);
        }
      }
    }
  }

  public TypeName root() { return root; }

  public TypeDef rootDefinition() { return definitions.get(root); }

  public Map<TypeName, TypeDef> definitions() { return definitions; }

  public Collection<TypeDef> all() { return definitions.values(); }

  public int size() { return definitions.size(); }

  public boolean contains(TypeName name) { return definitions.containsKey(name); }

  public TypeDef get(TypeName name) {
    TypeDef d = definitions.get(name);
    if (d == null) throw new IllegalArgumentException("Unknown type: " + name);
    return d;
  }

  public TypeDef get(String qualified) { return get(TypeName.parse(qualified)); }

  public <T extends TypeDef> T get(String qualified, Class<T> kind) {
    TypeDef d = get(qualified);
    if (!kind.isInstance(d)) {
      throw new IllegalArgumentException(qualified + " is a " + d.getClass().getSimpleName() + ", not " + kind.getSimpleName());
    }
    return kind.cast(d);
  }

  /** Top-level definitions in emission order. */
  public List<TypeDef> topLevel() {
    List<TypeDef> out = new ArrayList<>();
    for (TypeDef d : definitions.values()) {
      if (!d.name().isNested()) out.add(d);
    }
    return out;
  }

  /** Definitions directly nested in {@code owner}, in emission order. */
  public List<TypeDef> nestedIn(TypeName owner) {
    List<TypeDef> out = new ArrayList<>();
    for (TypeDef d : definitions.values()) {
      if (d.name().isNested() && d.name().owner().equals(owner)) out.add(d);
    }
    return out;
  }

  /** Sum types that list {@code member} as a variant payload, in emission order. */
  public List<TypeDef.SumType> sumsContaining(TypeName member) {
    List<TypeDef.SumType> out = new ArrayList<>();
    for (TypeDef d : definitions.values()) {
      if (d instanceof TypeDef.SumType s && s.variants().stream().anyMatch(v -> member.equals(v.payload()))) {
        out.add(s);
      }
    }
    return out;
  }

  /** Type names referenced by {@code def}'s fields or variants. */
  public static Set<TypeName> references(TypeDef def) {
    return def.accept(new TypeDef.Visitor<>() {
      @Override
      public Set<TypeName> visitRecord(TypeDef.RecordType record) {
        Set<TypeName> out = new LinkedHashSet<>();
        for (Field f : record.fields()) {
          if (f.type() instanceof ValueType.Ref r) out.add(r.name());
        }
        return out;
      }

      @Override
      public Set<TypeName> visitSum(TypeDef.SumType sum) {
        Set<TypeName> out = new LinkedHashSet<>();
        for (Variant v : sum.variants()) {
          if (!v.isText()) out.add(v.payload());
        }
        return out;
      }

      @Override
      public Set<TypeName> visitEnum(TypeDef.EnumType enumType) {
        return Set.of();
      }
    });
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof TypeGraph g)) return false;
    return root.equals(g.root) && List.copyOf(definitions.entrySet()).equals(List.copyOf(g.definitions.entrySet()));
  }

  @Override
  public int hashCode() { return Objects.hash(root, definitions); }

  @Override
  public String toString() {
    return "TypeGraph{root=" + root + ", types=" + definitions.keySet() + "}";
  }
}
