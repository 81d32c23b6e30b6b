package io.intellixity.typegraph.graph;

/**
 * One alternative of a {@link TypeDef.SumType}. A null payload marks the text variant
 * of mixed content.
 */
public record Variant(String name, String serializedName, TypeName payload) {
  public Variant {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("variant name is blank");
  }

  public static Variant of(String name, String serializedName, TypeName payload) {
    return new Variant(name, serializedName, payload);
  }

  public static Variant text(String name) {
    return new Variant(name, null, null);
  }

  public boolean isText() { return payload == null; }
}
