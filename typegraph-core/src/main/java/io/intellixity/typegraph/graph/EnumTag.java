package io.intellixity.typegraph.graph;

/** {@code literal} is the exact option text and is what goes on the wire. */
public record EnumTag(String identifier, String literal) {
  public EnumTag {
    if (identifier == null || identifier.isBlank()) throw new IllegalArgumentException("tag identifier is blank");
    if (literal == null) throw new IllegalArgumentException("tag literal is null: " + identifier);
  }
}
