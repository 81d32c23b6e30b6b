package io.intellixity.typegraph.grammar;

import java.util.List;

/** Declared value type of an attribute. */
public sealed interface AttributeType permits AttributeType.Tokenized, AttributeType.Enumerated {

  <R> R accept(Visitor<R> visitor);

  static Enumerated enumerated(String... options) {
    return new Enumerated(List.of(options));
  }

  enum Tokenized implements AttributeType {
    CDATA,
    ID,
    IDREF,
    IDREFS,
    NMTOKEN,
    NMTOKENS,
    ENTITY,
    ENTITIES,
    NOTATION,
    /** Predefined {@code xml:*} attribute value. */
    XML;

    @Override
    public <R> R accept(Visitor<R> visitor) { return visitor.visitTokenized(this); }
  }

  /** {@code (a | b | c)}; option order is preserved. */
  record Enumerated(List<String> options) implements AttributeType {
    public Enumerated {
      options = List.copyOf(options == null ? List.of() : options);
      if (options.isEmpty()) throw new IllegalArgumentException("enumerated attribute type requires options");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) { return visitor.visitEnumerated(this); }
  }

  interface Visitor<R> {
    R visitTokenized(Tokenized type);
    R visitEnumerated(Enumerated type);
  }
}
