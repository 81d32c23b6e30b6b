package io.intellixity.typegraph.grammar;

import io.intellixity.typegraph.graph.Cardinality;

/** Multiplicity annotation on a child reference. */
public enum Occurrence {
  ONCE(""),
  OPTIONAL("?"),
  ONE_OR_MORE("+"),
  ZERO_OR_MORE("*");

  private final String suffix;

  Occurrence(String suffix) {
    this.suffix = suffix;
  }

  /** DTD suffix for this occurrence, empty for exactly-one. */
  public String suffix() { return suffix; }

  /**
   * "At least one" and "zero or more" both map to {@link Cardinality#LIST};
   * the lower bound is not carried into the type graph.
   */
  public Cardinality cardinality() {
    return switch (this) {
      case ONCE -> Cardinality.REQUIRED;
      case OPTIONAL -> Cardinality.OPTIONAL;
      case ONE_OR_MORE, ZERO_OR_MORE -> Cardinality.LIST;
    };
  }

  public static Occurrence fromSuffix(String s) {
    String v = s == null ? "" : s.trim();
    for (Occurrence o : values()) {
      if (o.suffix.equals(v)) return o;
    }
    throw new IllegalArgumentException("Unknown occurrence suffix: " + s);
  }
}
