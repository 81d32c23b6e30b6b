package io.intellixity.typegraph.lower;

import io.intellixity.typegraph.graph.TypeName;

/** Two different definitions, or two variants of one sum, resolved to the same qualified name. */
public final class TypeNameCollisionException extends LoweringException {
  private final TypeName name;

  public TypeNameCollisionException(TypeName name, String message) {
    super(message);
    this.name = name;
  }

  public TypeName name() { return name; }
}
