package io.intellixity.typegraph.grammar;

import java.util.Objects;

public record AttributeDefinition(
    String name,
    AttributeType type,
    AttributePresence presence
) {
  public AttributeDefinition {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("attribute name is blank");
    Objects.requireNonNull(type, "type");
    presence = presence == null ? AttributePresence.implied() : presence;
  }

  public static AttributeDefinition of(String name, AttributeType type, AttributePresence presence) {
    return new AttributeDefinition(name, type, presence);
  }
}
