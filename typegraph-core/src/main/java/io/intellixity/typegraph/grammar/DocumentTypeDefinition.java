package io.intellixity.typegraph.grammar;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** A parsed document grammar: its root element and its entity declarations. */
public record DocumentTypeDefinition(
    ElementDefinition rootElement,
    List<EntityDeclaration> entities
) {
  public DocumentTypeDefinition {
    Objects.requireNonNull(rootElement, "rootElement");
    entities = List.copyOf(entities == null ? List.of() : entities);
  }

  public Optional<EntityDeclaration> entity(String name) {
    for (EntityDeclaration e : entities) {
      if (e.name().equals(name)) return Optional.of(e);
    }
    return Optional.empty();
  }
}
