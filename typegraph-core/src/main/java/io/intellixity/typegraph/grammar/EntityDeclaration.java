package io.intellixity.typegraph.grammar;

import java.util.Objects;

/** {@code <!ENTITY>} declarations. They are carried for consumers; lowering does not expand them. */
public sealed interface EntityDeclaration permits EntityDeclaration.Internal, EntityDeclaration.External {
  String name();

  /** Direct name-value replacement, e.g. {@code <!ENTITY n "noun (common) (futsuumeishi)">}. */
  record Internal(String name, String value) implements EntityDeclaration {
    public Internal {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(value, "value");
    }
  }

  /** Reference to an external definition, e.g. {@code <!ENTITY x SYSTEM "x.ent">}. */
  record External(String name, String url) implements EntityDeclaration {
    public External {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(url, "url");
    }
  }
}
