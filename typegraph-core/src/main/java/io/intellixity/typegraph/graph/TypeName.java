package io.intellixity.typegraph.graph;

import java.util.ArrayList;
import java.util.List;

/**
 * Qualified name of a type in the graph. Nested types carry their owner's
 * path, e.g. {@code Note.Content}. Equality compares the full path.
 */
public record TypeName(List<String> segments) implements Comparable<TypeName> {
  public TypeName {
    segments = List.copyOf(segments == null ? List.of() : segments);
    if (segments.isEmpty()) throw new IllegalArgumentException("type name has no segments");
    for (String s : segments) {
      if (s == null || s.isBlank()) throw new IllegalArgumentException("blank type name segment in " + segments);
    }
  }

  public static TypeName of(String simpleName) {
    return new TypeName(List.of(simpleName));
  }

  /** Parses a dotted path such as {@code Note.Content}. */
  public static TypeName parse(String qualified) {
    return new TypeName(List.of(qualified.split("\\.")));
  }

  public TypeName nested(String simpleName) {
    List<String> out = new ArrayList<>(segments);
    out.add(simpleName);
    return new TypeName(out);
  }

  public String simpleName() { return segments.get(segments.size() - 1); }

  public boolean isNested() { return segments.size() > 1; }

  public TypeName owner() {
    if (!isNested()) throw new IllegalStateException("Top-level type has no owner: " + this);
    return new TypeName(segments.subList(0, segments.size() - 1));
  }

  public TypeName topLevel() { return TypeName.of(segments.get(0)); }

  public String qualified() { return String.join(".", segments); }

  /** Segments concatenated, e.g. {@code NoteContent}. */
  public String flatName() { return String.join("", segments); }

  @Override
  public int compareTo(TypeName o) { return qualified().compareTo(o.qualified()); }

  @Override
  public String toString() { return qualified(); }
}
