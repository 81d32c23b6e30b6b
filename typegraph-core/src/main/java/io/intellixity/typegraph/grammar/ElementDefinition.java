package io.intellixity.typegraph.grammar;

import java.util.List;
import java.util.Objects;

/**
 * An {@code <!ELEMENT>} declaration together with its {@code <!ATTLIST>}.
 * <p>
 * Equality is identity: two references to the same declared element are the
 * same instance, and lowering memoizes on that. Declarations may refer to
 * elements declared later, so an element can be {@link #declare declared}
 * first and {@link #define defined} once its content model is known. After
 * that it never changes.
 */
public final class ElementDefinition {
  private final String name;
  private final List<AttributeDefinition> attributes;
  private ContentModel content;

  private ElementDefinition(String name, List<AttributeDefinition> attributes) {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("element name is blank");
    this.name = name;
    this.attributes = List.copyOf(attributes == null ? List.of() : attributes);
  }

  public static ElementDefinition of(String name, List<AttributeDefinition> attributes, ContentModel content) {
    return declare(name, attributes).define(content);
  }

  public static ElementDefinition of(String name, ContentModel content) {
    return of(name, List.of(), content);
  }

  public static ElementDefinition declare(String name, List<AttributeDefinition> attributes) {
    return new ElementDefinition(name, attributes);
  }

  public ElementDefinition define(ContentModel content) {
    Objects.requireNonNull(content, "content");
    if (this.content != null) throw new IllegalStateException("Element already defined: " + name);
    this.content = content;
    return this;
  }

  /** The grammar-level name, e.g. {@code note} for {@code <!ELEMENT note ...>}. */
  public String name() { return name; }

  public List<AttributeDefinition> attributes() { return attributes; }

  public ContentModel content() {
    if (content == null) throw new IllegalStateException("Element declared but never defined: " + name);
    return content;
  }

  public boolean isDefined() { return content != null; }

  @Override
  public String toString() {
    return "<!ELEMENT " + name + " " + (content == null ? "?" : content) + ">";
  }
}
