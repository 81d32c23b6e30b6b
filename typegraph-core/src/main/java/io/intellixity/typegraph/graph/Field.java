package io.intellixity.typegraph.graph;

import java.util.Objects;

/**
 * One field of a {@link TypeDef.RecordType}.
 *
 * @param name           target identifier (field-case)
 * @param serializedName grammar-level attribute or element name; null for {@link Role#VALUE}
 *                       and {@link Role#CHOICE} fields, whose wire names come from the body text
 *                       resp. each variant
 * @param literal        default value for a defaulted attribute, or the value of a fixed one
 * @param constant       true only for fixed attributes; such a field is never a constructor input
 */
public record Field(
    String name,
    String serializedName,
    Role role,
    Cardinality cardinality,
    ValueType type,
    String literal,
    boolean constant
) {
  public enum Role {
    ATTRIBUTE,
    ELEMENT,
    CHOICE,
    VALUE
  }

  public Field {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("field name is blank");
    Objects.requireNonNull(role, "role");
    Objects.requireNonNull(cardinality, "cardinality");
    Objects.requireNonNull(type, "type");
    if ((role == Role.ATTRIBUTE || role == Role.ELEMENT) && serializedName == null) {
      throw new IllegalArgumentException("serializedName is required for " + role + " field " + name);
    }
    if (constant && literal == null) throw new IllegalArgumentException("constant field requires a literal: " + name);
    if (constant && role != Role.ATTRIBUTE) throw new IllegalArgumentException("only attributes can be constant: " + name);
  }

  public static Field attribute(String name, String serializedName, Cardinality cardinality, ValueType type) {
    return new Field(name, serializedName, Role.ATTRIBUTE, cardinality, type, null, false);
  }

  public static Field element(String name, String serializedName, Cardinality cardinality, ValueType type) {
    return new Field(name, serializedName, Role.ELEMENT, cardinality, type, null, false);
  }

  public static Field choice(String name, Cardinality cardinality, TypeName sum) {
    return new Field(name, null, Role.CHOICE, cardinality, ValueType.ref(sum), null, false);
  }

  public static Field value(Cardinality cardinality, ValueType type) {
    return new Field("content", null, Role.VALUE, cardinality, type, null, false);
  }

  public Field withName(String newName) {
    return new Field(newName, serializedName, role, cardinality, type, literal, constant);
  }

  public Field withDefault(String value) {
    return new Field(name, serializedName, role, cardinality, type, value, false);
  }

  public Field asConstant(String value) {
    return new Field(name, serializedName, role, cardinality, type, value, true);
  }

  public boolean constructorInput() { return !constant; }

  public boolean hasDefault() { return literal != null && !constant; }
}
