package io.intellixity.typegraph.graph;

import java.util.List;
import java.util.Objects;

/** A named definition in the type graph. */
public sealed interface TypeDef permits TypeDef.RecordType, TypeDef.SumType, TypeDef.EnumType {
  TypeName name();

  <R> R accept(Visitor<R> visitor);

  /**
   * Lowered element. With no fields it is a singleton.
   *
   * @param serializedName the element's grammar name
   */
  record RecordType(TypeName name, String serializedName, List<Field> fields) implements TypeDef {
    public RecordType {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(serializedName, "serializedName");
      fields = List.copyOf(fields == null ? List.of() : fields);
    }

    public boolean isSingleton() { return fields.isEmpty(); }

    /** Fields a caller supplies when constructing a value, in declaration order. */
    public List<Field> constructorInputs() {
      return fields.stream().filter(Field::constructorInput).toList();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) { return visitor.visitRecord(this); }
  }

  /** Mutually exclusive alternatives, in declaration order. */
  record SumType(TypeName name, List<Variant> variants) implements TypeDef {
    public SumType {
      Objects.requireNonNull(name, "name");
      variants = List.copyOf(variants == null ? List.of() : variants);
      if (variants.isEmpty()) throw new IllegalArgumentException("sum type without variants: " + name);
    }

    public boolean hasTextVariant() {
      return variants.stream().anyMatch(Variant::isText);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) { return visitor.visitSum(this); }
  }

  /** @param serializedName the attribute's grammar name */
  record EnumType(TypeName name, String serializedName, List<EnumTag> tags) implements TypeDef {
    public EnumType {
      Objects.requireNonNull(name, "name");
      tags = List.copyOf(tags == null ? List.of() : tags);
    }

    public EnumTag tagForLiteral(String literal) {
      for (EnumTag t : tags) {
        if (t.literal().equals(literal)) return t;
      }
      throw new IllegalArgumentException("No tag with literal '" + literal + "' in " + name);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) { return visitor.visitEnum(this); }
  }

  interface Visitor<R> {
    R visitRecord(RecordType record);
    R visitSum(SumType sum);
    R visitEnum(EnumType enumType);
  }
}
