package io.intellixity.typegraph.grammar;

import java.util.Objects;

/** {@code #REQUIRED}, {@code #IMPLIED}, a default literal or {@code #FIXED} literal. */
public sealed interface AttributePresence
    permits AttributePresence.Required, AttributePresence.Implied,
            AttributePresence.Defaulted, AttributePresence.Fixed {

  <R> R accept(Visitor<R> visitor);

  static Required required() { return Required.INSTANCE; }
  static Implied implied() { return Implied.INSTANCE; }
  static Defaulted defaulted(String value) { return new Defaulted(value); }
  static Fixed fixed(String value) { return new Fixed(value); }

  final class Required implements AttributePresence {
    static final Required INSTANCE = new Required();
    private Required() {}
    @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitRequired(this); }
    @Override public String toString() { return "#REQUIRED"; }
  }

  final class Implied implements AttributePresence {
    static final Implied INSTANCE = new Implied();
    private Implied() {}
    @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitImplied(this); }
    @Override public String toString() { return "#IMPLIED"; }
  }

  /** Used when the attribute is absent. */
  record Defaulted(String value) implements AttributePresence {
    public Defaulted {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) { return visitor.visitDefaulted(this); }
  }

  /** The attribute always has this value. */
  record Fixed(String value) implements AttributePresence {
    public Fixed {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) { return visitor.visitFixed(this); }
  }

  interface Visitor<R> {
    R visitRequired(Required required);
    R visitImplied(Implied implied);
    R visitDefaulted(Defaulted defaulted);
    R visitFixed(Fixed fixed);
  }
}
