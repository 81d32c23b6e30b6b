package io.intellixity.typegraph.grammar;

import java.util.List;
import java.util.Objects;

/**
 * An occurrence-annotated reference to either one element or a nested choice
 * group inside a sequence or choice content model.
 */
public sealed interface ChildRef permits ChildRef.ElementRef, ChildRef.ChoiceRef {
  Occurrence occurrence();

  <R> R accept(Visitor<R> visitor);

  static ElementRef element(ElementDefinition element) {
    return new ElementRef(element, Occurrence.ONCE);
  }

  static ElementRef element(ElementDefinition element, Occurrence occurrence) {
    return new ElementRef(element, occurrence);
  }

  static ChoiceRef choice(Occurrence occurrence, ChildRef... options) {
    return new ChoiceRef(List.of(options), occurrence);
  }

  record ElementRef(ElementDefinition element, Occurrence occurrence) implements ChildRef {
    public ElementRef {
      Objects.requireNonNull(element, "element");
      occurrence = occurrence == null ? Occurrence.ONCE : occurrence;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) { return visitor.visitElement(this); }
  }

  /** The occurrence applies to the whole group, not to the individual options. */
  record ChoiceRef(List<ChildRef> options, Occurrence occurrence) implements ChildRef {
    public ChoiceRef {
      options = List.copyOf(options == null ? List.of() : options);
      if (options.isEmpty()) throw new IllegalArgumentException("choice requires at least one option");
      occurrence = occurrence == null ? Occurrence.ONCE : occurrence;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) { return visitor.visitChoice(this); }
  }

  interface Visitor<R> {
    R visitElement(ElementRef ref);
    R visitChoice(ChoiceRef ref);
  }
}
