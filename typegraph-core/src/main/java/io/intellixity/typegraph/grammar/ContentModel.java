package io.intellixity.typegraph.grammar;

import java.util.List;

/** The shape of an element's body. */
public sealed interface ContentModel
    permits ContentModel.Empty, ContentModel.Text, ContentModel.AnyContent,
            ContentModel.Sequence, ContentModel.Mixed, ContentModel.Choice {

  <R> R accept(Visitor<R> visitor);

  static Empty empty() { return Empty.INSTANCE; }
  static Text text() { return Text.INSTANCE; }
  static AnyContent any() { return AnyContent.INSTANCE; }

  static Sequence sequence(ChildRef... children) {
    return new Sequence(List.of(children));
  }

  static Mixed mixed(boolean allowsText, ElementDefinition... children) {
    return new Mixed(allowsText, List.of(children));
  }

  static Choice choice(Occurrence occurrence, ChildRef... options) {
    return new Choice(List.of(options), occurrence);
  }

  /** {@code EMPTY} */
  final class Empty implements ContentModel {
    static final Empty INSTANCE = new Empty();
    private Empty() {}
    @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitEmpty(this); }
    @Override public String toString() { return "EMPTY"; }
  }

  /** {@code (#PCDATA)} */
  final class Text implements ContentModel {
    static final Text INSTANCE = new Text();
    private Text() {}
    @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitText(this); }
    @Override public String toString() { return "(#PCDATA)"; }
  }

  /** {@code ANY} */
  final class AnyContent implements ContentModel {
    static final AnyContent INSTANCE = new AnyContent();
    private AnyContent() {}
    @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitAny(this); }
    @Override public String toString() { return "ANY"; }
  }

  /** Ordered children; declaration order is serialization order. */
  record Sequence(List<ChildRef> children) implements ContentModel {
    public Sequence {
      children = List.copyOf(children == null ? List.of() : children);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) { return visitor.visitSequence(this); }
  }

  /**
   * {@code (#PCDATA | a | b)*}: children interleaved with text in any order and any number.
   * With {@code allowsText == false} the element only takes the listed children.
   */
  record Mixed(boolean allowsText, List<ElementDefinition> children) implements ContentModel {
    public Mixed {
      children = List.copyOf(children == null ? List.of() : children);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) { return visitor.visitMixed(this); }
  }

  /** The whole content model is one choice group, e.g. {@code <!ELEMENT e (a | b)>}. */
  record Choice(List<ChildRef> options, Occurrence occurrence) implements ContentModel {
    public Choice {
      options = List.copyOf(options == null ? List.of() : options);
      if (options.isEmpty()) throw new IllegalArgumentException("choice requires at least one option");
      occurrence = occurrence == null ? Occurrence.ONCE : occurrence;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) { return visitor.visitChoice(this); }
  }

  interface Visitor<R> {
    R visitEmpty(Empty empty);
    R visitText(Text text);
    R visitAny(AnyContent any);
    R visitSequence(Sequence sequence);
    R visitMixed(Mixed mixed);
    R visitChoice(Choice choice);
  }
}
