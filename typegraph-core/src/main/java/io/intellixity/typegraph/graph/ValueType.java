package io.intellixity.typegraph.graph;

import java.util.Objects;

/** What a field or variant holds, before cardinality is applied. */
public sealed interface ValueType permits ValueType.Text, ValueType.Tokens, ValueType.Ref {

  <R> R accept(Visitor<R> visitor);

  static Text text() { return Text.INSTANCE; }
  static Tokens tokens() { return Tokens.INSTANCE; }
  static Ref ref(TypeName name) { return new Ref(name); }

  /** Scalar character data. */
  final class Text implements ValueType {
    static final Text INSTANCE = new Text();
    private Text() {}
    @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitText(this); }
    @Override public String toString() { return "text"; }
  }

  /** Whitespace separated tokens carried in a single attribute value (IDREFS, NMTOKENS, ...). */
  final class Tokens implements ValueType {
    static final Tokens INSTANCE = new Tokens();
    private Tokens() {}
    @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitTokens(this); }
    @Override public String toString() { return "tokens"; }
  }

  record Ref(TypeName name) implements ValueType {
    public Ref {
      Objects.requireNonNull(name, "name");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) { return visitor.visitRef(this); }

    @Override
    public String toString() { return name.qualified(); }
  }

  interface Visitor<R> {
    R visitText(Text text);
    R visitTokens(Tokens tokens);
    R visitRef(Ref ref);
  }
}
