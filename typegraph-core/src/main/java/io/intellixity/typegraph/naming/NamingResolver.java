package io.intellixity.typegraph.naming;

import io.intellixity.typegraph.graph.TypeName;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Maps grammar identifiers to type-graph identifiers. Every method is a pure
 * function of its arguments and the resolver's fixed settings.
 */
public final class NamingResolver {
  /** Appended to a nested name that equals one of its enclosing names. */
  public static final String NESTED_SUFFIX = "Value";

  private final String sumSeparator;
  private final String contentName;
  private final String textVariantName;

  public NamingResolver(String sumSeparator, String contentName, String textVariantName) {
    this.sumSeparator = Objects.requireNonNull(sumSeparator, "sumSeparator");
    this.contentName = requireIdentifier(contentName, "contentName");
    this.textVariantName = requireIdentifier(textVariantName, "textVariantName");
  }

  public static NamingResolver defaults() {
    return new NamingResolver("Or", "Content", "Text");
  }

  /** Type-case name for an element, attribute or group identifier. */
  public String typeName(String grammarIdentifier) {
    return requireIdentifier(Identifiers.pascal(grammarIdentifier), grammarIdentifier);
  }

  /**
   * Field-case name derived from the referenced type's simple name,
   * pluralized only for list fields.
   */
  public String fieldName(String childTypeName, boolean plural) {
    String base = Identifiers.decap(childTypeName);
    if (base.isEmpty()) throw new IllegalArgumentException("cannot derive field name from '" + childTypeName + "'");
    return plural ? Plurals.plural(base) : base;
  }

  /** Field-case name for an attribute. */
  public String attributeFieldName(String attributeName) {
    return requireIdentifier(Identifiers.camel(attributeName), attributeName);
  }

  /** Members joined with the separator, in the order given: {@code [A, B] -> AOrB}. */
  public String sumTypeName(List<String> memberTypeNames) {
    if (memberTypeNames == null || memberTypeNames.isEmpty()) {
      throw new IllegalArgumentException("sum type requires members");
    }
    return String.join(sumSeparator, memberTypeNames);
  }

  /** Name of the sum holding an element's mixed content, nested under the element. */
  public TypeName contentTypeName(TypeName owner) {
    return nestedTypeName(owner, contentName);
  }

  /** Name of the enum for an enumerated attribute, nested under its element. */
  public TypeName enumTypeName(TypeName owner, String attributeName) {
    return nestedTypeName(owner, typeName(attributeName));
  }

  /**
   * {@code simpleName} nested under {@code owner}. A nested type may not share its
   * simple name with an enclosing one, so {@code Type} under {@code Type} becomes
   * {@code Type.TypeValue}.
   */
  public TypeName nestedTypeName(TypeName owner, String simpleName) {
    return owner.nested(distinctFrom(owner, simpleName));
  }

  public String enumTagName(String optionLiteral) {
    return Identifiers.upperSnake(optionLiteral);
  }

  public String textVariantName() { return textVariantName; }

  /** Text variant name for {@code sum}; the variant is declared inside the sum. */
  public String textVariantName(TypeName sum) {
    return distinctFrom(sum, textVariantName);
  }

  /**
   * Returns {@code base} if unused, otherwise the first of {@code base2},
   * {@code base3}, ... not in {@code taken}.
   */
  public String uniqueFieldName(String base, Set<String> taken) {
    if (!taken.contains(base)) return base;
    for (int i = 2; ; i++) {
      String candidate = base + i;
      if (!taken.contains(candidate)) return candidate;
    }
  }

  private static String distinctFrom(TypeName enclosing, String simpleName) {
    String name = simpleName;
    while (enclosing.segments().contains(name)) name = name + NESTED_SUFFIX;
    return name;
  }

  private static String requireIdentifier(String s, String source) {
    if (s == null || s.isEmpty()) {
      throw new IllegalArgumentException("cannot derive identifier from '" + source + "'");
    }
    return s;
  }
}
