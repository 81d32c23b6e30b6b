package io.intellixity.typegraph.lower;

import io.intellixity.typegraph.graph.EnumTag;
import io.intellixity.typegraph.graph.TypeDef;
import io.intellixity.typegraph.graph.TypeName;
import io.intellixity.typegraph.naming.NamingResolver;

import java.util.*;

/** Turns the options of an enumerated attribute into an enum type. */
public final class EnumSynthesizer {
  private final NamingResolver naming;

  public EnumSynthesizer(NamingResolver naming) {
    this.naming = Objects.requireNonNull(naming, "naming");
  }

  /**
   * One tag per option, in option order. Tag identifiers are case-normalized;
   * each tag's literal is the option text unchanged.
   *
   * @throws DuplicateOptionException if two options normalize to the same identifier
   */
  public TypeDef.EnumType synthesize(TypeName name, String elementName, String attributeName, List<String> options) {
    Map<String, List<String>> byIdentifier = new LinkedHashMap<>();
    List<EnumTag> tags = new ArrayList<>(options.size());
    for (String literal : options) {
      String id = naming.enumTagName(literal);
      if (id.isEmpty()) {
        throw new UnsupportedGrammarException("Option '" + literal + "' of attribute '" + attributeName
            + "' on element '" + elementName + "' has no identifier characters");
      }
      List<String> seen = byIdentifier.computeIfAbsent(id, k -> new ArrayList<>());
      seen.add(literal);
      if (seen.size() > 1) throw new DuplicateOptionException(elementName, attributeName, id, seen);
      tags.add(new EnumTag(id, literal));
    }
    return new TypeDef.EnumType(name, attributeName, tags);
  }
}
