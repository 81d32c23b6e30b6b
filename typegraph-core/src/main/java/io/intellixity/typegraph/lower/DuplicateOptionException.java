package io.intellixity.typegraph.lower;

import java.util.List;

/** Two options of one enumerated attribute normalize to the same tag identifier. */
public final class DuplicateOptionException extends LoweringException {
  private final String elementName;
  private final String attributeName;
  private final String identifier;
  private final List<String> literals;

  public DuplicateOptionException(String elementName, String attributeName, String identifier, List<String> literals) {
    super("Options " + literals + " of attribute '" + attributeName + "' on element '" + elementName
        + "' all normalize to identifier " + identifier);
    this.elementName = elementName;
    this.attributeName = attributeName;
    this.identifier = identifier;
    this.literals = List.copyOf(literals);
  }

  public String elementName() { return elementName; }
  public String attributeName() { return attributeName; }
  public String identifier() { return identifier; }
  public List<String> literals() { return literals; }
}
