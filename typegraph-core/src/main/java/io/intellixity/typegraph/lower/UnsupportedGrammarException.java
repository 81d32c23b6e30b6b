package io.intellixity.typegraph.lower;

/**
 * The grammar uses a construct that has no mapping into the type graph under the
 * current options, e.g. an element whose whole content model is a choice, or a
 * cyclic element reference.
 */
public final class UnsupportedGrammarException extends LoweringException {
  public UnsupportedGrammarException(String message) {
    super(message);
  }

  public UnsupportedGrammarException(String message, Throwable cause) {
    super(message, cause);
  }
}
