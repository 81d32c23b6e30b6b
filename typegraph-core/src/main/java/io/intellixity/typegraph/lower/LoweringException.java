package io.intellixity.typegraph.lower;

/**
 * Raised when a grammar cannot be lowered into a type graph. Lowering is a pure
 * function of its input, so a failure is never transient.
 */
public class LoweringException extends RuntimeException {
  public LoweringException(String message) {
    super(message);
  }

  public LoweringException(String message, Throwable cause) {
    super(message, cause);
  }
}
