package io.intellixity.typegraph.json;

/** Grammar JSON that does not describe a grammar model. */
public final class GrammarFormatException extends RuntimeException {
  private final String path;

  public GrammarFormatException(String path, String message) {
    super(path + ": " + message);
    this.path = path;
  }

  public GrammarFormatException(String path, String message, Throwable cause) {
    super(path + ": " + message, cause);
    this.path = path;
  }

  /** JSON path of the offending node, e.g. {@code $.elements[2].content}. */
  public String path() { return path; }
}
