package io.intellixity.typegraph.lower;

import io.intellixity.typegraph.naming.NamingResolver;

import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings for one {@link LoweringEngine}.
 *
 * @param elementChoice   how an element whose whole content model is a choice is lowered
 * @param textVariantName variant name for text in mixed content
 * @param sumSeparator    joins member names into a choice's sum type name
 * @param contentName     simple name of the mixed-content sum nested under its element
 */
public record LoweringOptions(
    ElementChoice elementChoice,
    String textVariantName,
    String sumSeparator,
    String contentName
) {
  public static final String PREFIX = "typegraph.";

  public enum ElementChoice {
    /** Fail with {@link UnsupportedGrammarException}. */
    REJECT,
    /** Lower like a sequence holding one choice group with the same options and occurrence. */
    WRAP
  }

  public LoweringOptions {
    elementChoice = elementChoice == null ? ElementChoice.REJECT : elementChoice;
    textVariantName = blankToDefault(textVariantName, "Text");
    sumSeparator = sumSeparator == null ? "Or" : sumSeparator;
    contentName = blankToDefault(contentName, "Content");
  }

  public static LoweringOptions defaults() {
    return builder().build();
  }

  /**
   * Reads {@code typegraph.elementChoice}, {@code typegraph.textVariantName},
   * {@code typegraph.sumSeparator} and {@code typegraph.contentName}; missing keys keep defaults.
   */
  public static LoweringOptions fromProperties(Properties p) {
    Objects.requireNonNull(p, "properties");
    Builder b = builder();
    String ec = p.getProperty(PREFIX + "elementChoice");
    if (ec != null && !ec.isBlank()) {
      try {
        b.elementChoice(ElementChoice.valueOf(ec.trim().toUpperCase(Locale.ROOT)));
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Invalid " + PREFIX + "elementChoice: " + ec + " (expected REJECT or WRAP)", e);
      }
    }
    b.textVariantName(p.getProperty(PREFIX + "textVariantName"));
    b.sumSeparator(p.getProperty(PREFIX + "sumSeparator"));
    b.contentName(p.getProperty(PREFIX + "contentName"));
    return b.build();
  }

  public NamingResolver namingResolver() {
    return new NamingResolver(sumSeparator, contentName, textVariantName);
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private ElementChoice elementChoice;
    private String textVariantName;
    private String sumSeparator;
    private String contentName;

    public Builder elementChoice(ElementChoice elementChoice) {
      this.elementChoice = elementChoice;
      return this;
    }

    public Builder textVariantName(String textVariantName) {
      this.textVariantName = textVariantName;
      return this;
    }

    public Builder sumSeparator(String sumSeparator) {
      this.sumSeparator = sumSeparator;
      return this;
    }

    public Builder contentName(String contentName) {
      this.contentName = contentName;
      return this;
    }

    public LoweringOptions build() {
      return new LoweringOptions(elementChoice, textVariantName, sumSeparator, contentName);
    }
  }

  private static String blankToDefault(String v, String d) {
    return v == null || v.isBlank() ? d : v.trim();
  }
}
