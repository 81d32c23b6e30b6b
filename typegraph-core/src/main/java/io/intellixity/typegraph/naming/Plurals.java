package io.intellixity.typegraph.naming;

import java.util.Locale;

/** English pluralization of the last word of a camel-cased identifier. */
public final class Plurals {
  private Plurals() {}

  public static String plural(String word) {
    if (word == null || word.isEmpty()) return "";
    String lower = word.toLowerCase(Locale.ROOT);
    if (lower.endsWith("s") || lower.endsWith("x") || lower.endsWith("z")
        || lower.endsWith("ch") || lower.endsWith("sh")) {
      return word + "es";
    }
    if (lower.length() > 1 && lower.endsWith("y") && !isVowel(lower.charAt(lower.length() - 2))) {
      return word.substring(0, word.length() - 1) + "ies";
    }
    return word + "s";
  }

  private static boolean isVowel(char c) {
    return c == 'a' || c == 'e' || c == 'i' || c == 'o' || c == 'u';
  }
}
