package io.intellixity.typegraph.naming;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Casing helpers for grammar identifiers such as {@code re_ele}, {@code k-ele},
 * {@code xml:lang} or {@code gloss}. Words are split on any character that is
 * not a letter or digit and on lower-to-upper case boundaries.
 */
public final class Identifiers {
  private Identifiers() {}

  public static List<String> words(String raw) {
    List<String> out = new ArrayList<>();
    if (raw == null) return out;
    StringBuilder cur = new StringBuilder();
    char prev = 0;
    for (int i = 0; i < raw.length(); i++) {
      char c = raw.charAt(i);
      if (!Character.isLetterOrDigit(c)) {
        flush(cur, out);
        prev = 0;
        continue;
      }
      boolean upperBoundary = Character.isUpperCase(c) && (Character.isLowerCase(prev) || Character.isDigit(prev));
      if (upperBoundary) flush(cur, out);
      cur.append(c);
      prev = c;
    }
    flush(cur, out);
    return out;
  }

  /** {@code re_ele} -> {@code ReEle} */
  public static String pascal(String raw) {
    StringBuilder out = new StringBuilder();
    for (String w : words(raw)) out.append(cap(w.toLowerCase(Locale.ROOT)));
    return leadingDigit(out.toString());
  }

  /** {@code re_ele} -> {@code reEle} */
  public static String camel(String raw) {
    String p = pascal(raw);
    if (p.isEmpty() || p.startsWith("_")) return p;
    return Character.toLowerCase(p.charAt(0)) + p.substring(1);
  }

  /** {@code ichi1} -> {@code ICHI1}, {@code vs-c} -> {@code VS_C} */
  public static String upperSnake(String raw) {
    String s = String.join("_", words(raw)).toUpperCase(Locale.ROOT);
    return leadingDigit(s);
  }

  /** Lower-cases the first character of an already type-cased identifier. */
  public static String decap(String s) {
    if (s == null || s.isEmpty()) return "";
    if (s.length() > 1 && Character.isUpperCase(s.charAt(1))) {
      int i = 0;
      while (i < s.length() && Character.isUpperCase(s.charAt(i))) i++;
      // "XMLLang" -> "xmlLang"; keep the start of the next word upper-case
      int cut = (i < s.length() && i > 1) ? i - 1 : i;
      return s.substring(0, cut).toLowerCase(Locale.ROOT) + s.substring(cut);
    }
    return Character.toLowerCase(s.charAt(0)) + s.substring(1);
  }

  static String cap(String w) {
    if (w.isEmpty()) return w;
    return Character.toUpperCase(w.charAt(0)) + w.substring(1);
  }

  private static String leadingDigit(String s) {
    if (!s.isEmpty() && Character.isDigit(s.charAt(0))) return "_" + s;
    return s;
  }

  private static void flush(StringBuilder cur, List<String> out) {
    if (cur.length() > 0) {
      out.add(cur.toString());
      cur.setLength(0);
    }
  }
}
