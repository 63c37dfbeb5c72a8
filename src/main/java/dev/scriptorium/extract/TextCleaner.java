package dev.scriptorium.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/** Static helpers normalizing rendered page text before it is stored. */
public final class TextCleaner {

  /** Lines shorter than this are menu fragments, bullets or stray punctuation. */
  static final int MIN_LINE_LENGTH = 4;

  private static final Set<String> NAVIGATION_TOKENS = Set.of("home", "menu", "skip");

  private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\n{3,}");

  private TextCleaner() {
    // utility class
  }

  /**
   * Clean rendered text line by line.
   *
   * <ol>
   *   <li>Trim every line and drop those shorter than {@value #MIN_LINE_LENGTH} characters
   *   <li>Drop lines that are just "home", "menu" or "skip" (any case)
   *   <li>Collapse runs of blank lines to a single blank line and trim the result
   * </ol>
   *
   * @param text raw rendered text, may be null
   * @return cleaned text, empty when nothing survives
   */
  public static String clean(String text) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    List<String> kept = new ArrayList<>();
    for (String rawLine : text.split("\n", -1)) {
      String line = strip(rawLine);
      if (line.length() < MIN_LINE_LENGTH) {
        continue;
      }
      if (NAVIGATION_TOKENS.contains(line.toLowerCase(Locale.ROOT))) {
        continue;
      }
      kept.add(line);
    }
    String joined = String.join("\n", kept);
    return strip(EXCESS_BLANK_LINES.matcher(joined).replaceAll("\n\n"));
  }

  /**
   * Number of whitespace-delimited tokens.
   *
   * @param content text to count, may be null
   * @return token count, 0 for null or blank input
   */
  public static int wordCount(String content) {
    if (content == null) {
      return 0;
    }
    int words = 0;
    boolean inWord = false;
    for (int i = 0; i < content.length(); i++) {
      boolean space = isSpace(content.charAt(i));
      if (!space && !inWord) {
        words++;
      }
      inWord = !space;
    }
    return words;
  }

  /**
   * Trim whitespace from both ends: everything {@link String#isBlank()} treats as blank, plus
   * non-breaking and other Unicode space separators.
   */
  static String strip(String value) {
    int start = 0;
    int end = value.length();
    while (start < end && isSpace(value.charAt(start))) {
      start++;
    }
    while (end > start && isSpace(value.charAt(end - 1))) {
      end--;
    }
    return value.substring(start, end);
  }

  static boolean isSpace(char c) {
    return Character.isWhitespace(c) || Character.isSpaceChar(c);
  }
}
