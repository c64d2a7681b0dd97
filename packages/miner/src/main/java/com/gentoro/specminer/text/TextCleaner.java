package com.gentoro.specminer.text;

import java.util.regex.Pattern;

/**
 * Normalizes free text into a training label.
 *
 * <p>Tag removal is a plain {@code <[^>]+>} match with no notion of nesting, so unbalanced angle
 * brackets in malformed markup can remove more than a tag.
 */
public final class TextCleaner {

  private static final Pattern TAG = Pattern.compile("<[^>]+>");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

  private TextCleaner() {}

  /**
   * Strips tags, turns line breaks into spaces, collapses whitespace runs and trims. Returns the
   * empty string for null or empty input.
   */
  public static String clean(String text) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    String result = TAG.matcher(text).replaceAll("");
    result = result.replace('\n', ' ').replace('\r', ' ');
    return WHITESPACE.matcher(result).replaceAll(" ").trim();
  }

  /** Number of whitespace-delimited tokens. */
  public static int tokenCount(String text) {
    if (text == null) return 0;
    String trimmed = text.trim();
    if (trimmed.isEmpty()) return 0;
    return WHITESPACE.split(trimmed).length;
  }

  /** First {@code maxCodePoints} code points of {@code text}, or the text itself when shorter. */
  public static String truncate(String text, int maxCodePoints) {
    if (text == null) return "";
    if (maxCodePoints < 0 || text.codePointCount(0, text.length()) <= maxCodePoints) return text;
    return text.substring(0, text.offsetByCodePoints(0, maxCodePoints));
  }
}
