package com.autoinsight.mapper.service.matching;

import java.util.Locale;

import com.google.common.base.CharMatcher;

/**
 * Normalised edit-based similarity between short identifiers such as column names.
 *
 * <p>The ratio is {@code 2 * M / T * 100}, where {@code M} is the length of the longest common
 * subsequence and {@code T} the combined length of both strings. It equals 100 for identical
 * strings and 0 for strings with no character in common.
 */
public final class StringSimilarity {

  private static final CharMatcher SEPARATORS = CharMatcher.anyOf(" _-");

  private StringSimilarity() {}

  /** Lower-cases and removes spaces, underscores and hyphens. */
  public static String normalize(String name) {
    if (name == null) {
      return "";
    }
    return SEPARATORS.removeFrom(name.toLowerCase(Locale.ROOT));
  }

  /** Similarity of two already-normalised strings on a 0-100 scale. */
  public static int ratio(String a, String b) {
    int total = a.length() + b.length();
    if (total == 0) {
      return 100;
    }
    return (int) Math.round(200.0 * longestCommonSubsequence(a, b) / total);
  }

  static int longestCommonSubsequence(String a, String b) {
    int[] previous = new int[b.length() + 1];
    int[] current = new int[b.length() + 1];
    for (int i = 1; i <= a.length(); i++) {
      char ch = a.charAt(i - 1);
      for (int j = 1; j <= b.length(); j++) {
        if (ch == b.charAt(j - 1)) {
          current[j] = previous[j - 1] + 1;
        } else {
          current[j] = Math.max(previous[j], current[j - 1]);
        }
      }
      int[] swap = previous;
      previous = current;
      current = swap;
    }
    return previous[b.length()];
  }
}
