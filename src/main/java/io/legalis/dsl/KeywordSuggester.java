package io.legalis.dsl;

import java.util.Collection;
import java.util.Optional;

/** Suggests the closest known keyword for a misspelled word. */
public final class KeywordSuggester {
  /** Suggestions further away than this edit distance are dropped. */
  public static final int MAX_DISTANCE = 2;

  private KeywordSuggester() {}

  /**
   * Finds the keyword closest to a candidate.
   *
   * <p>A case-insensitive exact match wins immediately. Otherwise the keyword with the smallest
   * edit distance is returned if that distance is at most {@link #MAX_DISTANCE}.
   *
   * @param candidate the word as written
   * @param keywords the known keywords
   * @return the suggested keyword, or empty
   */
  public static Optional<String> suggest(String candidate, Collection<String> keywords) {
    for (String keyword : keywords) {
      if (keyword.equalsIgnoreCase(candidate)) {
        return Optional.of(keyword);
      }
    }

    String best = null;
    int bestDistance = Integer.MAX_VALUE;
    for (String keyword : keywords) {
      int distance = levenshteinDistance(candidate, keyword);
      if (distance < bestDistance) {
        best = keyword;
        bestDistance = distance;
      }
    }
    return bestDistance <= MAX_DISTANCE ? Optional.ofNullable(best) : Optional.empty();
  }

  /**
   * Computes the Levenshtein edit distance between two strings.
   *
   * @param a the first string
   * @param b the second string
   * @return the minimum number of single-character insertions, deletions and substitutions
   */
  public static int levenshteinDistance(String a, String b) {
    int[] prev = new int[b.length() + 1];
    int[] curr = new int[b.length() + 1];
    for (int j = 0; j <= b.length(); j++) {
      prev[j] = j;
    }
    for (int i = 1; i <= a.length(); i++) {
      curr[0] = i;
      for (int j = 1; j <= b.length(); j++) {
        int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
        curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
      }
      int[] tmp = prev;
      prev = curr;
      curr = tmp;
    }
    return prev[b.length()];
  }
}
