package dev.bulletin.search;

/**
 * Approximate substring search with at most one edit (insertion, deletion or substitution).
 *
 * <p>Runs the Sellers variant of the edit-distance recurrence, where a match may start anywhere in
 * the text, in {@code O(text * pattern)} time and {@code O(pattern)} space.
 */
final class FuzzyMatcher {

  private FuzzyMatcher() {
    // static utility
  }

  /**
   * Whether {@code text} contains a substring whose edit distance to {@code pattern} is at most 1.
   * Such a substring is necessarily within one character of the pattern's length.
   */
  static boolean containsWithinOneEdit(String text, String pattern) {
    int m = pattern.length();
    if (m <= 1) {
      return true;
    }
    int[] previous = new int[m + 1];
    int[] current = new int[m + 1];
    for (int i = 0; i <= m; i++) {
      previous[i] = i;
    }
    for (int j = 1; j <= text.length(); j++) {
      char t = text.charAt(j - 1);
      current[0] = 0;
      for (int i = 1; i <= m; i++) {
        int substitution = previous[i - 1] + (pattern.charAt(i - 1) == t ? 0 : 1);
        current[i] = Math.min(substitution, Math.min(previous[i], current[i - 1]) + 1);
      }
      if (current[m] <= 1) {
        return true;
      }
      int[] swap = previous;
      previous = current;
      current = swap;
    }
    return false;
  }
}
