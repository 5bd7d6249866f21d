package dev.bulletin.query;

import java.util.Set;

/**
 * Inclusive year range. Bounds given in the wrong order are swapped.
 *
 * @param from lowest accepted year
 * @param to highest accepted year
 */
public record YearFilter(int from, int to) {

  public YearFilter {
    if (from > to) {
      int swap = from;
      from = to;
      to = swap;
    }
  }

  public static YearFilter single(int year) {
    return new YearFilter(year, year);
  }

  public boolean matches(int year) {
    return year >= from && year <= to;
  }

  /** Whether any of {@code years} falls inside the range. */
  public boolean intersects(Set<Integer> years) {
    for (int year : years) {
      if (matches(year)) {
        return true;
      }
    }
    return false;
  }
}
