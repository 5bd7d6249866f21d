package dev.bulletin.date;

import java.util.Optional;

/**
 * Japanese era names recognised in bulletin dates, each with the offset that turns an era year into
 * a Gregorian year.
 */
public enum Era {
  REIWA("令和", 2018),
  HEISEI("平成", 1988),
  SHOWA("昭和", 1925);

  private final String label;
  private final int offset;

  Era(String label, int offset) {
    this.label = label;
    this.offset = offset;
  }

  public String label() {
    return label;
  }

  /**
   * Converts an era year to the Gregorian year ({@code 令和2} is 2020).
   *
   * @param eraYear the 1-based year within the era
   * @return the Gregorian year
   */
  public int toGregorianYear(int eraYear) {
    return offset + eraYear;
  }

  public static Optional<Era> fromLabel(String label) {
    for (Era era : values()) {
      if (era.label.equals(label)) {
        return Optional.of(era);
      }
    }
    return Optional.empty();
  }
}
