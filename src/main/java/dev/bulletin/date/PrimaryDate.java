package dev.bulletin.date;

import java.time.LocalDate;

/**
 * The recognised shapes of a bulletin's primary date, each normalised to one canonical {@link
 * LocalDate}. Missing month or day components default to 1.
 */
public sealed interface PrimaryDate
    permits PrimaryDate.ExactDate,
        PrimaryDate.YearMonth,
        PrimaryDate.YearOnly,
        PrimaryDate.EraBased {

  LocalDate toLocalDate();

  default int year() {
    return toLocalDate().getYear();
  }

  /** {@code YYYY-MM-DD}, {@code YYYY/MM/DD}, {@code YYYY.MM.DD} or {@code YYYY年MM月DD日}. */
  record ExactDate(int year, int month, int day) implements PrimaryDate {
    @Override
    public LocalDate toLocalDate() {
      return LocalDate.of(year, month, day);
    }
  }

  /** A year and month without a day. */
  record YearMonth(int year, int month) implements PrimaryDate {
    @Override
    public LocalDate toLocalDate() {
      return LocalDate.of(year, month, 1);
    }
  }

  /** A bare year. */
  record YearOnly(int year) implements PrimaryDate {
    @Override
    public LocalDate toLocalDate() {
      return LocalDate.of(year, 1, 1);
    }
  }

  /**
   * An era-relative date such as {@code 平成12年4月}.
   *
   * @param era the era
   * @param eraYear the 1-based year within the era ({@code 元年} is 1)
   * @param month the month, 1 when absent
   * @param day the day of month, 1 when absent
   */
  record EraBased(Era era, int eraYear, int month, int day) implements PrimaryDate {
    @Override
    public LocalDate toLocalDate() {
      return LocalDate.of(era.toGregorianYear(eraYear), month, day);
    }
  }
}
