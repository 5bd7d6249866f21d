package dev.bulletin.search;

/** Which document years a year filter is checked against. */
public enum YearFilterSource {
  /** The primary date's year plus every year mentioned in title, body or URL. */
  YEARS_SET,
  /** The primary date's year only; undated documents never pass a year filter. */
  PRIMARY_DATE
}
