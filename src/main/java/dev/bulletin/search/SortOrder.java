package dev.bulletin.search;

import java.util.Locale;
import org.jspecify.annotations.Nullable;

/** The two total orders a result list can be sorted by. */
public enum SortOrder {
  /** Score descending, then primary date descending, then doc id ascending. */
  RELEVANCE("relevance"),
  /** Primary date descending, then score descending, then doc id ascending. */
  LATEST("latest");

  private final String parameterValue;

  SortOrder(String parameterValue) {
    this.parameterValue = parameterValue;
  }

  public String parameterValue() {
    return parameterValue;
  }

  /**
   * Resolves a request parameter. Unknown or missing values fall back to {@link #RELEVANCE}.
   *
   * @param value the {@code order} parameter as sent
   * @return the matching order
   */
  public static SortOrder fromParameter(@Nullable String value) {
    if (value != null && LATEST.parameterValue.equals(value.strip().toLowerCase(Locale.ROOT))) {
      return LATEST;
    }
    return RELEVANCE;
  }
}
