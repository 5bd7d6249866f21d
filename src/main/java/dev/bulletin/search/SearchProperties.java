package dev.bulletin.search;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for matching, scoring and paging.
 *
 * <p>Properties are bound from {@code bulletin.search.*} in application.yml.
 *
 * <ul>
 *   <li>{@code default-page-size} - page size when the request gives none (default 5)
 *   <li>{@code max-page-size} - upper bound for a requested page size (default 50)
 *   <li>{@code phrase-title-bonus} / {@code phrase-body-bonus} - score added per matched phrase
 *       (defaults 100 and 60; the title bonus must exceed the body bonus)
 *   <li>{@code fuzzy-enabled} - whether edit-distance-1 matching is attempted (default true)
 *   <li>{@code fuzzy-min-length} - shortest folded term eligible for fuzzy matching (default 3,
 *       at least 2)
 *   <li>{@code year-filter-source} - {@code YEARS_SET} or {@code PRIMARY_DATE}
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "bulletin.search")
public class SearchProperties {

  private int defaultPageSize = 5;
  private int maxPageSize = 50;
  private int phraseTitleBonus = 100;
  private int phraseBodyBonus = 60;
  private boolean fuzzyEnabled = true;
  private int fuzzyMinLength = 3;
  private YearFilterSource yearFilterSource = YearFilterSource.YEARS_SET;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (maxPageSize < 1 || maxPageSize > 200) {
      throw new IllegalStateException(
          "bulletin.search.max-page-size must be in [1, 200], got: " + maxPageSize);
    }
    if (defaultPageSize < 1 || defaultPageSize > maxPageSize) {
      throw new IllegalStateException(
          "bulletin.search.default-page-size must be in [1, max-page-size], got: "
              + defaultPageSize);
    }
    if (phraseBodyBonus < 0 || phraseTitleBonus <= phraseBodyBonus) {
      throw new IllegalStateException(
          "bulletin.search.phrase-title-bonus must exceed phrase-body-bonus (>= 0), got: "
              + phraseTitleBonus
              + " / "
              + phraseBodyBonus);
    }
    if (fuzzyMinLength < 2) {
      throw new IllegalStateException(
          "bulletin.search.fuzzy-min-length must be at least 2, got: " + fuzzyMinLength);
    }
  }

  public int getDefaultPageSize() {
    return defaultPageSize;
  }

  public void setDefaultPageSize(int defaultPageSize) {
    this.defaultPageSize = defaultPageSize;
  }

  public int getMaxPageSize() {
    return maxPageSize;
  }

  public void setMaxPageSize(int maxPageSize) {
    this.maxPageSize = maxPageSize;
  }

  public int getPhraseTitleBonus() {
    return phraseTitleBonus;
  }

  public void setPhraseTitleBonus(int phraseTitleBonus) {
    this.phraseTitleBonus = phraseTitleBonus;
  }

  public int getPhraseBodyBonus() {
    return phraseBodyBonus;
  }

  public void setPhraseBodyBonus(int phraseBodyBonus) {
    this.phraseBodyBonus = phraseBodyBonus;
  }

  public boolean isFuzzyEnabled() {
    return fuzzyEnabled;
  }

  public void setFuzzyEnabled(boolean fuzzyEnabled) {
    this.fuzzyEnabled = fuzzyEnabled;
  }

  public int getFuzzyMinLength() {
    return fuzzyMinLength;
  }

  public void setFuzzyMinLength(int fuzzyMinLength) {
    this.fuzzyMinLength = fuzzyMinLength;
  }

  public YearFilterSource getYearFilterSource() {
    return yearFilterSource;
  }

  public void setYearFilterSource(YearFilterSource yearFilterSource) {
    this.yearFilterSource = yearFilterSource;
  }
}
