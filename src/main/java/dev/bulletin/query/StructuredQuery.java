package dev.bulletin.query;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * A parsed search query.
 *
 * @param andGroups required groups; each inner list is an OR-set of term variants
 * @param notGroups excluded groups; a document matching any variant of any group is dropped
 * @param phrases quoted substrings required verbatim in the title or body
 * @param year single-year filter from a trailing {@code YYYY} token
 * @param yearRange range filter from a trailing {@code YYYY-YYYY} token
 * @param highlightTerms every term variant worth marking in rendered output
 */
public record StructuredQuery(
    List<List<String>> andGroups,
    List<List<String>> notGroups,
    List<String> phrases,
    @Nullable Integer year,
    @Nullable YearFilter yearRange,
    Set<String> highlightTerms) {

  public StructuredQuery {
    andGroups = andGroups.stream().map(List::copyOf).toList();
    notGroups = notGroups.stream().map(List::copyOf).toList();
    phrases = List.copyOf(phrases);
    highlightTerms = Set.copyOf(highlightTerms);
  }

  public static StructuredQuery empty() {
    return new StructuredQuery(List.of(), List.of(), List.of(), null, null, Set.of());
  }

  /** True when there is nothing to match; such a query yields no results. */
  public boolean isEmpty() {
    return andGroups.isEmpty() && notGroups.isEmpty() && phrases.isEmpty();
  }

  /** The effective year filter, if the query carries one. */
  public Optional<YearFilter> yearFilter() {
    if (yearRange != null) {
      return Optional.of(yearRange);
    }
    return year == null ? Optional.empty() : Optional.of(YearFilter.single(year));
  }

  /**
   * Replaces any parsed year filter with explicitly requested bounds. When none of the arguments is
   * set the query is returned unchanged.
   *
   * @param explicitYear a single year, taking precedence over the range bounds
   * @param from lower bound, open when null
   * @param to upper bound, open when null
   * @return the query with the overridden filter
   */
  public StructuredQuery withYearOverride(
      @Nullable Integer explicitYear, @Nullable Integer from, @Nullable Integer to) {
    if (explicitYear != null) {
      return new StructuredQuery(andGroups, notGroups, phrases, explicitYear, null, highlightTerms);
    }
    if (from == null && to == null) {
      return this;
    }
    int lower = from == null ? Integer.MIN_VALUE : from;
    int upper = to == null ? Integer.MAX_VALUE : to;
    YearFilter range = new YearFilter(lower, upper);
    return new StructuredQuery(andGroups, notGroups, phrases, null, range, highlightTerms);
  }
}
