package dev.bulletin.search;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses hits that share a document identity and sorts the survivors into a total order.
 *
 * <p>Within a duplicate group the higher score wins, then the more recent primary date (an undated
 * hit counts as the oldest), then the earlier hit in source order. Both orders end with {@code
 * docId} ascending, so no two distinct hits ever compare equal and pagination never repeats or
 * skips an item.
 */
public final class HitRanker {

  /** Dates descending, undated last. */
  private static final Comparator<LocalDate> NEWEST_FIRST =
      Comparator.nullsLast(Comparator.<LocalDate>reverseOrder());

  static final Comparator<Hit> RELEVANCE =
      Comparator.comparingInt(Hit::score)
          .reversed()
          .thenComparing(Hit::datePrimary, NEWEST_FIRST)
          .thenComparing(Hit::docId);

  static final Comparator<Hit> LATEST =
      Comparator.comparing(Hit::datePrimary, NEWEST_FIRST)
          .thenComparing(Comparator.comparingInt(Hit::score).reversed())
          .thenComparing(Hit::docId);

  private HitRanker() {
    // static utility
  }

  /**
   * Deduplicates and sorts {@code hits}.
   *
   * @param hits every included hit of one query, in source order
   * @param order the requested total order
   * @return a new list, one hit per doc id, sorted
   */
  public static List<Hit> rank(List<Hit> hits, SortOrder order) {
    List<Hit> ranked = dedupe(hits);
    ranked.sort(comparator(order));
    return ranked;
  }

  static Comparator<Hit> comparator(SortOrder order) {
    return order == SortOrder.LATEST ? LATEST : RELEVANCE;
  }

  static List<Hit> dedupe(List<Hit> hits) {
    Map<String, Hit> byDocId = new LinkedHashMap<>();
    for (Hit hit : hits) {
      byDocId.merge(hit.docId(), hit, HitRanker::preferred);
    }
    return new ArrayList<>(byDocId.values());
  }

  private static Hit preferred(Hit kept, Hit candidate) {
    if (candidate.score() != kept.score()) {
      return candidate.score() > kept.score() ? candidate : kept;
    }
    LocalDate keptDate = kept.datePrimary();
    LocalDate candidateDate = candidate.datePrimary();
    if (candidateDate != null && (keptDate == null || candidateDate.isAfter(keptDate))) {
      return candidate;
    }
    return kept;
  }
}
