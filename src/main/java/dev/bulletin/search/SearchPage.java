package dev.bulletin.search;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * One page of results.
 *
 * @param items the rendered items of this page, in rank order
 * @param totalHits number of deduplicated hits across all pages
 * @param page the page number served
 * @param pageSize the effective page size
 * @param hasMore whether a later page holds more items
 * @param nextPage the next page number, null on the last page
 * @param orderUsed the order actually applied
 */
public record SearchPage(
    List<PageItem> items,
    int totalHits,
    int page,
    int pageSize,
    boolean hasMore,
    @Nullable Integer nextPage,
    SortOrder orderUsed) {

  public SearchPage {
    items = List.copyOf(items);
  }

  static SearchPage empty(int page, int pageSize, SortOrder order) {
    return new SearchPage(List.of(), 0, page, pageSize, false, null, order);
  }
}
