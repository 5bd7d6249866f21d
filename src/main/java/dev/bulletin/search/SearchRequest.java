package dev.bulletin.search;

import org.jspecify.annotations.Nullable;

/**
 * One search as requested by a caller.
 *
 * @param query the raw query text
 * @param page 1-based page number
 * @param pageSize requested page size, clamped to the configured maximum when executed
 * @param order the requested total order
 * @param year explicit single-year filter, overriding any year parsed from the query
 * @param yearFrom explicit lower year bound
 * @param yearTo explicit upper year bound
 * @param refresh whether to schedule a knowledge-base reload alongside this search
 */
public record SearchRequest(
    String query,
    int page,
    int pageSize,
    SortOrder order,
    @Nullable Integer year,
    @Nullable Integer yearFrom,
    @Nullable Integer yearTo,
    boolean refresh) {

  public SearchRequest {
    if (page < 1) {
      throw new IllegalArgumentException("page must be at least 1, got: " + page);
    }
    if (pageSize < 1) {
      throw new IllegalArgumentException("pageSize must be at least 1, got: " + pageSize);
    }
    query = query == null ? "" : query;
    order = order == null ? SortOrder.RELEVANCE : order;
  }

  /** A plain query with no year override and no refresh. */
  public static SearchRequest of(String query, int page, int pageSize, SortOrder order) {
    return new SearchRequest(query, page, pageSize, order, null, null, null, false);
  }
}
