package dev.bulletin.api;

import dev.bulletin.search.KnowledgeBaseUnavailableException;
import dev.bulletin.search.SearchErrorCode;
import dev.bulletin.search.SortOrder;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a failed search to a well-formed, empty {@link SearchResponse} carrying an error code.
 * Callers answer it with HTTP 200, so clients never handle a transport-level failure.
 */
final class SearchFailureMapper {

  private static final Logger log = LoggerFactory.getLogger(SearchFailureMapper.class);

  private SearchFailureMapper() {
    // static utility
  }

  static SearchResponse toResponse(int page, int pageSize, SortOrder order, Exception failure) {
    if (failure instanceof KnowledgeBaseUnavailableException unavailable) {
      log.debug("Search while knowledge base unavailable: {}", unavailable.getErrorCode());
      return empty(page, pageSize, order, unavailable.getErrorCode(), null);
    }
    log.error("Search failed: {}", failure.getMessage(), failure);
    String message =
        failure.getMessage() == null ? failure.getClass().getSimpleName() : failure.getMessage();
    return empty(page, pageSize, order, SearchErrorCode.EXCEPTION, message);
  }

  private static SearchResponse empty(
      int page, int pageSize, SortOrder order, SearchErrorCode code, @Nullable String message) {
    return new SearchResponse(
        List.of(), 0, page, pageSize, false, null, code.code(), order.parameterValue(), message);
  }
}
