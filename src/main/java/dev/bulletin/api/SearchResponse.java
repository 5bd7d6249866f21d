package dev.bulletin.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dev.bulletin.search.SearchPage;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Body of every {@code /api/search} answer, successful or not. {@code error} is null on success,
 * otherwise one of {@code kb_missing}, {@code not_ready} or {@code exception}. {@code message} is
 * only present for {@code exception}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SearchResponse(
    List<SearchItem> items,
    int totalHits,
    int page,
    int pageSize,
    boolean hasMore,
    @Nullable Integer nextPage,
    @Nullable String error,
    String orderUsed,
    @JsonInclude(JsonInclude.Include.NON_NULL) @Nullable String message) {

  static SearchResponse from(SearchPage page) {
    return new SearchResponse(
        page.items().stream().map(SearchItem::from).toList(),
        page.totalHits(),
        page.page(),
        page.pageSize(),
        page.hasMore(),
        page.nextPage(),
        null,
        page.orderUsed().parameterValue(),
        null);
  }
}
