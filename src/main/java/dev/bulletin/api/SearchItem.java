package dev.bulletin.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dev.bulletin.search.PageItem;
import java.time.LocalDate;
import org.jspecify.annotations.Nullable;

/** One result as serialized on {@code /api/search}. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SearchItem(
    String title,
    String content,
    @Nullable String url,
    int rank,
    @Nullable String date,
    @Nullable LocalDate datePrimary,
    String docId) {

  static SearchItem from(PageItem item) {
    return new SearchItem(
        item.titleHtml(),
        item.contentHtml(),
        item.url(),
        item.rank(),
        item.date(),
        item.datePrimary(),
        item.docId());
  }
}
