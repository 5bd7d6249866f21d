package dev.bulletin.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dev.bulletin.document.Document;
import dev.bulletin.document.IndexedDocument;
import java.time.LocalDate;
import org.jspecify.annotations.Nullable;

/** Full article as served by {@code /api/articles}. The body keeps its line breaks. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ArticleResponse(
    String docId,
    String title,
    String body,
    @Nullable String url,
    @Nullable String date,
    @Nullable LocalDate datePrimary,
    @Nullable String author,
    @Nullable String issue,
    @Nullable String category) {

  static ArticleResponse from(IndexedDocument indexed) {
    Document document = indexed.document();
    return new ArticleResponse(
        indexed.docId(),
        document.title(),
        indexed.displayBody(),
        document.url(),
        document.dateRaw(),
        indexed.datePrimary().orElse(null),
        document.author(),
        document.issue(),
        document.category());
  }
}
