package dev.bulletin.search;

import dev.bulletin.document.IndexedDocument;
import java.time.LocalDate;
import org.jspecify.annotations.Nullable;

/**
 * A document that matched a query, carried through deduplication and ranking.
 *
 * @param score the match score
 * @param datePrimary the document's primary date, null when it has none
 * @param docId the document identity
 * @param document the matched document
 */
public record Hit(
    int score, @Nullable LocalDate datePrimary, String docId, IndexedDocument document) {

  static Hit of(int score, IndexedDocument document) {
    return new Hit(score, document.datePrimary().orElse(null), document.docId(), document);
  }
}
