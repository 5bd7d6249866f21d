package dev.bulletin.snapshot;

import dev.bulletin.document.IndexedDocument;
import dev.bulletin.synonym.SynonymTable;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * One immutable, versioned generation of the knowledge base. A reload builds a new instance off to
 * the side; a query reads exactly one instance for its whole duration.
 *
 * @param version monotonically increasing generation number, starting at 1
 * @param fingerprint SHA-256 of the source and synonym bytes the snapshot was built from
 * @param loadedAt when the snapshot was built
 * @param documents the indexed documents in source order
 * @param synonyms the synonym table loaded together with the documents
 */
public record Snapshot(
    long version,
    String fingerprint,
    Instant loadedAt,
    List<IndexedDocument> documents,
    SynonymTable synonyms) {

  public Snapshot {
    documents = List.copyOf(documents);
  }

  public int size() {
    return documents.size();
  }

  /**
   * Looks an article up by its document identity. When several records share the id, the first in
   * source order is returned.
   */
  public Optional<IndexedDocument> findByDocId(String docId) {
    return documents.stream().filter(doc -> doc.docId().equals(docId)).findFirst();
  }
}
