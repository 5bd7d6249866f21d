package dev.bulletin.document;

import org.jspecify.annotations.Nullable;

/**
 * One bulletin article as produced by the ingestion side, with every key alias already resolved.
 *
 * @param title the article title (never null, may be empty)
 * @param body the article text (never null, may be empty)
 * @param url the source URL, if any
 * @param author the author, if any
 * @param dateRaw the bulletin's primary date field exactly as ingested
 * @param category the category or tags, space-joined when the source had a list
 * @param issue the bulletin issue number or label
 * @param explicitId an identifier supplied by the source system
 */
public record Document(
    String title,
    String body,
    @Nullable String url,
    @Nullable String author,
    @Nullable String dateRaw,
    @Nullable String category,
    @Nullable String issue,
    @Nullable String explicitId) {

  public Document {
    title = title == null ? "" : title;
    body = body == null ? "" : body;
  }

  /** Convenience constructor for a document with only title, body and date. */
  public Document(String title, String body, @Nullable String dateRaw) {
    this(title, body, null, null, dateRaw, null, null, null);
  }
}
