package dev.bulletin.fixture;

import dev.bulletin.document.Document;
import dev.bulletin.document.IndexedDocument;
import org.jspecify.annotations.Nullable;

/**
 * Lightweight test builder for {@link Document} and {@link IndexedDocument}. Provides sensible
 * defaults so tests only override what they care about.
 *
 * <pre>{@code
 * IndexedDocument doc = new DocumentBuilder().title("苔玉の作り方").date("2021-05-01").indexed();
 * }</pre>
 */
public final class DocumentBuilder {

  public static final int FOLD_BODY_LIMIT = 20_000;

  private String title = "会報記事";
  private String body = "";
  private @Nullable String url;
  private @Nullable String author;
  private @Nullable String date;
  private @Nullable String category;
  private @Nullable String issue;
  private @Nullable String id;

  public DocumentBuilder title(String title) {
    this.title = title;
    return this;
  }

  public DocumentBuilder body(String body) {
    this.body = body;
    return this;
  }

  public DocumentBuilder url(@Nullable String url) {
    this.url = url;
    return this;
  }

  public DocumentBuilder author(@Nullable String author) {
    this.author = author;
    return this;
  }

  public DocumentBuilder date(@Nullable String date) {
    this.date = date;
    return this;
  }

  public DocumentBuilder category(@Nullable String category) {
    this.category = category;
    return this;
  }

  public DocumentBuilder issue(@Nullable String issue) {
    this.issue = issue;
    return this;
  }

  public DocumentBuilder id(@Nullable String id) {
    this.id = id;
    return this;
  }

  public Document build() {
    return new Document(title, body, url, author, date, category, issue, id);
  }

  public IndexedDocument indexed() {
    return IndexedDocument.from(build(), FOLD_BODY_LIMIT);
  }
}
