package dev.bulletin.document;

import dev.bulletin.text.TextNormalizer;
import java.util.Optional;

/**
 * Computes the stable identity used to recognise two ingested records as the same article.
 *
 * <p>Precedence: an explicit source id ({@code id://}), else the canonical URL ({@code url://}),
 * else a SHA-256 of the normalized title, primary date and author ({@code hash://}).
 */
public final class DocumentIdentity {

  static final String ID_SCHEME = "id://";
  static final String URL_SCHEME = "url://";
  static final String HASH_SCHEME = "hash://";

  private DocumentIdentity() {
    // static utility
  }

  public static String docId(Document document) {
    String explicitId = document.explicitId();
    if (explicitId != null && !explicitId.isBlank()) {
      return ID_SCHEME + explicitId.strip();
    }
    Optional<String> canonicalUrl = UrlNormalizer.canonicalize(document.url());
    if (canonicalUrl.isPresent()) {
      return URL_SCHEME + canonicalUrl.get();
    }
    return HASH_SCHEME
        + ContentHasher.sha256Fields(
            TextNormalizer.normalize(document.title()),
            TextNormalizer.normalize(document.dateRaw()),
            TextNormalizer.normalize(document.author()));
  }
}
