package dev.bulletin.document;

import dev.bulletin.text.TextNormalizer;
import org.jspecify.annotations.Nullable;

/**
 * The two precomputed comparison forms of one document field.
 *
 * @param normalized the {@link TextNormalizer#normalize(String)} form
 * @param folded the kana-folded form, possibly of a bounded prefix only
 */
public record FieldText(String normalized, String folded) {

  static final FieldText EMPTY = new FieldText("", "");

  static FieldText of(@Nullable String raw) {
    String normalized = TextNormalizer.normalize(raw);
    return normalized.isEmpty()
        ? EMPTY
        : new FieldText(normalized, TextNormalizer.foldKana(normalized));
  }

  /** Folds only the first {@code foldLimit} characters of the normalized text. */
  static FieldText ofBounded(@Nullable String raw, int foldLimit) {
    String normalized = TextNormalizer.normalize(raw);
    if (normalized.isEmpty()) {
      return EMPTY;
    }
    if (normalized.length() <= foldLimit) {
      return new FieldText(normalized, TextNormalizer.foldKana(normalized));
    }
    int cut = foldLimit;
    if (cut > 0 && Character.isHighSurrogate(normalized.charAt(cut - 1))) {
      cut--;
    }
    return new FieldText(normalized, TextNormalizer.foldKana(normalized.substring(0, cut)));
  }

  public boolean isEmpty() {
    return normalized.isEmpty();
  }
}
