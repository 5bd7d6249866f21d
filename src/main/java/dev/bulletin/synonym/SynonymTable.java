package dev.bulletin.synonym;

import dev.bulletin.text.TextNormalizer;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Immutable canonical/variant term table.
 *
 * <p>Lookups are keyed by the kana-folded form of a term, so {@code コケ} and {@code こけ} hit the
 * same entry. {@link #expand(String)} returns the symmetric closure within one hop: a canonical
 * term expands to its variants, a variant expands to its canonical terms and their other
 * variants.
 */
public final class SynonymTable {

  private static final SynonymTable EMPTY = new SynonymTable(Map.of(), Map.of(), 0);

  private final Map<String, Set<String>> variantsByCanonical;
  private final Map<String, Set<String>> canonicalsByVariant;
  private final int pairCount;

  private SynonymTable(
      Map<String, Set<String>> variantsByCanonical,
      Map<String, Set<String>> canonicalsByVariant,
      int pairCount) {
    this.variantsByCanonical = variantsByCanonical;
    this.canonicalsByVariant = canonicalsByVariant;
    this.pairCount = pairCount;
  }

  public static SynonymTable empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Expands a term to itself plus every synonym reachable within one hop of the table.
   *
   * @param term the query term
   * @return an unmodifiable, insertion-ordered set that always contains {@code term}
   */
  public Set<String> expand(String term) {
    Set<String> expanded = new LinkedHashSet<>();
    expanded.add(term);
    String key = TextNormalizer.foldKana(term);
    if (key.isEmpty()) {
      return Collections.unmodifiableSet(expanded);
    }
    expanded.addAll(variantsByCanonical.getOrDefault(key, Set.of()));
    for (String canonical : canonicalsByVariant.getOrDefault(key, Set.of())) {
      expanded.add(canonical);
      expanded.addAll(
          variantsByCanonical.getOrDefault(TextNormalizer.foldKana(canonical), Set.of()));
    }
    return Collections.unmodifiableSet(expanded);
  }

  /** Number of distinct canonical/variant pairs. */
  public int size() {
    return pairCount;
  }

  public boolean isEmpty() {
    return pairCount == 0;
  }

  /** Accumulates pairs; duplicates and self-pairs are ignored. */
  public static final class Builder {

    private final Map<String, Set<String>> variantsByCanonical = new LinkedHashMap<>();
    private final Map<String, Set<String>> canonicalsByVariant = new LinkedHashMap<>();
    private final Set<String> seenPairs = new LinkedHashSet<>();

    private Builder() {}

    public Builder add(String canonical, String variant) {
      String canonicalTerm = TextNormalizer.normalize(canonical);
      String variantTerm = TextNormalizer.normalize(variant);
      String canonicalKey = TextNormalizer.foldKana(canonicalTerm);
      String variantKey = TextNormalizer.foldKana(variantTerm);
      if (canonicalKey.isEmpty() || variantKey.isEmpty()) {
        return this;
      }
      if (canonicalTerm.equals(variantTerm)
          || !seenPairs.add(canonicalTerm + '\u001F' + variantTerm)) {
        return this;
      }
      variantsByCanonical
          .computeIfAbsent(canonicalKey, k -> new LinkedHashSet<>())
          .add(variantTerm);
      canonicalsByVariant
          .computeIfAbsent(variantKey, k -> new LinkedHashSet<>())
          .add(canonicalTerm);
      return this;
    }

    public SynonymTable build() {
      if (seenPairs.isEmpty()) {
        return EMPTY;
      }
      return new SynonymTable(
          freeze(variantsByCanonical), freeze(canonicalsByVariant), seenPairs.size());
    }

    private static Map<String, Set<String>> freeze(Map<String, Set<String>> source) {
      Map<String, Set<String>> copy = new LinkedHashMap<>();
      source.forEach(
          (key, values) -> copy.put(key, Collections.unmodifiableSet(new LinkedHashSet<>(values))));
      return Collections.unmodifiableMap(copy);
    }
  }
}
