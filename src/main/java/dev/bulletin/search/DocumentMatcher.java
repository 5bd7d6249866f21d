package dev.bulletin.search;

import dev.bulletin.document.FieldText;
import dev.bulletin.document.IndexedDocument;
import dev.bulletin.document.WeightedField;
import dev.bulletin.query.StructuredQuery;
import dev.bulletin.query.YearFilter;
import dev.bulletin.text.TextNormalizer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Evaluates a {@link StructuredQuery} against one {@link IndexedDocument}.
 *
 * <p>Gates run in order and each one can exclude the document: year filter, excluded terms,
 * required groups, phrases. Scoring:
 *
 * <ul>
 *   <li>Variants of a group that share a kana-folded form are one match class. A field counts a
 *       class as the larger of the plain occurrences of its best surface form in the normalized
 *       text and the occurrences of the folded form in the folded text; the score grows by {@code
 *       field weight * count}.
 *   <li>A class with no exact hit in a field may still hit it with one edit, worth {@code max(1,
 *       weight / 4)}. Fuzzy hits satisfy the group.
 *   <li>Each phrase adds the title bonus when found in the title, else the body bonus.
 * </ul>
 *
 * <p>The outcome depends only on the query and the document.
 */
@Component
public class DocumentMatcher {

  private static final WeightedField[] FIELDS = WeightedField.values();

  private final SearchProperties properties;

  public DocumentMatcher(SearchProperties properties) {
    this.properties = properties;
  }

  public MatchOutcome match(StructuredQuery query, IndexedDocument document) {
    if (query.isEmpty()) {
      return MatchOutcome.excluded();
    }

    Optional<YearFilter> yearFilter = query.yearFilter();
    if (yearFilter.isPresent() && !passesYearFilter(yearFilter.get(), document)) {
      return MatchOutcome.excluded();
    }

    for (List<String> group : query.notGroups()) {
      if (anyVariantPresent(group, document)) {
        return MatchOutcome.excluded();
      }
    }

    int score = 0;
    for (List<String> group : query.andGroups()) {
      int groupScore = scoreGroup(group, document);
      if (groupScore < 0) {
        return MatchOutcome.excluded();
      }
      score += groupScore;
    }

    for (String phrase : query.phrases()) {
      String folded = TextNormalizer.foldKana(phrase);
      if (contains(document.title(), phrase, folded)) {
        score += properties.getPhraseTitleBonus();
      } else if (contains(document.body(), phrase, folded)) {
        score += properties.getPhraseBodyBonus();
      } else {
        return MatchOutcome.excluded();
      }
    }

    return MatchOutcome.included(score);
  }

  private boolean passesYearFilter(YearFilter filter, IndexedDocument document) {
    return switch (properties.getYearFilterSource()) {
      case YEARS_SET -> filter.intersects(document.years());
      case PRIMARY_DATE ->
          document.datePrimary().map(date -> filter.matches(date.getYear())).orElse(false);
    };
  }

  private static boolean anyVariantPresent(List<String> group, IndexedDocument document) {
    for (String variant : group) {
      String folded = TextNormalizer.foldKana(variant);
      for (WeightedField field : FIELDS) {
        if (contains(document.field(field), variant, folded)) {
          return true;
        }
      }
    }
    return false;
  }

  /** Score contributed by one required group, or -1 when no variant hits any field. */
  private int scoreGroup(List<String> group, IndexedDocument document) {
    Map<String, List<String>> classes = matchClasses(group);
    boolean hit = false;
    int score = 0;
    for (WeightedField field : FIELDS) {
      FieldText text = document.field(field);
      if (text.isEmpty()) {
        continue;
      }
      for (Map.Entry<String, List<String>> matchClass : classes.entrySet()) {
        int count = classCount(text, matchClass.getKey(), matchClass.getValue());
        if (count > 0) {
          score += field.weight() * count;
          hit = true;
        } else if (fuzzyEligible(matchClass.getKey())
            && FuzzyMatcher.containsWithinOneEdit(text.folded(), matchClass.getKey())) {
          score += Math.max(1, field.weight() / 4);
          hit = true;
        }
      }
    }
    return hit ? score : -1;
  }

  private boolean fuzzyEligible(String folded) {
    return properties.isFuzzyEnabled()
        && folded.codePointCount(0, folded.length()) >= properties.getFuzzyMinLength();
  }

  private static Map<String, List<String>> matchClasses(List<String> group) {
    Map<String, List<String>> classes = new LinkedHashMap<>();
    for (String variant : group) {
      String folded = TextNormalizer.foldKana(variant);
      if (!folded.isEmpty()) {
        classes.computeIfAbsent(folded, key -> new ArrayList<>()).add(variant);
      }
    }
    return classes;
  }

  private static int classCount(FieldText text, String folded, List<String> surfaces) {
    int best = countOccurrences(text.folded(), folded);
    for (String surface : surfaces) {
      best = Math.max(best, countOccurrences(text.normalized(), surface));
    }
    return best;
  }

  private static boolean contains(FieldText text, String normalized, String folded) {
    if (text.isEmpty()) {
      return false;
    }
    return (!normalized.isEmpty() && text.normalized().contains(normalized))
        || (!folded.isEmpty() && text.folded().contains(folded));
  }

  static int countOccurrences(String haystack, String needle) {
    if (needle.isEmpty() || haystack.length() < needle.length()) {
      return 0;
    }
    int count = 0;
    int from = 0;
    int at;
    while ((at = haystack.indexOf(needle, from)) >= 0) {
      count++;
      from = at + needle.length();
    }
    return count;
  }
}
