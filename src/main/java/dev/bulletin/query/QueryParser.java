package dev.bulletin.query;

import dev.bulletin.synonym.SynonymTable;
import dev.bulletin.text.TextNormalizer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Turns a raw query string into a {@link StructuredQuery}.
 *
 * <p>Grammar, applied to the normalized query:
 *
 * <ul>
 *   <li>a trailing {@code YYYY} or {@code YYYY<sep>YYYY} token (separators {@code - – — ~ 〜 ～ ..})
 *       becomes the year filter and is removed;
 *   <li>{@code "quoted text"} (straight or curly quotes) is a phrase, and each of its words is also
 *       a required term;
 *   <li>a token starting with {@code -} is excluded, {@code -"..."} excludes a phrase;
 *   <li>{@code a|b} is one required group satisfied by either part;
 *   <li>{@code X結果} is split into the two required terms {@code X} and {@code 結果}.
 * </ul>
 *
 * <p>Every term expands to itself, its kana-folded form, its katakana form and its synonyms.
 */
public final class QueryParser {

  private static final Pattern TRAILING_YEAR = Pattern.compile("^(\\d{4})$");
  private static final Pattern TRAILING_YEAR_RANGE =
      Pattern.compile("^(\\d{4})(?:-|–|—|~|〜|～|\\.\\.)(\\d{4})$");
  private static final Pattern COMPOUND_RESULT = Pattern.compile("^(.+?)結果$");
  private static final String RESULT = "結果";

  private QueryParser() {
    // static utility
  }

  /**
   * Parses {@code raw} against {@code synonyms}.
   *
   * @param raw the query as typed, may be null
   * @param synonyms the synonym table of the snapshot being searched
   * @return the structured query, {@link StructuredQuery#isEmpty() empty} for a blank query
   */
  public static StructuredQuery parse(@Nullable String raw, SynonymTable synonyms) {
    String text = TextNormalizer.normalize(raw);
    if (text.isEmpty()) {
      return StructuredQuery.empty();
    }

    Integer year = null;
    YearFilter yearRange = null;
    int lastSpace = text.lastIndexOf(' ');
    String lastToken = text.substring(lastSpace + 1);
    Matcher single = TRAILING_YEAR.matcher(lastToken);
    Matcher range = TRAILING_YEAR_RANGE.matcher(lastToken);
    if (single.matches()) {
      year = Integer.parseInt(single.group(1));
      text = lastSpace < 0 ? "" : text.substring(0, lastSpace);
    } else if (range.matches()) {
      yearRange =
          new YearFilter(Integer.parseInt(range.group(1)), Integer.parseInt(range.group(2)));
      text = lastSpace < 0 ? "" : text.substring(0, lastSpace);
    }

    List<List<String>> andGroups = new ArrayList<>();
    List<List<String>> notGroups = new ArrayList<>();
    List<String> phrases = new ArrayList<>();
    Set<String> highlight = new LinkedHashSet<>();

    for (Token token : tokenize(text)) {
      if (token.phrase()) {
        if (token.negated()) {
          notGroups.add(List.of(token.text()));
          continue;
        }
        phrases.add(token.text());
        highlight.add(token.text());
        for (String word : token.text().split(" ")) {
          addAndGroup(andGroups, highlight, expandTerm(word, synonyms));
        }
        continue;
      }

      String[] parts = splitAlternatives(token.text());
      if (parts.length == 0) {
        continue;
      }
      if (token.negated()) {
        notGroups.add(List.copyOf(expandAll(parts, synonyms)));
        continue;
      }
      Matcher compound = COMPOUND_RESULT.matcher(parts[0]);
      if (parts.length == 1 && compound.matches()) {
        addAndGroup(andGroups, highlight, expandTerm(compound.group(1), synonyms));
        addAndGroup(andGroups, highlight, expandTerm(RESULT, synonyms));
        continue;
      }
      addAndGroup(andGroups, highlight, expandAll(parts, synonyms));
    }

    return new StructuredQuery(andGroups, notGroups, phrases, year, yearRange, highlight);
  }

  /**
   * The OR-set of one query term: the term, its kana-folded and katakana forms, and every synonym
   * with its folded form. Empty strings are dropped.
   */
  static Set<String> expandTerm(String term, SynonymTable synonyms) {
    Set<String> variants = new LinkedHashSet<>();
    variants.add(term);
    variants.add(TextNormalizer.foldKana(term));
    variants.add(TextNormalizer.toKatakana(term));
    for (String synonym : synonyms.expand(term)) {
      variants.add(synonym);
      variants.add(TextNormalizer.foldKana(synonym));
    }
    variants.remove("");
    return variants;
  }

  private static Set<String> expandAll(String[] parts, SynonymTable synonyms) {
    Set<String> variants = new LinkedHashSet<>();
    for (String part : parts) {
      variants.addAll(expandTerm(part, synonyms));
    }
    return variants;
  }

  private static void addAndGroup(
      List<List<String>> andGroups, Set<String> highlight, Set<String> variants) {
    if (!variants.isEmpty()) {
      andGroups.add(List.copyOf(variants));
      highlight.addAll(variants);
    }
  }

  private static String[] splitAlternatives(String token) {
    return Arrays.stream(token.split("\\|"))
        .map(String::strip)
        .filter(part -> !part.isEmpty())
        .toArray(String[]::new);
  }

  record Token(String text, boolean negated, boolean phrase) {}

  /**
   * Splits on spaces, keeping quoted runs together. An unterminated quote runs to the end of the
   * input.
   */
  static List<Token> tokenize(String text) {
    List<Token> tokens = new ArrayList<>();
    int i = 0;
    int n = text.length();
    while (i < n) {
      char c = text.charAt(i);
      if (c == ' ') {
        i++;
        continue;
      }
      boolean negated = false;
      int start = i;
      if (c == '-' && i + 1 < n && isOpeningQuote(text.charAt(i + 1))) {
        negated = true;
        start = i + 1;
      }
      if (isOpeningQuote(text.charAt(start))) {
        int close = findClosingQuote(text, start + 1);
        String phrase = text.substring(start + 1, close).strip();
        if (!phrase.isEmpty()) {
          tokens.add(new Token(phrase, negated, true));
        }
        i = close + 1;
        continue;
      }

      int end = text.indexOf(' ', i);
      if (end < 0) {
        end = n;
      }
      String word = text.substring(i, end);
      i = end;
      if (word.startsWith("-")) {
        String excluded = word.substring(1);
        if (!excluded.isEmpty()) {
          tokens.add(new Token(excluded, true, false));
        }
      } else {
        tokens.add(new Token(word, false, false));
      }
    }
    return tokens;
  }

  private static boolean isOpeningQuote(char c) {
    return c == '"' || c == '“';
  }

  private static int findClosingQuote(String text, int from) {
    for (int i = from; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '"' || c == '”') {
        return i;
      }
    }
    return text.length();
  }
}
