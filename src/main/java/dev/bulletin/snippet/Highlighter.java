package dev.bulletin.snippet;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.springframework.web.util.HtmlUtils;

/**
 * Case-insensitive term marking over plain text, producing escaped HTML.
 *
 * <p>Terms are applied longest first and never overlap: once a span is marked, shorter terms cannot
 * match inside it. Everything outside the markers is escaped with {@link HtmlUtils}.
 */
public final class Highlighter {

  static final String MARK_OPEN = "<mark>";
  static final String MARK_CLOSE = "</mark>";

  private static final Comparator<String> LONGEST_FIRST =
      Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder());

  private Highlighter() {
    // static utility
  }

  /**
   * The first place any term occurs in a text.
   *
   * @param start offset of the occurrence
   * @param end offset just past the occurrence
   */
  public record Match(int start, int end) {}

  /**
   * Escapes {@code text} and wraps every occurrence of any term in {@code <mark>}.
   *
   * @param text plain text
   * @param terms terms to mark; blanks are ignored
   * @return escaped HTML
   */
  public static String highlight(String text, Collection<String> terms) {
    if (text.isEmpty()) {
      return "";
    }
    boolean[] marked = new boolean[text.length()];
    List<int[]> spans = new ArrayList<>();
    for (String term : longestFirst(terms)) {
      int length = term.length();
      int i = 0;
      while (i + length <= text.length()) {
        if (text.regionMatches(true, i, term, 0, length) && isFree(marked, i, length)) {
          for (int k = i; k < i + length; k++) {
            marked[k] = true;
          }
          spans.add(new int[] {i, i + length});
          i += length;
        } else {
          i++;
        }
      }
    }
    spans.sort(Comparator.comparingInt(span -> span[0]));

    StringBuilder html = new StringBuilder(text.length() + spans.size() * 16);
    int cursor = 0;
    for (int[] span : spans) {
      html.append(escape(text.substring(cursor, span[0])))
          .append(MARK_OPEN)
          .append(escape(text.substring(span[0], span[1])))
          .append(MARK_CLOSE);
      cursor = span[1];
    }
    html.append(escape(text.substring(cursor)));
    return html.toString();
  }

  /** Earliest occurrence of any term; on a tie the longest term wins. */
  public static Optional<Match> firstHit(String text, Collection<String> terms) {
    Match best = null;
    for (String term : longestFirst(terms)) {
      int limit = text.length() - term.length();
      if (best != null) {
        limit = Math.min(limit, best.start() - 1);
      }
      for (int i = 0; i <= limit; i++) {
        if (text.regionMatches(true, i, term, 0, term.length())) {
          best = new Match(i, i + term.length());
          break;
        }
      }
    }
    return Optional.ofNullable(best);
  }

  /** Removes the highlight markers and unescapes, giving back the visible text. */
  public static String stripMarkup(String html) {
    return HtmlUtils.htmlUnescape(html.replace(MARK_OPEN, "").replace(MARK_CLOSE, ""));
  }

  public static int visibleLength(String html) {
    return stripMarkup(html).length();
  }

  static String escape(String text) {
    return HtmlUtils.htmlEscape(text, "UTF-8");
  }

  static List<String> longestFirst(Collection<String> terms) {
    return terms.stream()
        .filter(term -> !term.isBlank())
        .distinct()
        .sorted(LONGEST_FIRST)
        .toList();
  }

  private static boolean isFree(boolean[] marked, int from, int length) {
    for (int k = from; k < from + length; k++) {
      if (marked[k]) {
        return false;
      }
    }
    return true;
  }
}
