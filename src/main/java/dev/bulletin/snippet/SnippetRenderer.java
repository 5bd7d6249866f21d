package dev.bulletin.snippet;

import dev.bulletin.document.IndexedDocument;
import java.util.Collection;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Builds the display title and excerpt of a result.
 *
 * <p>The top result gets the head of the body. Every other result gets a window of {@code side}
 * characters either side of the first highlighted term, or a shorter head when no term occurs in
 * the body. Window edges move to the nearest sentence punctuation, whitespace or line start within
 * {@code boundary-lookaround} characters. An ellipsis marks each side that does not reach the end
 * of the body. If the visible text still exceeds the budget plus slack, the plain text is cut again
 * and re-escaped.
 */
@Component
public class SnippetRenderer {

  static final String ELLIPSIS = "…";
  static final String UNTITLED = "(無題)";

  private static final String BOUNDARY_CHARS = "。．.！!？?、,\n";
  private static final char LIST_MARKER = '•';

  private final SnippetProperties properties;

  public SnippetRenderer(SnippetProperties properties) {
    this.properties = properties;
  }

  /**
   * Renders one result.
   *
   * @param document the matched document
   * @param terms the query's highlight terms
   * @param firstResult whether this is rank 1, which gets the long head excerpt
   * @return escaped, highlighted title and excerpt
   */
  public RenderedSnippet render(
      IndexedDocument document, Collection<String> terms, boolean firstResult) {
    String title = document.title().normalized();
    String titleHtml = Highlighter.highlight(title.isEmpty() ? UNTITLED : title, terms);
    String contentHtml = renderContent(document.displayBody(), terms, firstResult);
    return new RenderedSnippet(titleHtml, contentHtml);
  }

  String renderContent(String body, Collection<String> terms, boolean firstResult) {
    if (body.isEmpty()) {
      return "";
    }
    if (firstResult) {
      return head(body, terms, properties.getHeadBudget());
    }
    Optional<Highlighter.Match> hit = Highlighter.firstHit(body, terms);
    if (hit.isEmpty()) {
      return head(body, terms, properties.getFallbackBudget());
    }
    return window(body, terms, hit.get());
  }

  private String head(String body, Collection<String> terms, int budget) {
    if (body.length() <= budget) {
      return Highlighter.highlight(body, terms);
    }
    int end = budget;
    for (int p = budget; p >= Math.max(1, budget - properties.getBoundaryLookaround()); p--) {
      if (isSafeEnd(body, p)) {
        end = p;
        break;
      }
    }
    return finish(body, terms, 0, surrogateSafe(body, end), budget);
  }

  private String window(String body, Collection<String> terms, Highlighter.Match hit) {
    int side = properties.getSide();
    int start = Math.max(0, hit.start() - side);
    int end = Math.min(body.length(), Math.max(hit.start() + side, hit.end()));
    if (start > 0) {
      start = nudgeStart(body, start, hit.start());
    }
    if (end < body.length()) {
      end = nudgeEnd(body, end, hit.end());
    }
    return finish(body, terms, start, end, 2 * side);
  }

  /** Moves a window start outward, else inward up to {@code limit}, onto a safe boundary. */
  private int nudgeStart(String body, int start, int limit) {
    int lookaround = properties.getBoundaryLookaround();
    for (int p = start; p >= Math.max(0, start - lookaround); p--) {
      if (isSafeStart(body, p)) {
        return p;
      }
    }
    for (int p = start + 1; p <= Math.min(limit, start + lookaround); p++) {
      if (isSafeStart(body, p)) {
        return p;
      }
    }
    return Character.isLowSurrogate(body.charAt(start)) ? start - 1 : start;
  }

  /** Moves a window end outward, else inward down to {@code limit}, onto a safe boundary. */
  private int nudgeEnd(String body, int end, int limit) {
    int lookaround = properties.getBoundaryLookaround();
    for (int p = end; p <= Math.min(body.length(), end + lookaround); p++) {
      if (isSafeEnd(body, p)) {
        return p;
      }
    }
    for (int p = end - 1; p >= Math.max(limit, end - lookaround); p--) {
      if (isSafeEnd(body, p)) {
        return p;
      }
    }
    return surrogateSafe(body, end);
  }

  private String finish(String body, Collection<String> terms, int start, int end, int budget) {
    boolean leading = start > 0;
    boolean trailing = end < body.length();
    String core = body.substring(start, end).strip();
    String html = assemble(core, terms, leading, trailing);

    int cap = budget + properties.getSlack();
    if (Highlighter.visibleLength(html) > cap) {
      int room = cap - ELLIPSIS.length() - (leading ? ELLIPSIS.length() : 0);
      core = core.substring(0, surrogateSafe(core, Math.min(room, core.length()))).strip();
      html = assemble(core, terms, leading, true);
    }
    return html;
  }

  private static String assemble(
      String core, Collection<String> terms, boolean leading, boolean trailing) {
    return (leading ? ELLIPSIS : "")
        + Highlighter.highlight(core, terms)
        + (trailing ? ELLIPSIS : "");
  }

  private static boolean isSafeStart(String body, int p) {
    if (p == 0) {
      return true;
    }
    if (p >= body.length() || Character.isLowSurrogate(body.charAt(p))) {
      return false;
    }
    return body.charAt(p) == LIST_MARKER || isBoundary(body.charAt(p - 1));
  }

  private static boolean isSafeEnd(String body, int p) {
    if (p >= body.length()) {
      return true;
    }
    if (p <= 0) {
      return false;
    }
    return isBoundary(body.charAt(p - 1)) || body.charAt(p) == LIST_MARKER;
  }

  private static boolean isBoundary(char c) {
    return BOUNDARY_CHARS.indexOf(c) >= 0 || Character.isWhitespace(c);
  }

  /** Pulls a cut position back so it does not split a surrogate pair. */
  private static int surrogateSafe(String text, int cut) {
    if (cut > 0 && cut < text.length() && Character.isHighSurrogate(text.charAt(cut - 1))) {
      return cut - 1;
    }
    return cut;
  }
}
