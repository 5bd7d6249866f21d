package dev.bulletin.mcp;

import dev.bulletin.search.PageItem;
import dev.bulletin.snippet.Highlighter;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Formats result pages as plain text and truncates them to a token budget.
 *
 * <p>Tokens are estimated from the character count. Highlight markup is stripped and entities are
 * unescaped, since tool output is read as plain text. Results are accumulated in rank order until
 * the budget is reached; the first result is always returned, cut at the character level if it
 * alone exceeds the budget.
 */
@Component
public class TokenBudgetTruncator {

  /** Japanese text averages well under two characters per token. */
  private static final double CHARS_PER_TOKEN = 1.5;

  private final int tokenBudget;

  public TokenBudgetTruncator(@Value("${bulletin.mcp.token-budget:5000}") int tokenBudget) {
    this.tokenBudget = tokenBudget;
  }

  /**
   * Formats and truncates one page of results.
   *
   * @param items the page, in rank order
   * @return formatted text containing as many results as fit within the token budget
   */
  public String truncate(@Nullable List<PageItem> items) {
    if (items == null || items.isEmpty()) {
      return "";
    }

    StringBuilder output = new StringBuilder();
    int estimatedTokens = 0;

    for (int i = 0; i < items.size(); i++) {
      String formatted = formatItem(items.get(i));
      int itemTokens = estimateTokens(formatted);

      if (i == 0 && itemTokens > tokenBudget) {
        int maxChars = (int) (tokenBudget * CHARS_PER_TOKEN);
        output.append(formatted, 0, Math.min(maxChars, formatted.length()));
        break;
      }

      if (estimatedTokens + itemTokens > tokenBudget) {
        break;
      }

      output.append(formatted);
      estimatedTokens += itemTokens;
    }

    return output.toString();
  }

  public int getTokenBudget() {
    return tokenBudget;
  }

  int estimateTokens(String text) {
    return (int) Math.ceil(text.length() / CHARS_PER_TOKEN);
  }

  private String formatItem(PageItem item) {
    return "## [%d] %s\nDate: %s\nURL: %s\nID: %s\n\n%s\n\n---\n"
        .formatted(
            item.rank(),
            Highlighter.stripMarkup(item.titleHtml()),
            item.date() == null ? "-" : item.date(),
            item.url() == null ? "-" : item.url(),
            item.docId(),
            Highlighter.stripMarkup(item.contentHtml()));
  }
}
