package dev.bulletin.mcp;

import dev.bulletin.document.Document;
import dev.bulletin.document.IndexedDocument;
import dev.bulletin.search.SearchPage;
import dev.bulletin.search.SearchRequest;
import dev.bulletin.search.SearchService;
import dev.bulletin.search.SortOrder;
import dev.bulletin.snapshot.KnowledgeBaseReloader;
import dev.bulletin.snapshot.ReloadStatus;
import dev.bulletin.snapshot.Snapshot;
import dev.bulletin.snapshot.SnapshotHolder;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing bulletin search as tool methods.
 *
 * <p>Each method is annotated with {@code @Tool} and registered via {@link McpToolConfig}. Tool
 * methods never throw: every exception is caught and returned as a descriptive error string.
 *
 * <p>Tools: {@code search_bulletins}, {@code show_article}, {@code kb_status}.
 *
 * @see TokenBudgetTruncator
 */
@Service
public class McpToolService {

  private static final Logger log = LoggerFactory.getLogger(McpToolService.class);

  private static final int DEFAULT_PAGE_SIZE = 10;

  private final SearchService searchService;
  private final SnapshotHolder snapshotHolder;
  private final KnowledgeBaseReloader reloader;
  private final TokenBudgetTruncator truncator;

  public McpToolService(
      SearchService searchService,
      SnapshotHolder snapshotHolder,
      KnowledgeBaseReloader reloader,
      TokenBudgetTruncator truncator) {
    this.searchService = searchService;
    this.snapshotHolder = snapshotHolder;
    this.reloader = reloader;
    this.truncator = truncator;
  }

  /** Runs a bulletin search and returns one page of plain-text excerpts within the token budget. */
  @Tool(
      name = "search_bulletins",
      description =
          "Search club bulletin articles. Supports synonyms, -exclusion, \"quoted phrases\", "
              + "a|b alternatives and a trailing year or year range such as 2019 or 2018-2020. "
              + "Returns titles, dates, URLs, article IDs and excerpts.")
  public String searchBulletins(
      @ToolParam(description = "Search query text") @Nullable String query,
      @ToolParam(description = "1-based page number (default 1)", required = false)
          @Nullable Integer page,
      @ToolParam(description = "Results per page (default 10)", required = false)
          @Nullable Integer pageSize,
      @ToolParam(description = "Sort order: relevance (default) or latest", required = false)
          @Nullable String order) {
    try {
      if (query == null || query.isBlank()) {
        return "Error: Query must not be empty. Provide a search query string.";
      }
      int effectivePage = page == null ? 1 : Math.max(1, page);
      int effectiveSize = pageSize == null ? DEFAULT_PAGE_SIZE : Math.max(1, pageSize);
      SearchPage result =
          searchService.search(
              SearchRequest.of(
                  query, effectivePage, effectiveSize, SortOrder.fromParameter(order)));

      if (result.items().isEmpty()) {
        return result.totalHits() == 0
            ? "No results found for '%s'.".formatted(query)
            : "No results on page %d; the query matched %d articles."
                .formatted(effectivePage, result.totalHits());
      }

      String header =
          "%d articles matched (page %d, sorted by %s).%n%n"
              .formatted(
                  result.totalHits(), result.page(), result.orderUsed().parameterValue());
      String footer =
          result.hasMore() ? "%nMore results: request page %d.".formatted(result.nextPage()) : "";
      return header + truncator.truncate(result.items()) + footer;
    } catch (Exception e) {
      log.debug("search_bulletins failed for [{}]", query, e);
      return "Error searching bulletins: " + e.getMessage();
    }
  }

  /** Returns the full text of one article by the ID shown in search results. */
  @Tool(
      name = "show_article",
      description = "Show the full text and metadata of one bulletin article by its article ID.")
  public String showArticle(
      @ToolParam(description = "Article ID as returned by search_bulletins") @Nullable String id) {
    try {
      if (id == null || id.isBlank()) {
        return "Error: Article ID must not be empty.";
      }
      Optional<IndexedDocument> found = searchService.findArticle(id);
      if (found.isEmpty()) {
        return "Error: Article %s not found.".formatted(id.strip());
      }
      return formatArticle(found.get());
    } catch (Exception e) {
      return "Error showing article: " + e.getMessage();
    }
  }

  /** Reports the loaded snapshot and the reload state. */
  @Tool(
      name = "kb_status",
      description =
          "Report how many bulletin articles are loaded and the state of the last reload.")
  public String kbStatus() {
    try {
      ReloadStatus status = reloader.status();
      Optional<Snapshot> snapshot = snapshotHolder.current();
      StringBuilder sb = new StringBuilder();
      if (snapshot.isPresent()) {
        Snapshot current = snapshot.get();
        sb.append(
            "Articles: %,d | snapshot version: %d | loaded at: %s%n"
                .formatted(current.size(), current.version(), current.loadedAt()));
      } else {
        sb.append(
            status.sourceMissing()
                ? "No knowledge base loaded: the source file is missing.%n".formatted()
                : "No knowledge base loaded yet.%n".formatted());
      }
      sb.append(
          "Last reload: %s%s%s"
              .formatted(
                  status.lastOutcome() == null ? "never" : status.lastOutcome(),
                  status.lastFinishedAt() == null ? "" : " at " + status.lastFinishedAt(),
                  status.running() ? " (reload running)" : ""));
      if (status.lastError() != null) {
        sb.append("%nLast error: %s".formatted(status.lastError()));
      }
      return sb.toString();
    } catch (Exception e) {
      return "Error reading knowledge base status: " + e.getMessage();
    }
  }

  private static String formatArticle(IndexedDocument article) {
    Document document = article.document();
    String title = article.title().normalized();
    StringBuilder sb = new StringBuilder();
    sb.append("# ").append(title.isEmpty() ? "(無題)" : title).append('\n');
    appendLine(sb, "ID", article.docId());
    appendLine(sb, "Date", document.dateRaw());
    appendLine(sb, "Issue", document.issue());
    appendLine(sb, "Author", document.author());
    appendLine(sb, "Category", document.category());
    appendLine(sb, "URL", document.url());
    sb.append('\n').append(article.displayBody());
    return sb.toString();
  }

  private static void appendLine(StringBuilder sb, String label, @Nullable String value) {
    if (value != null && !value.isBlank()) {
      sb.append(label).append(": ").append(value).append('\n');
    }
  }
}
