package dev.bulletin.search;

import dev.bulletin.document.Document;
import dev.bulletin.document.IndexedDocument;
import dev.bulletin.query.QueryParser;
import dev.bulletin.query.StructuredQuery;
import dev.bulletin.snapshot.KnowledgeBaseReloader;
import dev.bulletin.snapshot.Snapshot;
import dev.bulletin.snapshot.SnapshotHolder;
import dev.bulletin.snippet.Highlighter;
import dev.bulletin.snippet.RenderedSnippet;
import dev.bulletin.snippet.SnippetRenderer;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Search orchestration over the live snapshot: parse, match every document, deduplicate and sort,
 * slice the requested page, render it.
 *
 * <p>The snapshot is read once per call, so a reload publishing mid-query does not affect it. A
 * document that fails to match or render is logged and skipped (or rendered plainly); it never
 * fails the whole search.
 */
@Service
public class SearchService {

  private static final Logger log = LoggerFactory.getLogger(SearchService.class);

  private final SnapshotHolder snapshotHolder;
  private final KnowledgeBaseReloader reloader;
  private final DocumentMatcher matcher;
  private final SnippetRenderer renderer;
  private final SearchProperties properties;

  public SearchService(
      SnapshotHolder snapshotHolder,
      KnowledgeBaseReloader reloader,
      DocumentMatcher matcher,
      SnippetRenderer renderer,
      SearchProperties properties) {
    this.snapshotHolder = snapshotHolder;
    this.reloader = reloader;
    this.matcher = matcher;
    this.renderer = renderer;
    this.properties = properties;
  }

  /**
   * Runs one search.
   *
   * @param request the search parameters
   * @return the requested page
   * @throws KnowledgeBaseUnavailableException if no snapshot has been published yet
   */
  public SearchPage search(SearchRequest request) {
    if (request.refresh()) {
      reloader.requestReload();
    }
    Snapshot snapshot = requireSnapshot();

    int page = request.page();
    int pageSize = Math.min(request.pageSize(), properties.getMaxPageSize());
    StructuredQuery query =
        QueryParser.parse(request.query(), snapshot.synonyms())
            .withYearOverride(request.year(), request.yearFrom(), request.yearTo());
    if (query.isEmpty()) {
      return SearchPage.empty(page, pageSize, request.order());
    }

    List<Hit> hits = new ArrayList<>();
    for (IndexedDocument document : snapshot.documents()) {
      try {
        if (matcher.match(query, document) instanceof MatchOutcome.Included included) {
          hits.add(Hit.of(included.score(), document));
        }
      } catch (RuntimeException e) {
        log.warn(
            "Skipping document {} that failed to match: {}", document.docId(), e.getMessage());
      }
    }
    List<Hit> ranked = HitRanker.rank(hits, request.order());

    int total = ranked.size();
    long firstIndex = (long) (page - 1) * pageSize;
    int from = (int) Math.min(firstIndex, total);
    int to = Math.min(from + pageSize, total);
    List<PageItem> items = new ArrayList<>(to - from);
    for (int i = from; i < to; i++) {
      items.add(toItem(ranked.get(i), i + 1, query));
    }
    boolean hasMore = to < total;

    log.debug(
        "Query [{}] and={} not={} phrases={} matched {} of {} (deduplicated {}), page {}",
        request.query(),
        query.andGroups().size(),
        query.notGroups().size(),
        query.phrases().size(),
        hits.size(),
        snapshot.size(),
        total,
        page);
    return new SearchPage(
        items, total, page, pageSize, hasMore, hasMore ? page + 1 : null, request.order());
  }

  /**
   * Looks up one article in the live snapshot.
   *
   * @param docId the document identity as returned in search results
   * @return the article, or empty if the live snapshot has no such document
   * @throws KnowledgeBaseUnavailableException if no snapshot has been published yet
   */
  public Optional<IndexedDocument> findArticle(String docId) {
    return requireSnapshot().findByDocId(docId.strip());
  }

  private Snapshot requireSnapshot() {
    return snapshotHolder
        .current()
        .orElseThrow(
            () ->
                new KnowledgeBaseUnavailableException(
                    reloader.status().sourceMissing()
                        ? SearchErrorCode.KB_MISSING
                        : SearchErrorCode.NOT_READY));
  }

  private PageItem toItem(Hit hit, int rank, StructuredQuery query) {
    IndexedDocument indexed = hit.document();
    Document document = indexed.document();
    String titleHtml;
    String contentHtml;
    try {
      RenderedSnippet snippet = renderer.render(indexed, query.highlightTerms(), rank == 1);
      titleHtml = snippet.titleHtml();
      contentHtml = snippet.contentHtml();
    } catch (RuntimeException e) {
      log.warn(
          "Rendering failed for document {}, using plain title: {}", hit.docId(), e.getMessage());
      titleHtml = Highlighter.highlight(indexed.title().normalized(), List.of());
      contentHtml = "";
    }
    return new PageItem(
        rank,
        hit.docId(),
        titleHtml,
        contentHtml,
        document.url(),
        document.dateRaw(),
        hit.datePrimary());
  }
}
