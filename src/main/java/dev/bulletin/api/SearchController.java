package dev.bulletin.api;

import dev.bulletin.search.ArticleNotFoundException;
import dev.bulletin.search.SearchRequest;
import dev.bulletin.search.SearchService;
import dev.bulletin.search.SortOrder;
import jakarta.validation.constraints.NotBlank;
import org.jspecify.annotations.Nullable;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * HTTP surface of the search core.
 *
 * <p>{@code GET /api/search} always answers 200 with {@code Cache-Control: no-store}; failures are
 * reported in the body's {@code error} field. {@code GET /api/articles} looks one article up by
 * its {@code doc_id}; a blank id is rejected with 400.
 */
@RestController
@RequestMapping("/api")
public class SearchController {

  private final SearchService searchService;
  private final int defaultPageSize;
  private final int maxPageSize;

  public SearchController(
      SearchService searchService,
      @Value("${bulletin.search.default-page-size:5}") int defaultPageSize,
      @Value("${bulletin.search.max-page-size:50}") int maxPageSize) {
    this.searchService = searchService;
    this.defaultPageSize = defaultPageSize;
    this.maxPageSize = maxPageSize;
  }

  @GetMapping("/search")
  public ResponseEntity<SearchResponse> search(
      @RequestParam(value = "q", defaultValue = "") String q,
      @RequestParam(value = "page", defaultValue = "1") int page,
      @RequestParam(value = "page_size", required = false) @Nullable Integer pageSize,
      @RequestParam(value = "order", required = false) @Nullable String order,
      @RequestParam(value = "year", required = false) @Nullable Integer year,
      @RequestParam(value = "year_from", required = false) @Nullable Integer yearFrom,
      @RequestParam(value = "year_to", required = false) @Nullable Integer yearTo,
      @RequestParam(value = "refresh", defaultValue = "false") boolean refresh) {
    int effectivePage = Math.max(1, page);
    int effectivePageSize =
        pageSize == null ? defaultPageSize : Math.min(Math.max(1, pageSize), maxPageSize);
    SortOrder sortOrder = SortOrder.fromParameter(order);

    SearchResponse body;
    try {
      SearchRequest request =
          new SearchRequest(
              q, effectivePage, effectivePageSize, sortOrder, year, yearFrom, yearTo, refresh);
      body = SearchResponse.from(searchService.search(request));
    } catch (RuntimeException e) {
      body = SearchFailureMapper.toResponse(effectivePage, effectivePageSize, sortOrder, e);
    }
    return noStore(body);
  }

  @GetMapping("/articles")
  public ArticleResponse article(@RequestParam("id") @NotBlank String id) {
    return searchService
        .findArticle(id)
        .map(ArticleResponse::from)
        .orElseThrow(() -> new ArticleNotFoundException(id));
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  ResponseEntity<SearchResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
    return noStore(
        SearchFailureMapper.toResponse(1, defaultPageSize, SortOrder.RELEVANCE, ex));
  }

  private static ResponseEntity<SearchResponse> noStore(SearchResponse body) {
    return ResponseEntity.ok().cacheControl(CacheControl.noStore()).body(body);
  }
}
