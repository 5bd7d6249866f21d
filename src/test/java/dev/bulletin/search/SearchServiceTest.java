package dev.bulletin.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

import dev.bulletin.document.IndexedDocument;
import dev.bulletin.fixture.DocumentBuilder;
import dev.bulletin.snapshot.KnowledgeBaseReloader;
import dev.bulletin.snapshot.ReloadOutcome;
import dev.bulletin.snapshot.ReloadStatus;
import dev.bulletin.snapshot.Snapshot;
import dev.bulletin.snapshot.SnapshotHolder;
import dev.bulletin.snippet.SnippetProperties;
import dev.bulletin.snippet.SnippetRenderer;
import dev.bulletin.synonym.SynonymTable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SearchServiceTest {

  @Mock
  @SuppressWarnings("NullAway.Init")
  KnowledgeBaseReloader reloader;

  private final SnapshotHolder holder = new SnapshotHolder();
  private SearchService searchService;

  @BeforeEach
  void setUp() {
    searchService =
        new SearchService(
            holder,
            reloader,
            new DocumentMatcher(new SearchProperties()),
            new SnippetRenderer(new SnippetProperties()),
            new SearchProperties());
  }

  private void publish(SynonymTable synonyms, IndexedDocument... documents) {
    holder.publish(new Snapshot(1, "fp", Instant.EPOCH, List.of(documents), synonyms));
  }

  private void publish(IndexedDocument... documents) {
    publish(SynonymTable.empty(), documents);
  }

  private SearchPage search(String query, int page, int pageSize) {
    return searchService.search(SearchRequest.of(query, page, pageSize, SortOrder.RELEVANCE));
  }

  private static List<String> docIds(SearchPage page) {
    return page.items().stream().map(PageItem::docId).toList();
  }

  @Nested
  class Paging {

    @BeforeEach
    void twelveMatchingDocuments() {
      List<IndexedDocument> documents = new ArrayList<>();
      for (int i = 1; i <= 12; i++) {
        documents.add(
            new DocumentBuilder().id("%02d".formatted(i)).title("例会報告").body("例会").indexed());
      }
      publish(documents.toArray(IndexedDocument[]::new));
    }

    @Test
    void firstPageHasRanksOneToFive() {
      SearchPage page = search("例会", 1, 5);

      assertThat(page.items()).extracting(PageItem::rank).containsExactly(1, 2, 3, 4, 5);
      assertThat(page.totalHits()).isEqualTo(12);
      assertThat(page.hasMore()).isTrue();
      assertThat(page.nextPage()).isEqualTo(2);
    }

    @Test
    void secondPageContinuesTheRanking() {
      SearchPage page = search("例会", 2, 5);

      assertThat(page.items()).extracting(PageItem::rank).containsExactly(6, 7, 8, 9, 10);
      assertThat(docIds(page)).first().isEqualTo("id://06");
    }

    @Test
    void lastPageIsPartialAndHasNoNextPage() {
      SearchPage page = search("例会", 3, 5);

      assertThat(page.items()).extracting(PageItem::rank).containsExactly(11, 12);
      assertThat(page.hasMore()).isFalse();
      assertThat(page.nextPage()).isNull();
    }

    @Test
    void pageBeyondTheEndIsEmpty() {
      SearchPage page = search("例会", 9, 5);

      assertThat(page.items()).isEmpty();
      assertThat(page.totalHits()).isEqualTo(12);
      assertThat(page.hasMore()).isFalse();
    }

    @Test
    void pageSizeIsClampedToMaximum() {
      SearchPage page = search("例会", 1, 500);

      assertThat(page.pageSize()).isEqualTo(50);
      assertThat(page.items()).hasSize(12);
    }
  }

  @Test
  void yearRangeFiltersByDateOrMentionedYear() {
    publish(
        new DocumentBuilder().id("dated").body("剪定講習").date("2000-04-01").indexed(),
        new DocumentBuilder().id("later").body("剪定講習").date("2010-04-01").indexed(),
        new DocumentBuilder().id("mentions").body("2001年の剪定講習").indexed());

    SearchPage page = search("剪定 1999-2001", 1, 5);

    assertThat(docIds(page)).containsExactlyInAnyOrder("id://dated", "id://mentions");
  }

  @Test
  void explicitYearParameterOverridesQueryYear() {
    publish(
        new DocumentBuilder().id("a").body("剪定").date("2000-04-01").indexed(),
        new DocumentBuilder().id("b").body("剪定").date("2010-04-01").indexed());

    SearchPage page =
        searchService.search(
            new SearchRequest("剪定 2000", 1, 5, SortOrder.RELEVANCE, 2010, null, null, false));

    assertThat(docIds(page)).containsExactly("id://b");
  }

  @Test
  void synonymsConnectEveryWritingOfATerm() {
    SynonymTable synonyms = SynonymTable.builder().add("苔", "コケ").add("苔", "こけ").build();
    publish(
        synonyms,
        new DocumentBuilder().id("kanji").body("苔の庭").indexed(),
        new DocumentBuilder().id("katakana").body("コケの庭").indexed(),
        new DocumentBuilder().id("hiragana").body("こけの庭").indexed());

    for (String query : List.of("苔", "コケ", "こけ")) {
      assertThat(docIds(search(query, 1, 5)))
          .as("query %s", query)
          .containsExactlyInAnyOrder("id://kanji", "id://katakana", "id://hiragana");
    }
  }

  @Test
  void documentsWithTheSameUrlAreCollapsed() {
    publish(
        new DocumentBuilder().url("https://club.example.jp/a").body("盆栽").indexed(),
        new DocumentBuilder().url("https://club.example.jp/a/#top").body("盆栽 盆栽").indexed());

    SearchPage page = search("盆栽", 1, 5);

    assertThat(page.totalHits()).isEqualTo(1);
    assertThat(page.items().get(0).contentHtml()).contains("<mark>盆栽</mark> <mark>盆栽</mark>");
  }

  @Test
  void equalScoresRankDatedDocumentFirst() {
    publish(
        new DocumentBuilder().id("a").title("盆栽").body("盆栽").indexed(),
        new DocumentBuilder().id("b").title("盆栽").body("盆栽").date("2021-06-01").indexed());

    assertThat(docIds(search("盆栽", 1, 5))).containsExactly("id://b", "id://a");
  }

  @Test
  void latestOrderIsReported() {
    publish(new DocumentBuilder().id("a").body("盆栽").indexed());

    SearchPage page = searchService.search(SearchRequest.of("盆栽", 1, 5, SortOrder.LATEST));

    assertThat(page.orderUsed()).isEqualTo(SortOrder.LATEST);
  }

  @Test
  void itemsCarryHighlightedTitleAndDates() {
    publish(
        new DocumentBuilder()
            .id("a")
            .title("苔玉講習")
            .body("苔玉を作りました")
            .url("https://club.example.jp/a")
            .date("令和3年5月")
            .indexed());

    PageItem item = search("苔玉", 1, 5).items().get(0);

    assertThat(item.titleHtml()).isEqualTo("<mark>苔玉</mark>講習");
    assertThat(item.contentHtml()).isEqualTo("<mark>苔玉</mark>を作りました");
    assertThat(item.url()).isEqualTo("https://club.example.jp/a");
    assertThat(item.date()).isEqualTo("令和3年5月");
    assertThat(item.datePrimary()).hasToString("2021-05-01");
  }

  @Test
  void blankQueryReturnsEmptyPage() {
    publish(new DocumentBuilder().body("盆栽").indexed());

    SearchPage page = search("   ", 1, 5);

    assertThat(page.items()).isEmpty();
    assertThat(page.totalHits()).isZero();
  }

  @Test
  void yearOnlyQueryReturnsNothing() {
    publish(new DocumentBuilder().body("2019年の総会").date("2019-05-01").indexed());

    assertThat(search("2019", 1, 5).totalHits()).isZero();
  }

  @Test
  void refreshSchedulesReloadAndStillAnswers() {
    publish(new DocumentBuilder().body("盆栽").indexed());

    SearchPage page =
        searchService.search(
            new SearchRequest("盆栽", 1, 5, SortOrder.RELEVANCE, null, null, null, true));

    verify(reloader).requestReload();
    assertThat(page.totalHits()).isEqualTo(1);
  }

  @Nested
  class Unavailable {

    @Test
    void missingSourceReportsKbMissing() {
      given(reloader.status())
          .willReturn(new ReloadStatus(false, ReloadOutcome.MISSING, Instant.EPOCH, null, null));

      assertThatThrownBy(() -> search("盆栽", 1, 5))
          .isInstanceOf(KnowledgeBaseUnavailableException.class)
          .extracting(e -> ((KnowledgeBaseUnavailableException) e).getErrorCode())
          .isEqualTo(SearchErrorCode.KB_MISSING);
    }

    @Test
    void noSnapshotYetReportsNotReady() {
      given(reloader.status()).willReturn(new ReloadStatus(true, null, null, null, null));

      assertThatThrownBy(() -> search("盆栽", 1, 5))
          .isInstanceOf(KnowledgeBaseUnavailableException.class)
          .extracting(e -> ((KnowledgeBaseUnavailableException) e).getErrorCode())
          .isEqualTo(SearchErrorCode.NOT_READY);
      verify(reloader, never()).requestReload();
    }
  }

  @Nested
  class FailingDocuments {

    private SearchService failingService;

    @BeforeEach
    void oneDocumentFailsToMatchAndAnotherToRender() {
      DocumentMatcher matcher = spy(new DocumentMatcher(new SearchProperties()));
      willAnswer(
              invocation -> {
                IndexedDocument document = invocation.getArgument(1);
                if (document.docId().equals("id://broken")) {
                  throw new IllegalStateException("corrupt field");
                }
                return invocation.callRealMethod();
              })
          .given(matcher)
          .match(any(), any());

      SnippetRenderer renderer = spy(new SnippetRenderer(new SnippetProperties()));
      willAnswer(
              invocation -> {
                IndexedDocument document = invocation.getArgument(0);
                if (document.docId().equals("id://unrenderable")) {
                  throw new IllegalStateException("bad excerpt");
                }
                return invocation.callRealMethod();
              })
          .given(renderer)
          .render(any(), any(), anyBoolean());

      failingService =
          new SearchService(holder, reloader, matcher, renderer, new SearchProperties());
      publish(
          new DocumentBuilder().id("good").title("盆栽展").body("盆栽 盆栽").indexed(),
          new DocumentBuilder().id("broken").title("盆栽").body("盆栽").indexed(),
          new DocumentBuilder().id("unrenderable").title("秋の<盆栽>").body("盆栽").indexed());
    }

    @Test
    void documentThatFailsToMatchIsSkipped() {
      SearchPage page =
          failingService.search(SearchRequest.of("盆栽", 1, 5, SortOrder.RELEVANCE));

      assertThat(page.totalHits()).isEqualTo(2);
      assertThat(page.items()).extracting(PageItem::rank).containsExactly(1, 2);
      assertThat(docIds(page))
          .containsExactlyInAnyOrder("id://good", "id://unrenderable")
          .doesNotContain("id://broken");
    }

    @Test
    void documentThatFailsToRenderKeepsPlainTitle() {
      SearchPage page =
          failingService.search(SearchRequest.of("盆栽", 1, 5, SortOrder.RELEVANCE));

      PageItem unrenderable =
          page.items().stream()
              .filter(item -> item.docId().equals("id://unrenderable"))
              .findFirst()
              .orElseThrow();
      assertThat(unrenderable.titleHtml()).isEqualTo("秋の&lt;盆栽&gt;");
      assertThat(unrenderable.contentHtml()).isEmpty();

      PageItem good =
          page.items().stream()
              .filter(item -> item.docId().equals("id://good"))
              .findFirst()
              .orElseThrow();
      assertThat(good.titleHtml()).contains("<mark>盆栽</mark>");
    }
  }

  @Test
  void findArticleLooksUpByDocId() {
    publish(new DocumentBuilder().id("a").title("盆栽展").indexed());

    assertThat(searchService.findArticle(" id://a ")).isPresent();
    assertThat(searchService.findArticle("id://missing")).isEmpty();
  }
}
