package dev.bulletin.document;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.StringReader;
import org.junit.jupiter.api.Test;

class DocumentReaderTest {

  private final DocumentReader reader = new DocumentReader(new ObjectMapper());

  @Test
  void readsCanonicalKeys() throws IOException {
    String jsonl =
        """
        {"title":"春の例会","content":"苔玉を作りました","url":"https://club.example.jp/1",\
        "date":"2021-04-01","author":"山田","category":"例会","issue":"第12号","id":"a1"}
        """;

    DocumentReader.ReadResult result = reader.read(new StringReader(jsonl));

    assertThat(result.skippedLines()).isZero();
    assertThat(result.documents())
        .containsExactly(
            new Document(
                "春の例会",
                "苔玉を作りました",
                "https://club.example.jp/1",
                "山田",
                "2021-04-01",
                "例会",
                "第12号",
                "a1"));
  }

  @Test
  void resolvesJapaneseAliases() throws IOException {
    String jsonl =
        """
        {"タイトル":"盆栽展","本文":"展示会のお知らせ","開催日/発行日":{"start":"2020-10-03"},\
        "執筆者":"佐藤","タグ":["展示","盆栽"],"号":15}
        """;

    Document document = reader.read(new StringReader(jsonl)).documents().get(0);

    assertThat(document.title()).isEqualTo("盆栽展");
    assertThat(document.body()).isEqualTo("展示会のお知らせ");
    assertThat(document.dateRaw()).isEqualTo("2020-10-03");
    assertThat(document.author()).isEqualTo("佐藤");
    assertThat(document.category()).isEqualTo("展示 盆栽");
    assertThat(document.issue()).isEqualTo("15");
  }

  @Test
  void firstNonEmptyAliasWins() throws IOException {
    Document document =
        reader
            .read(new StringReader("{\"title\":\"  \",\"名前\":\"剪定講習\",\"text\":\"x\"}"))
            .documents()
            .get(0);

    assertThat(document.title()).isEqualTo("剪定講習");
  }

  @Test
  void skipsMalformedNonObjectAndEmptyRecords() throws IOException {
    String jsonl =
        """
        {"title":"有効"}
        not json
        [1,2,3]

        {"url":"https://club.example.jp/no-text"}
        {"body":"本文のみ"}
        """;

    DocumentReader.ReadResult result = reader.read(new StringReader(jsonl));

    assertThat(result.documents()).extracting(Document::title).containsExactly("有効", "");
    assertThat(result.skippedLines()).isEqualTo(3);
  }

  @Test
  void stripsByteOrderMarkOnFirstLine() throws IOException {
    DocumentReader.ReadResult result =
        reader.read(new StringReader("\uFEFF{\"title\":\"会報\"}\n"));

    assertThat(result.documents()).hasSize(1);
    assertThat(result.skippedLines()).isZero();
  }
}
