package dev.bulletin.document;

import static org.assertj.core.api.Assertions.assertThat;

import dev.bulletin.fixture.DocumentBuilder;
import org.junit.jupiter.api.Test;

class DocumentIdentityTest {

  @Test
  void explicitIdTakesPrecedence() {
    Document document =
        new DocumentBuilder().id(" 42 ").url("https://club.example.jp/a").build();

    assertThat(DocumentIdentity.docId(document)).isEqualTo("id://42");
  }

  @Test
  void canonicalUrlIsUsedWithoutExplicitId() {
    Document document =
        new DocumentBuilder().url("https://Club.example.jp/a/?utm_medium=x").build();

    assertThat(DocumentIdentity.docId(document)).isEqualTo("url://https://club.example.jp/a");
  }

  @Test
  void urlVariantsOfTheSamePageShareAnIdentity() {
    Document first = new DocumentBuilder().title("春の例会").url("https://club.example.jp/a#x").build();
    Document second = new DocumentBuilder().title("別題").url("https://club.example.jp/a/").build();

    assertThat(DocumentIdentity.docId(first)).isEqualTo(DocumentIdentity.docId(second));
  }

  @Test
  void contentHashIsUsedWhenNoUsableUrl() {
    Document document =
        new DocumentBuilder().title("春の例会").date("2021-04-01").author("山田").url("#").build();

    String docId = DocumentIdentity.docId(document);

    assertThat(docId).startsWith("hash://");
    assertThat(docId)
        .isEqualTo(
            DocumentIdentity.docId(
                new DocumentBuilder()
                    .title("春の例会　")
                    .date("2021-04-01")
                    .author("山田")
                    .body("本文は識別に影響しない")
                    .build()));
  }

  @Test
  void differentTitlesHashDifferently() {
    Document first = new DocumentBuilder().title("春の例会").date("2021-04-01").build();
    Document second = new DocumentBuilder().title("秋の例会").date("2021-04-01").build();

    assertThat(DocumentIdentity.docId(first)).isNotEqualTo(DocumentIdentity.docId(second));
  }
}
