package dev.bulletin.snapshot;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class KnowledgeBasePropertiesTest {

  @Test
  void defaultsAreValid() {
    KnowledgeBaseProperties properties = new KnowledgeBaseProperties();

    assertThatCode(properties::validate).doesNotThrowAnyException();
    assertThat(properties.sourcePath()).isEqualTo(Path.of("data/kb.jsonl"));
    assertThat(properties.hasRemoteSource()).isFalse();
  }

  @Test
  void blankPathIsRejected() {
    KnowledgeBaseProperties properties = new KnowledgeBaseProperties();
    properties.setPath(" ");

    assertThatThrownBy(properties::validate)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("bulletin.kb.path");
  }

  @Test
  void retryAttemptsAreBounded() {
    KnowledgeBaseProperties properties = new KnowledgeBaseProperties();
    properties.getFetch().setMaxAttempts(0);

    assertThatThrownBy(properties::validate).isInstanceOf(IllegalStateException.class);
  }

  @ParameterizedTest
  @ValueSource(
      strings = {"kb.example.jp/kb.jsonl", "ftp://kb.example.jp/kb.jsonl", "https://kb example"})
  void urlMustBeAbsoluteHttp(String url) {
    KnowledgeBaseProperties properties = new KnowledgeBaseProperties();
    properties.setUrl(url);

    assertThatThrownBy(properties::validate)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("bulletin.kb.url");
  }

  @Test
  void httpsUrlIsAccepted() {
    KnowledgeBaseProperties properties = new KnowledgeBaseProperties();
    properties.setUrl("https://kb.example.jp/kb.jsonl");

    assertThatCode(properties::validate).doesNotThrowAnyException();
    assertThat(properties.hasRemoteSource()).isTrue();
  }

  @Test
  void emptyUrlMeansNoRemoteSourceAndBlankSynonymPathMeansBundled() {
    KnowledgeBaseProperties properties = new KnowledgeBaseProperties();
    properties.setUrl("");
    properties.setSynonymsPath("");

    assertThat(properties.hasRemoteSource()).isFalse();
    assertThat(properties.synonymsFile()).isNull();
  }
}
