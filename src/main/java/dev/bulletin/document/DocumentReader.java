package dev.bulletin.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads the knowledge-base JSONL export (one JSON object per line) into typed {@link Document}s.
 *
 * <p>Every field is resolved through a family of key aliases; the first alias present with a
 * non-empty value wins. String and number values are used as text, arrays are joined with spaces,
 * and objects contribute their {@code start} member (the shape of an exported date range).
 *
 * <p>Malformed lines, non-object lines and records with neither title nor body are skipped and
 * counted, never fatal.
 */
@Component
public class DocumentReader {

  private static final Logger log = LoggerFactory.getLogger(DocumentReader.class);

  private static final String BYTE_ORDER_MARK = "\uFEFF";

  static final List<String> TITLE_KEYS =
      List.of("title", "Title", "名前", "タイトル", "題名", "見出し", "subject", "headline");
  static final List<String> BODY_KEYS =
      List.of(
          "content", "text", "body", "本文", "内容", "記事", "description", "summary", "excerpt");
  static final List<String> DATE_KEYS =
      List.of(
          "開催日/発行日",
          "date",
          "Date",
          "published_at",
          "published",
          "created_at",
          "日付",
          "開催日",
          "発行日");
  static final List<String> URL_KEYS =
      List.of("url", "URL", "link", "permalink", "出典URL", "公開URL", "source");
  static final List<String> AUTHOR_KEYS =
      List.of("author", "Author", "著者", "執筆者", "投稿者", "作成者", "writer");
  static final List<String> CATEGORY_KEYS =
      List.of("category", "Category", "tags", "Tags", "カテゴリ", "カテゴリー", "タグ", "分類");
  static final List<String> ISSUE_KEYS = List.of("issue", "Issue", "号", "会報号", "号数", "No");
  static final List<String> ID_KEYS = List.of("id", "ID", "doc_id", "page_id", "記事ID");

  private final ObjectMapper objectMapper;

  public DocumentReader(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Result of reading one JSONL source.
   *
   * @param documents the documents in source order
   * @param skippedLines number of non-blank lines that did not yield a document
   */
  public record ReadResult(List<Document> documents, int skippedLines) {
    public ReadResult {
      documents = List.copyOf(documents);
    }
  }

  /**
   * Reads every line of {@code source}.
   *
   * @param source the JSONL text; closed by the caller
   * @return the parsed documents and the number of skipped lines
   * @throws IOException if the underlying reader fails
   */
  public ReadResult read(Reader source) throws IOException {
    BufferedReader reader =
        source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);
    List<Document> documents = new ArrayList<>();
    int skipped = 0;
    int lineNumber = 0;
    String line;
    while ((line = reader.readLine()) != null) {
      lineNumber++;
      if (lineNumber == 1 && line.startsWith(BYTE_ORDER_MARK)) {
        line = line.substring(1);
      }
      String trimmed = line.strip();
      if (trimmed.isEmpty()) {
        continue;
      }
      Document document = parseLine(trimmed, lineNumber);
      if (document == null) {
        skipped++;
      } else {
        documents.add(document);
      }
    }
    if (skipped > 0) {
      log.warn("Skipped {} unusable JSONL lines out of {}", skipped, lineNumber);
    }
    return new ReadResult(documents, skipped);
  }

  @Nullable Document parseLine(String line, int lineNumber) {
    JsonNode node;
    try {
      node = objectMapper.readTree(line);
    } catch (JsonProcessingException e) {
      log.debug("Line {} is not valid JSON: {}", lineNumber, e.getOriginalMessage());
      return null;
    }
    if (node == null || !node.isObject()) {
      log.debug("Line {} is not a JSON object", lineNumber);
      return null;
    }

    String title = firstText(node, TITLE_KEYS);
    String body = firstText(node, BODY_KEYS);
    if (title == null && body == null) {
      log.debug("Line {} has neither title nor body", lineNumber);
      return null;
    }
    return new Document(
        title,
        body,
        firstText(node, URL_KEYS),
        firstText(node, AUTHOR_KEYS),
        firstText(node, DATE_KEYS),
        firstText(node, CATEGORY_KEYS),
        firstText(node, ISSUE_KEYS),
        firstText(node, ID_KEYS));
  }

  private static @Nullable String firstText(JsonNode node, List<String> keys) {
    for (String key : keys) {
      String text = asText(node.get(key));
      if (text != null) {
        return text;
      }
    }
    return null;
  }

  private static @Nullable String asText(@Nullable JsonNode value) {
    if (value == null || value.isNull() || value.isMissingNode()) {
      return null;
    }
    if (value.isTextual() || value.isNumber() || value.isBoolean()) {
      String text = value.asText().strip();
      return text.isEmpty() ? null : text;
    }
    if (value.isArray()) {
      StringJoiner joined = new StringJoiner(" ");
      for (JsonNode element : value) {
        String text = asText(element);
        if (text != null) {
          joined.add(text);
        }
      }
      return joined.length() == 0 ? null : joined.toString();
    }
    if (value.isObject()) {
      JsonNode start = value.get("start");
      if (start != null) {
        return asText(start);
      }
      JsonNode name = value.get("name");
      return name == null ? null : asText(name);
    }
    return null;
  }
}
