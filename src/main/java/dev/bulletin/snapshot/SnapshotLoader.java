package dev.bulletin.snapshot;

import dev.bulletin.document.ContentHasher;
import dev.bulletin.document.Document;
import dev.bulletin.document.DocumentReader;
import dev.bulletin.document.IndexedDocument;
import dev.bulletin.synonym.SynonymLoader;
import dev.bulletin.synonym.SynonymTable;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds a {@link Snapshot} from the raw bytes of the local knowledge-base file.
 *
 * <p>Every document is indexed independently; a record that fails to index is logged and left out
 * rather than failing the whole load.
 */
@Component
public class SnapshotLoader {

  private static final Logger log = LoggerFactory.getLogger(SnapshotLoader.class);

  private final KnowledgeBaseProperties properties;
  private final DocumentReader documentReader;
  private final SynonymLoader synonymLoader;
  private final Clock clock;

  public SnapshotLoader(
      KnowledgeBaseProperties properties,
      DocumentReader documentReader,
      SynonymLoader synonymLoader,
      Clock clock) {
    this.properties = properties;
    this.documentReader = documentReader;
    this.synonymLoader = synonymLoader;
    this.clock = clock;
  }

  public Path sourcePath() {
    return properties.sourcePath();
  }

  public boolean sourceExists() {
    return Files.isRegularFile(sourcePath());
  }

  public byte[] readSource() throws IOException {
    return Files.readAllBytes(sourcePath());
  }

  /**
   * Fingerprint of a knowledge-base generation: the hash of the JSONL bytes, combined with the hash
   * of the synonym file when one exists, so that editing either one triggers a rebuild.
   *
   * @param content the JSONL bytes
   * @return lowercase hex digest
   */
  public String fingerprint(byte[] content) {
    String contentHash = ContentHasher.sha256(content);
    Path synonymsFile = properties.synonymsFile();
    if (synonymsFile == null || !Files.isRegularFile(synonymsFile)) {
      return contentHash;
    }
    try {
      return ContentHasher.sha256Fields(
          contentHash, ContentHasher.sha256(Files.readAllBytes(synonymsFile)));
    } catch (IOException e) {
      log.warn(
          "Cannot read synonym file {} for fingerprinting: {}", synonymsFile, e.getMessage());
      return contentHash;
    }
  }

  /**
   * Parses and indexes {@code content} into a new snapshot.
   *
   * @param content the JSONL bytes
   * @param version the generation number to assign
   * @return the fully built snapshot
   * @throws IOException if the content cannot be read as UTF-8 text
   */
  public Snapshot build(byte[] content, long version) throws IOException {
    DocumentReader.ReadResult read;
    try (Reader reader =
        new InputStreamReader(new ByteArrayInputStream(content), StandardCharsets.UTF_8)) {
      read = documentReader.read(reader);
    }

    int foldBodyLimit = properties.getFoldBodyLimit();
    List<IndexedDocument> indexed = new ArrayList<>(read.documents().size());
    for (Document document : read.documents()) {
      try {
        indexed.add(IndexedDocument.from(document, foldBodyLimit));
      } catch (RuntimeException e) {
        log.warn("Skipping document that failed to index: {}", e.getMessage());
      }
    }

    SynonymTable synonyms = synonymLoader.load(properties.synonymsFile());
    return new Snapshot(
        version, fingerprint(content), clock.instant(), indexed, synonyms);
  }
}
