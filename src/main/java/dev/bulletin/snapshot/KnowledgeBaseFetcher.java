package dev.bulletin.snapshot;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Downloads the remote JSONL export into the local knowledge-base file.
 *
 * <p>Sends {@code If-None-Match} with the ETag remembered next to the local file ({@code
 * <path>.etag}). New content is written to a temporary sibling and moved over the target, so a
 * concurrent reader never sees a half-written file. Transient {@link RestClientException}s are
 * retried with exponential backoff; after the last attempt the fetch reports {@link
 * FetchOutcome#FAILED} and the local file stays as it was.
 */
@Service
public class KnowledgeBaseFetcher {

  private static final Logger log = LoggerFactory.getLogger(KnowledgeBaseFetcher.class);

  static final String ETAG_SUFFIX = ".etag";

  private final RestClient restClient;

  public KnowledgeBaseFetcher(@Qualifier("knowledgeBaseRestClient") RestClient restClient) {
    this.restClient = restClient;
  }

  /**
   * Refreshes {@code target} from {@code url}.
   *
   * @param url the remote JSONL location
   * @param target the local knowledge-base file
   * @return whether new content was stored
   */
  @Retryable(
      retryFor = RestClientException.class,
      maxAttemptsExpression = "${bulletin.kb.fetch.max-attempts:3}",
      backoff =
          @Backoff(
              delayExpression = "${bulletin.kb.fetch.delay-ms:1000}",
              multiplierExpression = "${bulletin.kb.fetch.multiplier:2.0}"))
  public FetchOutcome fetch(String url, Path target) {
    String etag = readEtag(target);
    ResponseEntity<byte[]> response =
        restClient
            .get()
            .uri(URI.create(url))
            .headers(
                headers -> {
                  if (etag != null && Files.exists(target)) {
                    headers.setIfNoneMatch(etag);
                  }
                })
            .retrieve()
            .toEntity(byte[].class);

    if (response.getStatusCode().isSameCodeAs(HttpStatus.NOT_MODIFIED)) {
      log.info("Knowledge base at {} not modified", url);
      return FetchOutcome.NOT_MODIFIED;
    }
    byte[] body = response.getBody();
    if (body == null || body.length == 0) {
      log.warn("Knowledge base download from {} returned an empty body, keeping local file", url);
      return FetchOutcome.FAILED;
    }

    try {
      writeAtomically(target, body);
      writeEtag(target, response.getHeaders().getETag());
    } catch (IOException e) {
      log.warn("Could not store downloaded knowledge base at {}: {}", target, e.getMessage());
      return FetchOutcome.FAILED;
    }
    log.info("Downloaded {} bytes of knowledge base from {}", body.length, url);
    return FetchOutcome.FETCHED;
  }

  @Recover
  FetchOutcome recoverFetch(RestClientException e, String url, Path target) {
    log.warn("Knowledge base download failed after retries for {}: {}", url, e.getMessage());
    return FetchOutcome.FAILED;
  }

  private static void writeAtomically(Path target, byte[] content) throws IOException {
    Path parent = target.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
    Files.write(tmp, content);
    try {
      Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static @Nullable String readEtag(Path target) {
    Path etagFile = etagFile(target);
    if (!Files.isRegularFile(etagFile)) {
      return null;
    }
    try {
      String etag = Files.readString(etagFile, StandardCharsets.UTF_8).strip();
      return etag.isEmpty() ? null : etag;
    } catch (IOException e) {
      log.debug("Ignoring unreadable ETag file {}: {}", etagFile, e.getMessage());
      return null;
    }
  }

  private static void writeEtag(Path target, @Nullable String etag) throws IOException {
    Path etagFile = etagFile(target);
    if (etag == null || etag.isBlank()) {
      Files.deleteIfExists(etagFile);
    } else {
      Files.writeString(etagFile, etag, StandardCharsets.UTF_8);
    }
  }

  static Path etagFile(Path target) {
    return target.resolveSibling(target.getFileName() + ETAG_SUFFIX);
  }
}
