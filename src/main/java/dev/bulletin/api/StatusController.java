package dev.bulletin.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dev.bulletin.snapshot.KnowledgeBaseReloader;
import dev.bulletin.snapshot.ReloadStatus;
import dev.bulletin.snapshot.Snapshot;
import dev.bulletin.snapshot.SnapshotHolder;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness, readiness, version and manual reload.
 *
 * <p>{@code /health} answers immediately even before the first snapshot is built. {@code /ready}
 * always answers 200 and reports readiness in the body.
 */
@RestController
public class StatusController {

  static final String READY = "ready";
  static final String NOT_READY = "not_ready";
  static final String KB_MISSING = "kb_missing";

  private final SnapshotHolder snapshotHolder;
  private final KnowledgeBaseReloader reloader;
  private final String version;

  public StatusController(
      SnapshotHolder snapshotHolder,
      KnowledgeBaseReloader reloader,
      @Value("${bulletin.version:dev}") String version) {
    this.snapshotHolder = snapshotHolder;
    this.reloader = reloader;
    this.version = version;
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record HealthResponse(
      boolean ok,
      @Nullable String kbUrl,
      int kbSize,
      @Nullable String kbFingerprint,
      long snapshotVersion,
      @Nullable Instant loadedAt) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record ReadyResponse(boolean ready, String status) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record ReloadResponse(
      boolean scheduled,
      boolean running,
      @Nullable String lastOutcome,
      @Nullable Instant lastFinishedAt,
      @Nullable String lastError) {}

  @GetMapping("/health")
  public HealthResponse health() {
    Optional<Snapshot> snapshot = snapshotHolder.current();
    return new HealthResponse(
        true,
        reloader.status().sourceUrl(),
        snapshot.map(Snapshot::size).orElse(0),
        snapshot.map(Snapshot::fingerprint).orElse(null),
        snapshot.map(Snapshot::version).orElse(0L),
        snapshot.map(Snapshot::loadedAt).orElse(null));
  }

  @GetMapping("/ready")
  public ReadyResponse ready() {
    if (snapshotHolder.current().isPresent()) {
      return new ReadyResponse(true, READY);
    }
    return new ReadyResponse(false, reloader.status().sourceMissing() ? KB_MISSING : NOT_READY);
  }

  @GetMapping("/version")
  public Map<String, String> version() {
    return Map.of("version", version);
  }

  @PostMapping("/api/reload")
  public ReloadResponse reload() {
    boolean scheduled = reloader.requestReload();
    ReloadStatus status = reloader.status();
    return new ReloadResponse(
        scheduled,
        status.running(),
        status.lastOutcome() == null ? null : status.lastOutcome().name().toLowerCase(Locale.ROOT),
        status.lastFinishedAt(),
        status.lastError());
  }
}
