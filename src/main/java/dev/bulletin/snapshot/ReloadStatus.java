package dev.bulletin.snapshot;

import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * Point-in-time view of the reload machinery.
 *
 * @param running whether a reload is executing right now
 * @param lastOutcome outcome of the most recent finished reload, null before the first one
 * @param lastFinishedAt when the most recent reload finished
 * @param lastError message of the most recent failure, cleared by a later success
 * @param sourceUrl the configured remote source, if any
 */
public record ReloadStatus(
    boolean running,
    @Nullable ReloadOutcome lastOutcome,
    @Nullable Instant lastFinishedAt,
    @Nullable String lastError,
    @Nullable String sourceUrl) {

  static ReloadStatus initial(@Nullable String sourceUrl) {
    return new ReloadStatus(false, null, null, null, sourceUrl);
  }

  ReloadStatus withRunning(boolean running) {
    return new ReloadStatus(running, lastOutcome, lastFinishedAt, lastError, sourceUrl);
  }

  ReloadStatus finished(ReloadOutcome outcome, Instant at, @Nullable String error) {
    return new ReloadStatus(running, outcome, at, error, sourceUrl);
  }

  /** Whether the source file was found missing on the most recent attempt. */
  public boolean sourceMissing() {
    return lastOutcome == ReloadOutcome.MISSING;
  }
}
