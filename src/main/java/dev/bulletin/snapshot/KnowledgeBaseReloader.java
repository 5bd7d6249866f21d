package dev.bulletin.snapshot;

import java.io.IOException;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Rebuilds the knowledge base and publishes it through {@link SnapshotHolder}.
 *
 * <p>Reloads run on a dedicated executor, never on a request thread. At most one reload runs at a
 * time. Requests arriving while one is pending are absorbed by it; a request arriving while one is
 * running triggers exactly one more pass once it finishes. A reload whose knowledge-base and
 * synonym bytes hash to the live snapshot's fingerprint publishes nothing. A failed remote download
 * falls back to the local file. Every failure leaves the live snapshot in place.
 */
@Service
public class KnowledgeBaseReloader {

  private static final Logger log = LoggerFactory.getLogger(KnowledgeBaseReloader.class);

  private final SnapshotLoader loader;
  private final SnapshotHolder holder;
  private final KnowledgeBaseFetcher fetcher;
  private final KnowledgeBaseProperties properties;
  private final Executor executor;
  private final Clock clock;

  private final AtomicBoolean scheduled = new AtomicBoolean();
  private final AtomicBoolean rerunRequested = new AtomicBoolean();
  private final AtomicReference<ReloadStatus> status;

  public KnowledgeBaseReloader(
      SnapshotLoader loader,
      SnapshotHolder holder,
      KnowledgeBaseFetcher fetcher,
      KnowledgeBaseProperties properties,
      @Qualifier("reloadExecutor") Executor executor,
      Clock clock) {
    this.loader = loader;
    this.holder = holder;
    this.fetcher = fetcher;
    this.properties = properties;
    this.executor = executor;
    this.clock = clock;
    this.status = new AtomicReference<>(ReloadStatus.initial(properties.getUrl()));
  }

  @EventListener(ApplicationReadyEvent.class)
  public void loadOnStartup() {
    if (properties.isLoadOnStartup()) {
      log.info("Scheduling initial knowledge base load from {}", loader.sourcePath());
      requestReload();
    }
  }

  /**
   * Schedules an asynchronous reload unless one is already pending or running. A request that
   * finds a reload running marks it for one more pass.
   *
   * @return true if a new reload was scheduled, false if the request was coalesced or rejected
   */
  public boolean requestReload() {
    if (!scheduled.compareAndSet(false, true)) {
      rerunRequested.set(true);
      log.debug("Reload already in progress, request coalesced");
      return false;
    }
    try {
      executor.execute(this::runScheduled);
      return true;
    } catch (RejectedExecutionException e) {
      scheduled.set(false);
      log.warn("Reload executor rejected the reload request: {}", e.getMessage());
      return false;
    }
  }

  private void runScheduled() {
    do {
      try {
        do {
          rerunRequested.set(false);
          reloadNow();
        } while (rerunRequested.get());
      } finally {
        scheduled.set(false);
      }
      // a request may have landed between the last check and releasing the flag
    } while (rerunRequested.get() && scheduled.compareAndSet(false, true));
  }

  /**
   * Runs one reload on the calling thread.
   *
   * @return how the reload ended
   */
  public synchronized ReloadOutcome reloadNow() {
    status.updateAndGet(s -> s.withRunning(true));
    ReloadOutcome outcome;
    String error = null;
    try {
      outcome = reload();
    } catch (IOException | RuntimeException e) {
      log.error(
          "Knowledge base reload failed, keeping snapshot v{}: {}",
          holder.current().map(Snapshot::version).orElse(0L),
          e.getMessage(),
          e);
      outcome = ReloadOutcome.FAILED;
      error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
    ReloadOutcome finalOutcome = outcome;
    String finalError = error;
    status.updateAndGet(
        s -> s.finished(finalOutcome, clock.instant(), finalError).withRunning(false));
    return outcome;
  }

  public ReloadStatus status() {
    return status.get().withRunning(status.get().running() || scheduled.get());
  }

  private ReloadOutcome reload() throws IOException {
    String url = properties.getUrl();
    if (properties.hasRemoteSource() && url != null) {
      try {
        FetchOutcome fetched = fetcher.fetch(url, loader.sourcePath());
        log.info("Remote knowledge base fetch: {}", fetched);
      } catch (RuntimeException e) {
        log.warn(
            "Remote knowledge base fetch from {} failed, using local file: {}",
            url,
            e.getMessage(),
            e);
      }
    }

    if (!loader.sourceExists()) {
      log.warn("Knowledge base file {} does not exist", loader.sourcePath());
      return ReloadOutcome.MISSING;
    }

    byte[] content = loader.readSource();
    String fingerprint = loader.fingerprint(content);
    Optional<Snapshot> live = holder.current();
    if (live.isPresent() && live.get().fingerprint().equals(fingerprint)) {
      log.info(
          "Knowledge base unchanged (fingerprint {}), keeping snapshot v{}",
          abbreviate(fingerprint),
          live.get().version());
      return ReloadOutcome.UNCHANGED;
    }

    Snapshot next = loader.build(content, holder.nextVersion());
    holder.publish(next);
    log.info(
        "Published snapshot v{} with {} documents, {} synonym pairs (fingerprint {})",
        next.version(),
        next.size(),
        next.synonyms().size(),
        abbreviate(next.fingerprint()));
    return ReloadOutcome.PUBLISHED;
  }

  private static String abbreviate(String fingerprint) {
    return fingerprint.length() > 12 ? fingerprint.substring(0, 12) : fingerprint;
  }
}
