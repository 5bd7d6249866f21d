package dev.bulletin.snapshot;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.stereotype.Component;

/** The single shared pointer to the live {@link Snapshot}; swapped atomically on publish. */
@Component
public class SnapshotHolder {

  private final AtomicReference<Snapshot> live = new AtomicReference<>();

  /** The live snapshot, or empty before the first successful load. */
  public Optional<Snapshot> current() {
    return Optional.ofNullable(live.get());
  }

  public void publish(Snapshot snapshot) {
    live.set(snapshot);
  }

  long nextVersion() {
    Snapshot current = live.get();
    return current == null ? 1 : current.version() + 1;
  }
}
