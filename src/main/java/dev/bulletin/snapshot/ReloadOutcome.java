package dev.bulletin.snapshot;

/** How a reload attempt ended. */
public enum ReloadOutcome {
  /** A new snapshot was built and published. */
  PUBLISHED,
  /** The source fingerprint matched the live snapshot; nothing was published. */
  UNCHANGED,
  /** No local source file exists (and none could be downloaded). */
  MISSING,
  /** Loading failed; the previously published snapshot, if any, stays live. */
  FAILED
}
