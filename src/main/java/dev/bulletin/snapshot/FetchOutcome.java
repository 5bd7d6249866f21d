package dev.bulletin.snapshot;

/** Result of one attempt to refresh the local copy of the remote knowledge base. */
public enum FetchOutcome {
  /** New content was downloaded and replaced the local file. */
  FETCHED,
  /** The server answered 304; the local file is current. */
  NOT_MODIFIED,
  /** The download failed; the local file, if any, is untouched. */
  FAILED
}
