package dev.bulletin.search;

/** The closed set of error codes a search response can carry. */
public enum SearchErrorCode {
  /** No knowledge-base file exists. */
  KB_MISSING("kb_missing"),
  /** The knowledge base exists but no snapshot has been published yet. */
  NOT_READY("not_ready"),
  /** An unexpected failure, classified at the request boundary. */
  EXCEPTION("exception");

  private final String code;

  SearchErrorCode(String code) {
    this.code = code;
  }

  /** Wire form of the code. */
  public String code() {
    return code;
  }
}
