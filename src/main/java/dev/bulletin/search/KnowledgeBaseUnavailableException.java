package dev.bulletin.search;

/** Thrown when a search or lookup runs before any snapshot has been published. */
public class KnowledgeBaseUnavailableException extends RuntimeException {

  private final SearchErrorCode errorCode;

  public KnowledgeBaseUnavailableException(SearchErrorCode errorCode) {
    super(
        errorCode == SearchErrorCode.KB_MISSING
            ? "Knowledge base file is missing"
            : "Knowledge base is not loaded yet");
    this.errorCode = errorCode;
  }

  public SearchErrorCode getErrorCode() {
    return errorCode;
  }
}
