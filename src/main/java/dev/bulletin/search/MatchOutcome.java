package dev.bulletin.search;

/** Result of evaluating one query against one document. */
public sealed interface MatchOutcome permits MatchOutcome.Excluded, MatchOutcome.Included {

  static MatchOutcome excluded() {
    return Excluded.INSTANCE;
  }

  static MatchOutcome included(int score) {
    return new Included(score);
  }

  /** The document does not satisfy the query. */
  enum Excluded implements MatchOutcome {
    INSTANCE
  }

  /**
   * The document satisfies the query.
   *
   * @param score accumulated relevance, never negative
   */
  record Included(int score) implements MatchOutcome {
    public Included {
      if (score < 0) {
        throw new IllegalArgumentException("score must not be negative: " + score);
      }
    }
  }
}
