package dev.bulletin.document;

/**
 * The document fields a query is matched against, with the weight each occurrence contributes to a
 * document's score. Weights only affect ranking, never whether a document matches.
 */
public enum WeightedField {
  TITLE(12),
  BODY(8),
  AUTHOR(5),
  ISSUE(3),
  CATEGORY(3),
  DATE(2);

  private final int weight;

  WeightedField(int weight) {
    this.weight = weight;
  }

  public int weight() {
    return weight;
  }
}
