package dev.bulletin.search;

/** Thrown when no document in the live snapshot carries the requested identity. */
public class ArticleNotFoundException extends RuntimeException {

  public ArticleNotFoundException(String docId) {
    super("No article with id: " + docId);
  }
}
