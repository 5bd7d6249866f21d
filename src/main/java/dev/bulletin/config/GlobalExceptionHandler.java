package dev.bulletin.config;

import dev.bulletin.search.ArticleNotFoundException;
import dev.bulletin.search.KnowledgeBaseUnavailableException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global REST error handler that maps application exceptions to RFC 9457 Problem Detail responses.
 *
 * <p>Applies to every endpoint except {@code /api/search}, which reports failures in its own body.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  /**
   * Maps {@link IllegalArgumentException} to a 400 Bad Request Problem Detail.
   *
   * @param ex the exception thrown by validation logic
   * @return a Problem Detail with HTTP 400 status and the exception message
   */
  @ExceptionHandler(IllegalArgumentException.class)
  ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(ArticleNotFoundException.class)
  ProblemDetail handleArticleNotFound(ArticleNotFoundException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
  }

  /** No snapshot yet: 503 with the error code as the problem title. */
  @ExceptionHandler(KnowledgeBaseUnavailableException.class)
  ProblemDetail handleUnavailable(KnowledgeBaseUnavailableException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
    problem.setTitle(ex.getErrorCode().code());
    return problem;
  }
}
