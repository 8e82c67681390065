package io.b2mash.content.exception;

import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Malformed input detected by the service itself, e.g. a reference that cannot be resolved. Uses
 * the same body shape as request validation failures: a 400 problem with an {@code errors} list of
 * {@code {path, message}} entries.
 */
public class InvalidStateException extends ErrorResponseException {

  public InvalidStateException(String title, String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(title, detail), null);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty("errors", List.of());
    return problem;
  }

  /** One entry of the {@code errors} list. */
  public record FieldError(String path, String message) {

    Map<String, String> asMap() {
      return Map.of("path", path, "message", message);
    }
  }
}
