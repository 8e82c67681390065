package io.b2mash.content.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * The caller is known but lacks the project role the operation needs. Always a 403 problem whose
 * title names the missing relationship, e.g. "Not a project member".
 */
public class ForbiddenException extends ErrorResponseException {

  public ForbiddenException(String title, String detail) {
    super(HttpStatus.FORBIDDEN, problem(title, detail), null);
  }

  public static ForbiddenException notMember(UUID projectId) {
    return new ForbiddenException(
        "Not a project member", "You are not a member of project " + projectId);
  }

  public static ForbiddenException notOwner(UUID projectId) {
    return new ForbiddenException(
        "Not the project owner", "Only the owner of project " + projectId + " may do this");
  }

  private static ProblemDetail problem(String title, String detail) {
    var body = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    body.setTitle(title);
    body.setDetail(detail);
    return body;
  }
}
