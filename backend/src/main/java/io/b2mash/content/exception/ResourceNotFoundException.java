package io.b2mash.content.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A project, task, comment or membership that the request names does not exist. */
public class ResourceNotFoundException extends ErrorResponseException {

  private ResourceNotFoundException(String resource, String detail) {
    super(HttpStatus.NOT_FOUND, problem(resource, detail), null);
  }

  public static ResourceNotFoundException project(UUID projectId) {
    return byId("Project", projectId);
  }

  public static ResourceNotFoundException task(UUID taskId) {
    return byId("Task", taskId);
  }

  public static ResourceNotFoundException comment(UUID commentId) {
    return byId("Comment", commentId);
  }

  public static ResourceNotFoundException member(UUID projectId, String userId) {
    return new ResourceNotFoundException(
        "Member", "User " + userId + " is not a member of project " + projectId);
  }

  private static ResourceNotFoundException byId(String resource, UUID id) {
    return new ResourceNotFoundException(
        resource, "No " + resource.toLowerCase() + " found with id " + id);
  }

  private static ProblemDetail problem(String resource, String detail) {
    var body = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    body.setTitle(resource + " not found");
    body.setDetail(detail);
    body.setProperty("resource", resource.toLowerCase());
    return body;
  }
}
