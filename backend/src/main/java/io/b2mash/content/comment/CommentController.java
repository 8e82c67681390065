package io.b2mash.content.comment;

import io.b2mash.content.security.CallerIdentity;
import io.b2mash.content.security.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class CommentController {

  private final CommentService commentService;

  public CommentController(CommentService commentService) {
    this.commentService = commentService;
  }

  @PostMapping("/api/tasks/{taskId}/comments")
  public ResponseEntity<CommentResponse> createComment(
      @PathVariable UUID taskId, @Valid @RequestBody CreateCommentRequest request) {
    String userId = RequestScopes.requireUserId();
    var comment = commentService.createComment(taskId, userId, request.body());
    return ResponseEntity.created(URI.create("/api/comments/" + comment.getId()))
        .body(CommentResponse.from(comment));
  }

  @GetMapping("/api/tasks/{taskId}/comments")
  public ResponseEntity<List<CommentResponse>> listComments(@PathVariable UUID taskId) {
    String userId = RequestScopes.requireUserId();
    var comments =
        commentService.listComments(taskId, userId).stream().map(CommentResponse::from).toList();
    return ResponseEntity.ok(comments);
  }

  @DeleteMapping("/api/comments/{id}")
  public ResponseEntity<Void> deleteComment(@PathVariable UUID id) {
    CallerIdentity caller = RequestScopes.requireCaller();
    commentService.deleteComment(id, caller.userId(), caller.role());
    return ResponseEntity.noContent().build();
  }

  public record CreateCommentRequest(
      @NotBlank(message = "body is required")
          @Size(max = 5000, message = "body must be at most 5000 characters")
          String body) {}

  public record CommentResponse(
      UUID id, UUID taskId, String authorId, String body, Instant createdAt, Instant updatedAt) {

    public static CommentResponse from(Comment comment) {
      return new CommentResponse(
          comment.getId(),
          comment.getTaskId(),
          comment.getAuthorId(),
          comment.getBody(),
          comment.getCreatedAt(),
          comment.getUpdatedAt());
    }
  }
}
