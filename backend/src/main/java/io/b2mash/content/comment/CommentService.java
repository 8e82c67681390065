package io.b2mash.content.comment;

import io.b2mash.content.event.CommentCreatedEvent;
import io.b2mash.content.exception.ForbiddenException;
import io.b2mash.content.exception.ResourceNotFoundException;
import io.b2mash.content.member.ProjectAccessService;
import io.b2mash.content.security.Roles;
import io.b2mash.content.task.Task;
import io.b2mash.content.task.TaskRepository;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class CommentService {

  private static final Logger log = LoggerFactory.getLogger(CommentService.class);

  private final CommentRepository commentRepository;
  private final TaskRepository taskRepository;
  private final ProjectAccessService projectAccessService;
  private final ApplicationEventPublisher eventPublisher;

  public CommentService(
      CommentRepository commentRepository,
      TaskRepository taskRepository,
      ProjectAccessService projectAccessService,
      ApplicationEventPublisher eventPublisher) {
    this.commentRepository = commentRepository;
    this.taskRepository = taskRepository;
    this.projectAccessService = projectAccessService;
    this.eventPublisher = eventPublisher;
  }

  /**
   * Adds a comment to a task. Members of the task's project only. The task's assignee and creator
   * are notified once the comment is committed.
   */
  @Transactional
  public Comment createComment(UUID taskId, String authorId, String body) {
    var task = requireTask(taskId);
    projectAccessService.requireMember(task.getProjectId(), authorId);

    var comment = commentRepository.save(new Comment(taskId, authorId, body));
    log.info("Created comment {} on task {}", comment.getId(), taskId);

    eventPublisher.publishEvent(
        new CommentCreatedEvent(
            comment.getId(),
            taskId,
            task.getProjectId(),
            task.getTitle(),
            task.getAssigneeId(),
            task.getCreatedBy(),
            authorId,
            Instant.now()));
    return comment;
  }

  /** Comments on a task, oldest first. Members only. */
  @Transactional(readOnly = true)
  public List<Comment> listComments(UUID taskId, String userId) {
    var task = requireTask(taskId);
    projectAccessService.requireMember(task.getProjectId(), userId);
    return commentRepository.findByTaskId(taskId);
  }

  /** Allowed for the author and for callers with the global admin role. */
  @Transactional
  public void deleteComment(UUID commentId, String userId, String role) {
    var comment =
        commentRepository
            .findById(commentId)
            .orElseThrow(() -> ResourceNotFoundException.comment(commentId));

    boolean isAuthor = comment.getAuthorId().equals(userId);
    if (!isAuthor && !Roles.GLOBAL_ADMIN.equals(role)) {
      throw new ForbiddenException(
          "Cannot delete comment", "You do not have permission to delete comment " + commentId);
    }

    commentRepository.delete(comment);
    log.info("Deleted comment {}", commentId);
  }

  private Task requireTask(UUID taskId) {
    return taskRepository
        .findById(taskId)
        .orElseThrow(() -> ResourceNotFoundException.task(taskId));
  }
}
