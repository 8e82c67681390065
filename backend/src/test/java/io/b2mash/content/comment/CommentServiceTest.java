package io.b2mash.content.comment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.content.TestEntities;
import io.b2mash.content.event.CommentCreatedEvent;
import io.b2mash.content.exception.ForbiddenException;
import io.b2mash.content.exception.ResourceNotFoundException;
import io.b2mash.content.member.ProjectAccessService;
import io.b2mash.content.task.TaskRepository;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

@ExtendWith(MockitoExtension.class)
class CommentServiceTest {

  private static final UUID PROJECT_ID = UUID.randomUUID();
  private static final UUID TASK_ID = UUID.randomUUID();
  private static final UUID COMMENT_ID = UUID.randomUUID();

  @Mock private CommentRepository commentRepository;
  @Mock private TaskRepository taskRepository;
  @Mock private ProjectAccessService projectAccessService;
  @Mock private ApplicationEventPublisher eventPublisher;
  @InjectMocks private CommentService service;

  @Test
  void createComment_publishesEventWithTaskParticipants() {
    var task = TestEntities.task(TASK_ID, PROJECT_ID, "user1", "user2");
    when(taskRepository.findById(TASK_ID)).thenReturn(Optional.of(task));
    when(commentRepository.save(any(Comment.class)))
        .thenAnswer(inv -> inv.getArgument(0, Comment.class));

    var comment = service.createComment(TASK_ID, "user3", "Nice work");

    assertThat(comment.getAuthorId()).isEqualTo("user3");
    assertThat(comment.getBody()).isEqualTo("Nice work");
    verify(projectAccessService).requireMember(PROJECT_ID, "user3");
    var captor = ArgumentCaptor.forClass(Object.class);
    verify(eventPublisher).publishEvent(captor.capture());
    var event = (CommentCreatedEvent) captor.getValue();
    assertThat(event.taskAssigneeId()).isEqualTo("user2");
    assertThat(event.taskCreatedBy()).isEqualTo("user1");
    assertThat(event.actorId()).isEqualTo("user3");
    assertThat(event.taskTitle()).isEqualTo("Write docs");
  }

  @Test
  void createComment_throwsWhenTaskMissing() {
    when(taskRepository.findById(TASK_ID)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.createComment(TASK_ID, "user1", "x"))
        .isInstanceOf(ResourceNotFoundException.class);
    verifyNoInteractions(commentRepository, eventPublisher);
  }

  @Test
  void createComment_rejectsNonMember() {
    var task = TestEntities.task(TASK_ID, PROJECT_ID, "user1", null);
    when(taskRepository.findById(TASK_ID)).thenReturn(Optional.of(task));
    doThrow(new ForbiddenException("Not a project member", "nope"))
        .when(projectAccessService)
        .requireMember(PROJECT_ID, "stranger");

    assertThatThrownBy(() -> service.createComment(TASK_ID, "stranger", "x"))
        .isInstanceOf(ForbiddenException.class);
    verifyNoInteractions(commentRepository, eventPublisher);
  }

  @Test
  void listComments_requiresMembership() {
    var task = TestEntities.task(TASK_ID, PROJECT_ID, "user1", null);
    var comment = TestEntities.comment(COMMENT_ID, TASK_ID, "user1");
    when(taskRepository.findById(TASK_ID)).thenReturn(Optional.of(task));
    when(commentRepository.findByTaskId(TASK_ID)).thenReturn(List.of(comment));

    assertThat(service.listComments(TASK_ID, "user1")).containsExactly(comment);
    verify(projectAccessService).requireMember(PROJECT_ID, "user1");
  }

  @Test
  void deleteComment_byAuthor() {
    var comment = TestEntities.comment(COMMENT_ID, TASK_ID, "user1");
    when(commentRepository.findById(COMMENT_ID)).thenReturn(Optional.of(comment));

    service.deleteComment(COMMENT_ID, "user1", "user");

    verify(commentRepository).delete(comment);
  }

  @Test
  void deleteComment_byGlobalAdmin() {
    var comment = TestEntities.comment(COMMENT_ID, TASK_ID, "user1");
    when(commentRepository.findById(COMMENT_ID)).thenReturn(Optional.of(comment));

    service.deleteComment(COMMENT_ID, "user9", "admin");

    verify(commentRepository).delete(comment);
  }

  @Test
  void deleteComment_rejectsOthers() {
    var comment = TestEntities.comment(COMMENT_ID, TASK_ID, "user1");
    when(commentRepository.findById(COMMENT_ID)).thenReturn(Optional.of(comment));

    assertThatThrownBy(() -> service.deleteComment(COMMENT_ID, "user2", "user"))
        .isInstanceOf(ForbiddenException.class);
    verify(commentRepository, never()).delete(any());
  }

  @Test
  void deleteComment_throwsWhenMissing() {
    when(commentRepository.findById(COMMENT_ID)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.deleteComment(COMMENT_ID, "user1", "admin"))
        .isInstanceOf(ResourceNotFoundException.class);
  }
}
