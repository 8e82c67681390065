package io.b2mash.content.task;

import io.b2mash.content.common.PageResult;
import io.b2mash.content.event.TaskAssignedEvent;
import io.b2mash.content.event.TaskStatusChangedEvent;
import io.b2mash.content.exception.ForbiddenException;
import io.b2mash.content.exception.ResourceNotFoundException;
import io.b2mash.content.member.ProjectAccessService;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class TaskService {

  private static final Logger log = LoggerFactory.getLogger(TaskService.class);

  private final TaskRepository taskRepository;
  private final TaskQueryRepository taskQueryRepository;
  private final ProjectAccessService projectAccessService;
  private final ApplicationEventPublisher eventPublisher;

  public TaskService(
      TaskRepository taskRepository,
      TaskQueryRepository taskQueryRepository,
      ProjectAccessService projectAccessService,
      ApplicationEventPublisher eventPublisher) {
    this.taskRepository = taskRepository;
    this.taskQueryRepository = taskQueryRepository;
    this.projectAccessService = projectAccessService;
    this.eventPublisher = eventPublisher;
  }

  /** Filtered, sorted, paginated tasks of one project. Members only. */
  @Transactional(readOnly = true)
  public PageResult<Task> listTasks(UUID projectId, String userId, TaskFilter filter) {
    projectAccessService.requireMember(projectId, userId);
    return taskQueryRepository.execute(TaskQuery.forProject(projectId, filter));
  }

  /** Creates a task in {@link TaskStatus#TODO}. Members only. */
  @Transactional
  public Task createTask(UUID projectId, String createdBy, TaskDraft draft) {
    projectAccessService.requireMember(projectId, createdBy);

    var task =
        taskRepository.save(
            new Task(
                projectId,
                draft.title(),
                draft.description(),
                draft.priority(),
                draft.assigneeId(),
                draft.dueDate(),
                draft.tags(),
                createdBy));
    log.info("Created task {} in project {}", task.getId(), projectId);

    if (task.getAssigneeId() != null) {
      eventPublisher.publishEvent(
          new TaskAssignedEvent(
              task.getId(),
              projectId,
              task.getTitle(),
              task.getAssigneeId(),
              createdBy,
              Instant.now()));
    }
    return task;
  }

  @Transactional(readOnly = true)
  public Task getTaskById(UUID taskId) {
    return taskRepository
        .findById(taskId)
        .orElseThrow(() -> ResourceNotFoundException.task(taskId));
  }

  /** Applies a partial update. Any member may update any task; status moves freely. */
  @Transactional
  public Task updateTask(UUID taskId, String userId, TaskUpdate update) {
    var task = getTaskById(taskId);
    projectAccessService.requireMember(task.getProjectId(), userId);

    TaskStatus previousStatus = task.getStatus();
    String previousAssignee = task.getAssigneeId();

    task.apply(update);
    task = taskRepository.save(task);
    log.info("Updated task {}", taskId);

    if (task.getAssigneeId() != null && !task.getAssigneeId().equals(previousAssignee)) {
      eventPublisher.publishEvent(
          new TaskAssignedEvent(
              task.getId(),
              task.getProjectId(),
              task.getTitle(),
              task.getAssigneeId(),
              userId,
              Instant.now()));
    }
    if (!Objects.equals(previousStatus, task.getStatus())) {
      eventPublisher.publishEvent(
          new TaskStatusChangedEvent(
              task.getId(),
              task.getProjectId(),
              task.getTitle(),
              previousStatus.value(),
              task.getStatus().value(),
              task.getAssigneeId(),
              task.getCreatedBy(),
              userId,
              Instant.now()));
    }
    return task;
  }

  /** Allowed for the task's creator and the project owner. */
  @Transactional
  public void deleteTask(UUID taskId, String userId) {
    var task = getTaskById(taskId);

    boolean isCreator = task.getCreatedBy().equals(userId);
    if (!isCreator && !projectAccessService.isOwner(task.getProjectId(), userId)) {
      throw new ForbiddenException(
          "Cannot delete task", "Only the task creator or project owner can delete task " + taskId);
    }

    taskRepository.delete(task);
    log.info("Deleted task {} from project {}", taskId, task.getProjectId());
  }
}
