package io.b2mash.content.task;

import io.b2mash.content.common.PageResult;
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
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class TaskController {

  private final TaskService taskService;

  public TaskController(TaskService taskService) {
    this.taskService = taskService;
  }

  @PostMapping("/api/projects/{projectId}/tasks")
  public ResponseEntity<TaskResponse> createTask(
      @PathVariable UUID projectId, @Valid @RequestBody CreateTaskRequest request) {
    String userId = RequestScopes.requireUserId();
    var task = taskService.createTask(projectId, userId, request.toDraft());
    return ResponseEntity.created(URI.create("/api/tasks/" + task.getId()))
        .body(TaskResponse.from(task));
  }

  @GetMapping("/api/projects/{projectId}/tasks")
  public ResponseEntity<PageResult<TaskResponse>> listTasks(
      @PathVariable UUID projectId,
      @RequestParam(required = false) String status,
      @RequestParam(required = false) String priority,
      @RequestParam(required = false) String assigneeId,
      @RequestParam(required = false) String search,
      @RequestParam(required = false) String sortBy,
      @RequestParam(required = false) String sortOrder,
      @RequestParam(required = false) Integer page,
      @RequestParam(required = false) Integer pageSize) {
    String userId = RequestScopes.requireUserId();
    var filter =
        new TaskFilter(status, priority, assigneeId, search, sortBy, sortOrder, page, pageSize);
    var tasks = taskService.listTasks(projectId, userId, filter);
    return ResponseEntity.ok(tasks.map(TaskResponse::from));
  }

  @GetMapping("/api/tasks/{id}")
  public ResponseEntity<TaskResponse> getTask(@PathVariable UUID id) {
    return ResponseEntity.ok(TaskResponse.from(taskService.getTaskById(id)));
  }

  @PatchMapping("/api/tasks/{id}")
  public ResponseEntity<TaskResponse> updateTask(
      @PathVariable UUID id, @Valid @RequestBody UpdateTaskRequest request) {
    String userId = RequestScopes.requireUserId();
    var task = taskService.updateTask(id, userId, request.toUpdate());
    return ResponseEntity.ok(TaskResponse.from(task));
  }

  @DeleteMapping("/api/tasks/{id}")
  public ResponseEntity<Void> deleteTask(@PathVariable UUID id) {
    String userId = RequestScopes.requireUserId();
    taskService.deleteTask(id, userId);
    return ResponseEntity.noContent().build();
  }

  /** A {@code status} in the body is ignored: tasks always start as todo. */
  public record CreateTaskRequest(
      @NotBlank(message = "title is required")
          @Size(max = 200, message = "title must be at most 200 characters")
          String title,
      @Size(max = 5000, message = "description must be at most 5000 characters")
          String description,
      TaskPriority priority,
      String assigneeId,
      Instant dueDate,
      List<String> tags) {

    TaskDraft toDraft() {
      return new TaskDraft(title, description, priority, assigneeId, dueDate, tags);
    }
  }

  /**
   * Partial update body. Jackson calls a setter only for properties present in the JSON, so an
   * explicit {@code null} for assigneeId or dueDate clears the field while an absent one keeps it.
   */
  public static class UpdateTaskRequest {

    @Size(min = 1, max = 200, message = "title must be between 1 and 200 characters")
    private String title;

    @Size(max = 5000, message = "description must be at most 5000 characters")
    private String description;

    private TaskStatus status;
    private TaskPriority priority;
    private String assigneeId;
    private boolean assigneeIdPresent;
    private Instant dueDate;
    private boolean dueDatePresent;
    private List<String> tags;

    public String getTitle() {
      return title;
    }

    public void setTitle(String title) {
      this.title = title;
    }

    public String getDescription() {
      return description;
    }

    public void setDescription(String description) {
      this.description = description;
    }

    public TaskStatus getStatus() {
      return status;
    }

    public void setStatus(TaskStatus status) {
      this.status = status;
    }

    public TaskPriority getPriority() {
      return priority;
    }

    public void setPriority(TaskPriority priority) {
      this.priority = priority;
    }

    public String getAssigneeId() {
      return assigneeId;
    }

    public void setAssigneeId(String assigneeId) {
      this.assigneeId = assigneeId;
      this.assigneeIdPresent = true;
    }

    public Instant getDueDate() {
      return dueDate;
    }

    public void setDueDate(Instant dueDate) {
      this.dueDate = dueDate;
      this.dueDatePresent = true;
    }

    public List<String> getTags() {
      return tags;
    }

    public void setTags(List<String> tags) {
      this.tags = tags;
    }

    TaskUpdate toUpdate() {
      var update =
          TaskUpdate.empty()
              .withTitle(title)
              .withDescription(description)
              .withStatus(status)
              .withPriority(priority)
              .withTags(tags);
      if (assigneeIdPresent) {
        update = update.withAssigneeId(assigneeId);
      }
      if (dueDatePresent) {
        update = update.withDueDate(dueDate);
      }
      return update;
    }
  }

  public record TaskResponse(
      UUID id,
      UUID projectId,
      String title,
      String description,
      TaskStatus status,
      TaskPriority priority,
      String assigneeId,
      String createdBy,
      Instant dueDate,
      List<String> tags,
      Instant createdAt,
      Instant updatedAt) {

    public static TaskResponse from(Task task) {
      return new TaskResponse(
          task.getId(),
          task.getProjectId(),
          task.getTitle(),
          task.getDescription(),
          task.getStatus(),
          task.getPriority(),
          task.getAssigneeId(),
          task.getCreatedBy(),
          task.getDueDate(),
          task.getTags(),
          task.getCreatedAt(),
          task.getUpdatedAt());
    }
  }
}
