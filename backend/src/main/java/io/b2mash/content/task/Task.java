package io.b2mash.content.task;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "tasks")
public class Task {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false, updatable = false)
  private UUID projectId;

  @Column(name = "title", nullable = false, length = 200)
  private String title;

  @Column(name = "description", nullable = false, length = 5000)
  private String description;

  @Convert(converter = TaskStatusConverter.class)
  @Column(name = "status", nullable = false, length = 20)
  private TaskStatus status;

  @Convert(converter = TaskPriorityConverter.class)
  @Column(name = "priority", nullable = false, length = 20)
  private TaskPriority priority;

  @Column(name = "assignee_id")
  private String assigneeId;

  @Column(name = "created_by", nullable = false, updatable = false)
  private String createdBy;

  @Column(name = "due_date")
  private Instant dueDate;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "tags", nullable = false, columnDefinition = "jsonb")
  private List<String> tags = new ArrayList<>();

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Task() {}

  /** New tasks always start as {@link TaskStatus#TODO}. */
  public Task(
      UUID projectId,
      String title,
      String description,
      TaskPriority priority,
      String assigneeId,
      Instant dueDate,
      List<String> tags,
      String createdBy) {
    this.projectId = projectId;
    this.title = title;
    this.description = description != null ? description : "";
    this.status = TaskStatus.TODO;
    this.priority = priority != null ? priority : TaskPriority.MEDIUM;
    this.assigneeId = assigneeId;
    this.dueDate = dueDate;
    this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
    this.createdBy = createdBy;
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
  }

  /**
   * Applies a partial update. Fields the update leaves out keep their value; a provided null
   * assignee or due date clears it; provided tags replace the whole list.
   */
  public void apply(TaskUpdate update) {
    if (update.title() != null) {
      this.title = update.title();
    }
    if (update.description() != null) {
      this.description = update.description();
    }
    if (update.status() != null) {
      this.status = update.status();
    }
    if (update.priority() != null) {
      this.priority = update.priority();
    }
    if (update.assigneeIdProvided()) {
      this.assigneeId = update.assigneeId();
    }
    if (update.dueDateProvided()) {
      this.dueDate = update.dueDate();
    }
    if (update.tags() != null) {
      this.tags = new ArrayList<>(update.tags());
    }
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public String getTitle() {
    return title;
  }

  public String getDescription() {
    return description;
  }

  public TaskStatus getStatus() {
    return status;
  }

  public TaskPriority getPriority() {
    return priority;
  }

  public String getAssigneeId() {
    return assigneeId;
  }

  public String getCreatedBy() {
    return createdBy;
  }

  public Instant getDueDate() {
    return dueDate;
  }

  public List<String> getTags() {
    return List.copyOf(tags);
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
