package io.b2mash.content.member;

import java.io.Serializable;
import java.util.Objects;
import java.util.UUID;

/** Composite key of {@link ProjectMember}: one row per (project, user). */
public class ProjectMemberId implements Serializable {

  private UUID projectId;
  private String userId;

  protected ProjectMemberId() {}

  public ProjectMemberId(UUID projectId, String userId) {
    this.projectId = projectId;
    this.userId = userId;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public String getUserId() {
    return userId;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ProjectMemberId other)) {
      return false;
    }
    return Objects.equals(projectId, other.projectId) && Objects.equals(userId, other.userId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(projectId, userId);
  }
}
