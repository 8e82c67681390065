package io.b2mash.content.member;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import java.util.UUID;

@Entity
@Table(name = "project_members")
@IdClass(ProjectMemberId.class)
public class ProjectMember {

  @Id
  @Column(name = "project_id", nullable = false, updatable = false)
  private UUID projectId;

  @Id
  @Column(name = "user_id", nullable = false, updatable = false)
  private String userId;

  @Column(name = "role", nullable = false, length = 20)
  private String role;

  protected ProjectMember() {}

  public ProjectMember(UUID projectId, String userId, String role) {
    this.projectId = projectId;
    this.userId = userId;
    this.role = role;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public String getUserId() {
    return userId;
  }

  public String getRole() {
    return role;
  }

  public void setRole(String role) {
    this.role = role;
  }
}
