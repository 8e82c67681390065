package io.b2mash.content.member;

import io.b2mash.content.exception.ForbiddenException;
import io.b2mash.content.project.ProjectRepository;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Membership and ownership checks shared by every entity service. Membership is read from {@code
 * project_members}; ownership from {@code projects.owner_id}.
 */
@Service
public class ProjectAccessService {

  private final ProjectMemberRepository projectMemberRepository;
  private final ProjectRepository projectRepository;

  public ProjectAccessService(
      ProjectMemberRepository projectMemberRepository, ProjectRepository projectRepository) {
    this.projectMemberRepository = projectMemberRepository;
    this.projectRepository = projectRepository;
  }

  @Transactional(readOnly = true)
  public boolean isMember(UUID projectId, String userId) {
    return projectMemberRepository.existsByProjectIdAndUserId(projectId, userId);
  }

  @Transactional(readOnly = true)
  public boolean isOwner(UUID projectId, String userId) {
    return projectRepository.existsByIdAndOwnerId(projectId, userId);
  }

  /** Throws {@link ForbiddenException} unless the user holds a membership row in the project. */
  @Transactional(readOnly = true)
  public void requireMember(UUID projectId, String userId) {
    if (!isMember(projectId, userId)) {
      throw ForbiddenException.notMember(projectId);
    }
  }

  /** Throws {@link ForbiddenException} unless the user is the project's owner. */
  @Transactional(readOnly = true)
  public void requireOwner(UUID projectId, String userId) {
    if (!isOwner(projectId, userId)) {
      throw ForbiddenException.notOwner(projectId);
    }
  }
}
