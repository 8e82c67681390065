package io.b2mash.content.member;

import io.b2mash.content.exception.ForbiddenException;
import io.b2mash.content.exception.ResourceNotFoundException;
import io.b2mash.content.project.ProjectRepository;
import io.b2mash.content.security.Roles;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Membership management. Every mutation is reserved to the project owner, and the owner's own
 * membership can neither be re-roled nor removed.
 */
@Service
public class ProjectMemberService {

  private static final Logger log = LoggerFactory.getLogger(ProjectMemberService.class);

  private final ProjectMemberRepository projectMemberRepository;
  private final ProjectRepository projectRepository;
  private final ProjectAccessService projectAccessService;

  public ProjectMemberService(
      ProjectMemberRepository projectMemberRepository,
      ProjectRepository projectRepository,
      ProjectAccessService projectAccessService) {
    this.projectMemberRepository = projectMemberRepository;
    this.projectRepository = projectRepository;
    this.projectAccessService = projectAccessService;
  }

  @Transactional(readOnly = true)
  public List<ProjectMember> listMembers(UUID projectId) {
    requireProject(projectId);
    return projectMemberRepository.findNonOwnerMembers(projectId);
  }

  /** Adds a member. A role other than member or viewer is stored as member. */
  @Transactional
  public ProjectMember addMember(UUID projectId, String userId, String requesterId, String role) {
    requireProject(projectId);
    projectAccessService.requireOwner(projectId, requesterId);

    if (projectMemberRepository.existsByProjectIdAndUserId(projectId, userId)) {
      throw new ForbiddenException(
          "Already a member", "User " + userId + " is already a member of project " + projectId);
    }

    var member =
        projectMemberRepository.save(
            new ProjectMember(projectId, userId, Roles.grantableProjectRole(role)));
    log.info("Added {} to project {} as {}", userId, projectId, member.getRole());
    return member;
  }

  @Transactional
  public ProjectMember updateMemberRole(
      UUID projectId, String userId, String role, String requesterId) {
    requireProject(projectId);
    projectAccessService.requireOwner(projectId, requesterId);

    var member = requireMembership(projectId, userId);
    if (Roles.PROJECT_OWNER.equals(member.getRole())) {
      throw new ForbiddenException(
          "Cannot change owner role", "The owner's membership of a project cannot be changed");
    }

    member.setRole(Roles.grantableProjectRole(role));
    member = projectMemberRepository.save(member);
    log.info("Changed role of {} in project {} to {}", userId, projectId, member.getRole());
    return member;
  }

  @Transactional
  public void removeMember(UUID projectId, String userId, String requesterId) {
    requireProject(projectId);
    projectAccessService.requireOwner(projectId, requesterId);

    if (requesterId.equals(userId)) {
      throw new ForbiddenException(
          "Cannot remove yourself", "The project owner cannot leave their own project");
    }

    var member = requireMembership(projectId, userId);
    if (Roles.PROJECT_OWNER.equals(member.getRole())) {
      throw new ForbiddenException(
          "Cannot remove owner", "The owner's membership of a project cannot be removed");
    }

    projectMemberRepository.delete(member);
    log.info("Removed {} from project {}", userId, projectId);
  }

  private void requireProject(UUID projectId) {
    if (!projectRepository.existsById(projectId)) {
      throw ResourceNotFoundException.project(projectId);
    }
  }

  private ProjectMember requireMembership(UUID projectId, String userId) {
    return projectMemberRepository
        .findByProjectIdAndUserId(projectId, userId)
        .orElseThrow(() -> ResourceNotFoundException.member(projectId, userId));
  }
}
