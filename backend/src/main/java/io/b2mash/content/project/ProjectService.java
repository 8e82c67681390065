package io.b2mash.content.project;

import io.b2mash.content.common.PageBounds;
import io.b2mash.content.common.PageResult;
import io.b2mash.content.exception.ResourceNotFoundException;
import io.b2mash.content.member.ProjectAccessService;
import io.b2mash.content.member.ProjectMember;
import io.b2mash.content.member.ProjectMemberRepository;
import io.b2mash.content.security.Roles;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ProjectService {

  private static final Logger log = LoggerFactory.getLogger(ProjectService.class);

  private final ProjectRepository projectRepository;
  private final ProjectMemberRepository projectMemberRepository;
  private final ProjectAccessService projectAccessService;

  public ProjectService(
      ProjectRepository projectRepository,
      ProjectMemberRepository projectMemberRepository,
      ProjectAccessService projectAccessService) {
    this.projectRepository = projectRepository;
    this.projectMemberRepository = projectMemberRepository;
    this.projectAccessService = projectAccessService;
  }

  /** Creates the project together with its owner membership, in one transaction. */
  @Transactional
  public Project createProject(String name, String description, String ownerId) {
    var project = projectRepository.save(new Project(name, description, ownerId));
    projectMemberRepository.save(new ProjectMember(project.getId(), ownerId, Roles.PROJECT_OWNER));
    log.info("Created project {} owned by {}", project.getId(), ownerId);
    return project;
  }

  @Transactional(readOnly = true)
  public PageResult<Project> listUserProjects(String userId, Integer page, Integer pageSize) {
    var bounds = PageBounds.of(page, pageSize);
    if (!bounds.isAddressable()) {
      return PageResult.of(List.of(), projectRepository.countProjectsForMember(userId), bounds);
    }
    var result =
        projectRepository.findProjectsForMember(
            userId, PageRequest.of(bounds.page() - 1, bounds.pageSize()));
    return PageResult.of(result.getContent(), result.getTotalElements(), bounds);
  }

  @Transactional(readOnly = true)
  public Project getProjectById(UUID id) {
    return projectRepository
        .findById(id)
        .orElseThrow(() -> ResourceNotFoundException.project(id));
  }

  /** Owner only. Null name or description keeps the stored value. */
  @Transactional
  public Project updateProject(UUID id, String userId, String name, String description) {
    var project = getProjectById(id);
    projectAccessService.requireOwner(id, userId);
    project.update(name, description);
    project = projectRepository.save(project);
    log.info("Updated project {}", id);
    return project;
  }

  /** Owner only. Memberships, tasks and their comments go with it. */
  @Transactional
  public void deleteProject(UUID id, String userId) {
    var project = getProjectById(id);
    projectAccessService.requireOwner(id, userId);
    projectRepository.delete(project);
    log.info("Deleted project {}", id);
  }
}
