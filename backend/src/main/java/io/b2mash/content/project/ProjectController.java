package io.b2mash.content.project;

import io.b2mash.content.common.PageResult;
import io.b2mash.content.security.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/projects")
public class ProjectController {

  private final ProjectService projectService;

  public ProjectController(ProjectService projectService) {
    this.projectService = projectService;
  }

  @PostMapping
  public ResponseEntity<ProjectResponse> createProject(
      @Valid @RequestBody CreateProjectRequest request) {
    String userId = RequestScopes.requireUserId();
    var project = projectService.createProject(request.name(), request.description(), userId);
    return ResponseEntity.created(URI.create("/api/projects/" + project.getId()))
        .body(ProjectResponse.from(project));
  }

  @GetMapping
  public ResponseEntity<PageResult<ProjectResponse>> listProjects(
      @RequestParam(required = false) Integer page,
      @RequestParam(required = false) Integer pageSize) {
    String userId = RequestScopes.requireUserId();
    var projects = projectService.listUserProjects(userId, page, pageSize);
    return ResponseEntity.ok(projects.map(ProjectResponse::from));
  }

  @GetMapping("/{id}")
  public ResponseEntity<ProjectResponse> getProject(@PathVariable UUID id) {
    return ResponseEntity.ok(ProjectResponse.from(projectService.getProjectById(id)));
  }

  @PatchMapping("/{id}")
  public ResponseEntity<ProjectResponse> updateProject(
      @PathVariable UUID id, @Valid @RequestBody UpdateProjectRequest request) {
    String userId = RequestScopes.requireUserId();
    var project =
        projectService.updateProject(id, userId, request.name(), request.description());
    return ResponseEntity.ok(ProjectResponse.from(project));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteProject(@PathVariable UUID id) {
    String userId = RequestScopes.requireUserId();
    projectService.deleteProject(id, userId);
    return ResponseEntity.noContent().build();
  }

  public record CreateProjectRequest(
      @NotBlank(message = "name is required")
          @Size(max = 200, message = "name must be at most 200 characters")
          String name,
      @Size(max = 2000, message = "description must be at most 2000 characters")
          String description) {}

  public record UpdateProjectRequest(
      @Size(min = 1, max = 200, message = "name must be between 1 and 200 characters")
          String name,
      @Size(max = 2000, message = "description must be at most 2000 characters")
          String description) {}

  public record ProjectResponse(
      UUID id,
      String name,
      String description,
      String ownerId,
      Instant createdAt,
      Instant updatedAt) {

    public static ProjectResponse from(Project project) {
      return new ProjectResponse(
          project.getId(),
          project.getName(),
          project.getDescription(),
          project.getOwnerId(),
          project.getCreatedAt(),
          project.getUpdatedAt());
    }
  }
}
