package io.b2mash.content.member;

import io.b2mash.content.security.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/projects/{projectId}/members")
public class ProjectMemberController {

  private final ProjectMemberService projectMemberService;

  public ProjectMemberController(ProjectMemberService projectMemberService) {
    this.projectMemberService = projectMemberService;
  }

  @GetMapping
  public ResponseEntity<List<MemberResponse>> listMembers(@PathVariable UUID projectId) {
    var members =
        projectMemberService.listMembers(projectId).stream().map(MemberResponse::from).toList();
    return ResponseEntity.ok(members);
  }

  @PostMapping
  public ResponseEntity<MemberResponse> addMember(
      @PathVariable UUID projectId, @Valid @RequestBody AddMemberRequest request) {
    String requesterId = RequestScopes.requireUserId();
    var member =
        projectMemberService.addMember(projectId, request.userId(), requesterId, request.role());
    return ResponseEntity.created(
            URI.create("/api/projects/" + projectId + "/members/" + member.getUserId()))
        .body(MemberResponse.from(member));
  }

  @PatchMapping("/{userId}")
  public ResponseEntity<MemberResponse> updateMemberRole(
      @PathVariable UUID projectId,
      @PathVariable String userId,
      @Valid @RequestBody UpdateMemberRoleRequest request) {
    String requesterId = RequestScopes.requireUserId();
    var member =
        projectMemberService.updateMemberRole(projectId, userId, request.role(), requesterId);
    return ResponseEntity.ok(MemberResponse.from(member));
  }

  @DeleteMapping("/{userId}")
  public ResponseEntity<Void> removeMember(
      @PathVariable UUID projectId, @PathVariable String userId) {
    String requesterId = RequestScopes.requireUserId();
    projectMemberService.removeMember(projectId, userId, requesterId);
    return ResponseEntity.noContent().build();
  }

  /** {@code role} defaults to member; unsupported values are stored as member. */
  public record AddMemberRequest(
      @NotBlank(message = "userId is required") String userId, String role) {}

  public record UpdateMemberRoleRequest(@NotBlank(message = "role is required") String role) {}

  public record MemberResponse(UUID projectId, String userId, String role) {

    public static MemberResponse from(ProjectMember member) {
      return new MemberResponse(member.getProjectId(), member.getUserId(), member.getRole());
    }
  }
}
