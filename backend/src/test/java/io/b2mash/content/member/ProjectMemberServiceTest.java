package io.b2mash.content.member;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.content.exception.ForbiddenException;
import io.b2mash.content.exception.ResourceNotFoundException;
import io.b2mash.content.project.ProjectRepository;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ProjectMemberServiceTest {

  private static final UUID PROJECT_ID = UUID.randomUUID();
  private static final String OWNER = "user_owner";
  private static final String MEMBER = "user_member";

  @Mock private ProjectMemberRepository projectMemberRepository;
  @Mock private ProjectRepository projectRepository;
  @Mock private ProjectAccessService projectAccessService;
  @InjectMocks private ProjectMemberService service;

  @Test
  void listMembers_throwsWhenProjectMissing() {
    when(projectRepository.existsById(PROJECT_ID)).thenReturn(false);

    assertThatThrownBy(() -> service.listMembers(PROJECT_ID))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void listMembers_returnsNonOwnerMemberships() {
    var member = new ProjectMember(PROJECT_ID, MEMBER, "member");
    when(projectRepository.existsById(PROJECT_ID)).thenReturn(true);
    when(projectMemberRepository.findNonOwnerMembers(PROJECT_ID)).thenReturn(List.of(member));

    assertThat(service.listMembers(PROJECT_ID)).containsExactly(member);
  }

  @ParameterizedTest
  @CsvSource(
      value = {"member,member", "viewer,viewer", "owner,member", "admin,member", "NULL,member"},
      nullValues = "NULL")
  void addMember_normalizesRole(String requested, String stored) {
    when(projectRepository.existsById(PROJECT_ID)).thenReturn(true);
    when(projectMemberRepository.existsByProjectIdAndUserId(PROJECT_ID, MEMBER))
        .thenReturn(false);
    when(projectMemberRepository.save(any(ProjectMember.class)))
        .thenAnswer(inv -> inv.getArgument(0));

    var member = service.addMember(PROJECT_ID, MEMBER, OWNER, requested);

    assertThat(member.getRole()).isEqualTo(stored);
    verify(projectAccessService).requireOwner(PROJECT_ID, OWNER);
  }

  @Test
  void addMember_rejectsExistingMembership() {
    when(projectRepository.existsById(PROJECT_ID)).thenReturn(true);
    when(projectMemberRepository.existsByProjectIdAndUserId(PROJECT_ID, MEMBER)).thenReturn(true);

    assertThatThrownBy(() -> service.addMember(PROJECT_ID, MEMBER, OWNER, "member"))
        .isInstanceOf(ForbiddenException.class);
    verify(projectMemberRepository, never()).save(any());
  }

  @Test
  void addMember_rejectsNonOwner() {
    when(projectRepository.existsById(PROJECT_ID)).thenReturn(true);
    doThrow(new ForbiddenException("Not the project owner", "nope"))
        .when(projectAccessService)
        .requireOwner(PROJECT_ID, MEMBER);

    assertThatThrownBy(() -> service.addMember(PROJECT_ID, "someone", MEMBER, "member"))
        .isInstanceOf(ForbiddenException.class);
    verify(projectMemberRepository, never()).save(any());
  }

  @Test
  void updateMemberRole_changesRole() {
    var member = new ProjectMember(PROJECT_ID, MEMBER, "member");
    when(projectRepository.existsById(PROJECT_ID)).thenReturn(true);
    when(projectMemberRepository.findByProjectIdAndUserId(PROJECT_ID, MEMBER))
        .thenReturn(Optional.of(member));
    when(projectMemberRepository.save(member)).thenReturn(member);

    var updated = service.updateMemberRole(PROJECT_ID, MEMBER, "viewer", OWNER);

    assertThat(updated.getRole()).isEqualTo("viewer");
  }

  @Test
  void updateMemberRole_throwsWhenMembershipMissing() {
    when(projectRepository.existsById(PROJECT_ID)).thenReturn(true);
    when(projectMemberRepository.findByProjectIdAndUserId(PROJECT_ID, MEMBER))
        .thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.updateMemberRole(PROJECT_ID, MEMBER, "viewer", OWNER))
        .isInstanceOfSatisfying(
            ResourceNotFoundException.class,
            ex -> {
              assertThat(ex.getBody().getTitle()).isEqualTo("Member not found");
              assertThat(ex.getBody().getProperties()).containsEntry("resource", "member");
              assertThat(ex.getBody().getDetail()).contains(MEMBER);
            });
  }

  @Test
  void updateMemberRole_cannotTouchOwnerMembership() {
    var owner = new ProjectMember(PROJECT_ID, OWNER, "owner");
    when(projectRepository.existsById(PROJECT_ID)).thenReturn(true);
    when(projectMemberRepository.findByProjectIdAndUserId(PROJECT_ID, OWNER))
        .thenReturn(Optional.of(owner));

    assertThatThrownBy(() -> service.updateMemberRole(PROJECT_ID, OWNER, "viewer", OWNER))
        .isInstanceOf(ForbiddenException.class);
    assertThat(owner.getRole()).isEqualTo("owner");
  }

  @Test
  void removeMember_ownerCannotRemoveSelf() {
    when(projectRepository.existsById(PROJECT_ID)).thenReturn(true);

    assertThatThrownBy(() -> service.removeMember(PROJECT_ID, OWNER, OWNER))
        .isInstanceOfSatisfying(
            ForbiddenException.class,
            ex -> assertThat(ex.getBody().getTitle()).isEqualTo("Cannot remove yourself"));
    verify(projectMemberRepository, never()).delete(any());
  }

  @Test
  void removeMember_throwsWhenMembershipMissing() {
    when(projectRepository.existsById(PROJECT_ID)).thenReturn(true);
    when(projectMemberRepository.findByProjectIdAndUserId(PROJECT_ID, MEMBER))
        .thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.removeMember(PROJECT_ID, MEMBER, OWNER))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void removeMember_deletesMembership() {
    var member = new ProjectMember(PROJECT_ID, MEMBER, "viewer");
    when(projectRepository.existsById(PROJECT_ID)).thenReturn(true);
    when(projectMemberRepository.findByProjectIdAndUserId(PROJECT_ID, MEMBER))
        .thenReturn(Optional.of(member));

    service.removeMember(PROJECT_ID, MEMBER, OWNER);

    verify(projectMemberRepository).delete(member);
  }
}
