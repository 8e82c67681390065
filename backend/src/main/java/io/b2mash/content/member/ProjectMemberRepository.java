package io.b2mash.content.member;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ProjectMemberRepository extends JpaRepository<ProjectMember, ProjectMemberId> {

  Optional<ProjectMember> findByProjectIdAndUserId(UUID projectId, String userId);

  boolean existsByProjectIdAndUserId(UUID projectId, String userId);

  /** Memberships other than the owner's, ordered by user id. */
  @Query(
      """
      SELECT pm FROM ProjectMember pm
      WHERE pm.projectId = :projectId
        AND pm.role <> 'owner'
      ORDER BY pm.userId ASC
      """)
  List<ProjectMember> findNonOwnerMembers(@Param("projectId") UUID projectId);
}
