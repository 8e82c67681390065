package io.b2mash.content.project;

import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ProjectRepository extends JpaRepository<Project, UUID> {

  boolean existsByIdAndOwnerId(UUID id, String ownerId);

  /** Projects the user holds any membership in, newest first. */
  @Query(
      value =
          """
          SELECT p FROM Project p
          WHERE EXISTS (
            SELECT 1 FROM ProjectMember pm
            WHERE pm.projectId = p.id AND pm.userId = :userId
          )
          ORDER BY p.createdAt DESC, p.id ASC
          """,
      countQuery =
          """
          SELECT COUNT(p) FROM Project p
          WHERE EXISTS (
            SELECT 1 FROM ProjectMember pm
            WHERE pm.projectId = p.id AND pm.userId = :userId
          )
          """)
  Page<Project> findProjectsForMember(@Param("userId") String userId, Pageable pageable);

  @Query(
      """
      SELECT COUNT(p) FROM Project p
      WHERE EXISTS (
        SELECT 1 FROM ProjectMember pm
        WHERE pm.projectId = p.id AND pm.userId = :userId
      )
      """)
  long countProjectsForMember(@Param("userId") String userId);
}
