package io.b2mash.content.comment;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CommentRepository extends JpaRepository<Comment, UUID> {

  /** Comments on a task, oldest first. */
  @Query("SELECT c FROM Comment c WHERE c.taskId = :taskId ORDER BY c.createdAt ASC, c.id ASC")
  List<Comment> findByTaskId(@Param("taskId") UUID taskId);
}
