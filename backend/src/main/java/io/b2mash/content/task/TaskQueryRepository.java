package io.b2mash.content.task;

import io.b2mash.content.common.PageResult;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/** Runs a {@link TaskQuery} as two native statements: a count and a page. */
@Repository
public class TaskQueryRepository {

  private static final Logger log = LoggerFactory.getLogger(TaskQueryRepository.class);

  @PersistenceContext private EntityManager entityManager;

  @Transactional(readOnly = true)
  public PageResult<Task> execute(TaskQuery query) {
    log.debug("Task listing: {} with {}", query.selectSql(), query.params());

    Query count = entityManager.createNativeQuery(query.countSql());
    query.params().forEach(count::setParameter);
    long total = ((Number) count.getSingleResult()).longValue();

    if (!query.bounds().isAddressable()) {
      return PageResult.of(List.of(), total, query.bounds());
    }

    Query page = entityManager.createNativeQuery(query.selectSql(), Task.class);
    query.params().forEach(page::setParameter);
    page.setFirstResult((int) query.bounds().offset());
    page.setMaxResults(query.bounds().pageSize());

    @SuppressWarnings("unchecked")
    List<Task> tasks = page.getResultList();
    return PageResult.of(tasks, total, query.bounds());
  }
}
