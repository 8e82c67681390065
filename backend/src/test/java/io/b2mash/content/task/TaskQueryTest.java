package io.b2mash.content.task;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.content.common.PageBounds;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class TaskQueryTest {

  private static final UUID PROJECT_ID = UUID.randomUUID();

  @Test
  void projectClauseAlone_whenNoFilters() {
    var query = TaskQuery.forProject(PROJECT_ID, TaskFilter.none());

    assertThat(query.clauses()).containsExactly(new TaskFilterClause.ProjectEquals(PROJECT_ID));
    assertThat(query.countSql())
        .isEqualTo("SELECT COUNT(*) FROM tasks t WHERE t.project_id = :projectId");
    assertThat(query.params()).containsEntry("projectId", PROJECT_ID).hasSize(1);
  }

  @Test
  void statusAndPriority_splitOnCommas() {
    var query =
        TaskQuery.builder(PROJECT_ID).statusIn("todo, in_progress").priorityIn("high").build();

    assertThat(query.params().get("statuses")).isEqualTo(List.of("todo", "in_progress"));
    assertThat(query.params().get("priorities")).isEqualTo(List.of("high"));
    assertThat(query.countSql())
        .contains("t.status IN (:statuses)")
        .contains("t.priority IN (:priorities)");
  }

  @Test
  void blankTokensDropped_andEmptyListOmitsClause() {
    var query = TaskQuery.builder(PROJECT_ID).statusIn(" , ,").priorityIn("low,,").build();

    assertThat(query.clauses())
        .containsExactly(
            new TaskFilterClause.ProjectEquals(PROJECT_ID),
            new TaskFilterClause.PriorityIn(List.of("low")));
    assertThat(query.params()).doesNotContainKey("statuses");
  }

  @Test
  void unknownStatusValueKept_soItMatchesNothing() {
    var query = TaskQuery.builder(PROJECT_ID).statusIn("archived").build();

    assertThat(query.params().get("statuses")).isEqualTo(List.of("archived"));
  }

  @Test
  void assigneeAndSearch_bindParameters() {
    var query = TaskQuery.builder(PROJECT_ID).assignee("user1").search("bug").build();

    assertThat(query.params())
        .containsEntry("assigneeId", "user1")
        .containsEntry("search", "%bug%");
    assertThat(query.countSql())
        .contains("t.assignee_id = :assigneeId")
        .contains("(t.title ILIKE :search ESCAPE '!' OR t.description ILIKE :search ESCAPE '!')");
  }

  @Test
  void emptySearchOmitted() {
    var query = TaskQuery.builder(PROJECT_ID).search("").assignee("").build();

    assertThat(query.clauses()).hasSize(1);
  }

  @Test
  void searchEscapesLikeWildcards() {
    var query = TaskQuery.builder(PROJECT_ID).search("100%_done!").build();

    assertThat(query.params()).containsEntry("search", "%100!%!_done!!%");
  }

  @Test
  void userInputNeverReachesSqlText() {
    var query =
        TaskQuery.builder(PROJECT_ID)
            .statusIn("todo'; DROP TABLE tasks; --")
            .search("' OR 1=1 --")
            .assignee("x' OR 'a'='a")
            .build();

    assertThat(query.selectSql())
        .doesNotContain("DROP")
        .doesNotContain("1=1")
        .doesNotContain("'a'");
  }

  @Test
  void countAndSelectShareThePredicate() {
    var query = TaskQuery.builder(PROJECT_ID).statusIn("todo").search("x").build();

    String where = query.countSql().substring(query.countSql().indexOf(" WHERE "));
    assertThat(query.selectSql()).contains(where + " ORDER BY ");
  }

  @Test
  void clauseOrderDoesNotChangeParameters() {
    var first = TaskQuery.builder(PROJECT_ID).statusIn("todo").priorityIn("high").build();
    var second = TaskQuery.builder(PROJECT_ID).priorityIn("high").statusIn("todo").build();

    assertThat(first.params()).isEqualTo(second.params());
  }

  @Test
  void forProject_resolvesSortAndPage() {
    var filter = new TaskFilter(null, null, null, null, "priority", "asc", 0, 1000);

    var query = TaskQuery.forProject(PROJECT_ID, filter);

    assertThat(query.sort()).isEqualTo(new TaskSort(TaskSort.Field.PRIORITY, false));
    assertThat(query.bounds()).isEqualTo(new PageBounds(1, 100));
  }
}
