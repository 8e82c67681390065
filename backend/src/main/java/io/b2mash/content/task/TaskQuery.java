package io.b2mash.content.task;

import io.b2mash.content.common.PageBounds;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A task listing rendered to native SQL: one predicate shared by the page query and the count
 * query, an ordering, and a page window.
 */
public final class TaskQuery {

  private final List<TaskFilterClause> clauses;
  private final TaskSort sort;
  private final PageBounds bounds;
  private final String whereClause;
  private final Map<String, Object> params;

  private TaskQuery(List<TaskFilterClause> clauses, TaskSort sort, PageBounds bounds) {
    this.clauses = List.copyOf(clauses);
    this.sort = sort;
    this.bounds = bounds;
    var bound = new HashMap<String, Object>();
    var fragments = new ArrayList<String>();
    for (TaskFilterClause clause : this.clauses) {
      fragments.add(clause.render(bound));
    }
    this.whereClause = String.join(" AND ", fragments);
    this.params = Collections.unmodifiableMap(bound);
  }

  /** Builds the query for one project from raw listing parameters. */
  public static TaskQuery forProject(UUID projectId, TaskFilter filter) {
    return builder(projectId)
        .statusIn(filter.status())
        .priorityIn(filter.priority())
        .assignee(filter.assigneeId())
        .search(filter.search())
        .sort(TaskSort.resolve(filter.sortBy(), filter.sortOrder()))
        .page(PageBounds.of(filter.page(), filter.pageSize()))
        .build();
  }

  public static Builder builder(UUID projectId) {
    return new Builder(projectId);
  }

  public List<TaskFilterClause> clauses() {
    return clauses;
  }

  public TaskSort sort() {
    return sort;
  }

  public PageBounds bounds() {
    return bounds;
  }

  public Map<String, Object> params() {
    return params;
  }

  public String selectSql() {
    return "SELECT t.* FROM tasks t WHERE " + whereClause + " ORDER BY " + sort.toSql();
  }

  public String countSql() {
    return "SELECT COUNT(*) FROM tasks t WHERE " + whereClause;
  }

  public static final class Builder {

    private final List<TaskFilterClause> clauses = new ArrayList<>();
    private TaskSort sort = TaskSort.DEFAULT;
    private PageBounds bounds = PageBounds.of(null, null);

    private Builder(UUID projectId) {
      clauses.add(new TaskFilterClause.ProjectEquals(projectId));
    }

    /** Comma-separated statuses. Blank tokens are dropped; nothing left means no clause. */
    public Builder statusIn(String commaSeparated) {
      var values = splitCsv(commaSeparated);
      if (!values.isEmpty()) {
        clauses.add(new TaskFilterClause.StatusIn(values));
      }
      return this;
    }

    public Builder priorityIn(String commaSeparated) {
      var values = splitCsv(commaSeparated);
      if (!values.isEmpty()) {
        clauses.add(new TaskFilterClause.PriorityIn(values));
      }
      return this;
    }

    public Builder assignee(String assigneeId) {
      if (assigneeId != null && !assigneeId.isEmpty()) {
        clauses.add(new TaskFilterClause.AssigneeEquals(assigneeId));
      }
      return this;
    }

    public Builder search(String term) {
      if (term != null && !term.isEmpty()) {
        clauses.add(new TaskFilterClause.TextContains(term));
      }
      return this;
    }

    public Builder sort(TaskSort sort) {
      this.sort = sort;
      return this;
    }

    public Builder page(PageBounds bounds) {
      this.bounds = bounds;
      return this;
    }

    public TaskQuery build() {
      return new TaskQuery(clauses, sort, bounds);
    }

    private static List<String> splitCsv(String value) {
      if (value == null) {
        return List.of();
      }
      return Arrays.stream(value.split(","))
          .map(String::trim)
          .filter(token -> !token.isEmpty())
          .distinct()
          .toList();
    }
  }
}
