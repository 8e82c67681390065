package io.b2mash.content.task;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One conjunct of a task listing predicate. Each clause renders a SQL fragment against the {@code
 * tasks t} alias and binds its values as named parameters; user input never reaches the SQL text.
 */
public sealed interface TaskFilterClause {

  String render(Map<String, Object> params);

  record ProjectEquals(UUID projectId) implements TaskFilterClause {
    @Override
    public String render(Map<String, Object> params) {
      params.put("projectId", projectId);
      return "t.project_id = :projectId";
    }
  }

  /** Status is one of the given values. Unknown values simply match nothing. */
  record StatusIn(List<String> statuses) implements TaskFilterClause {
    public StatusIn {
      statuses = List.copyOf(statuses);
    }

    @Override
    public String render(Map<String, Object> params) {
      params.put("statuses", statuses);
      return "t.status IN (:statuses)";
    }
  }

  record PriorityIn(List<String> priorities) implements TaskFilterClause {
    public PriorityIn {
      priorities = List.copyOf(priorities);
    }

    @Override
    public String render(Map<String, Object> params) {
      params.put("priorities", priorities);
      return "t.priority IN (:priorities)";
    }
  }

  record AssigneeEquals(String assigneeId) implements TaskFilterClause {
    @Override
    public String render(Map<String, Object> params) {
      params.put("assigneeId", assigneeId);
      return "t.assignee_id = :assigneeId";
    }
  }

  /**
   * Case-insensitive substring match on title or description. LIKE wildcards in the term are
   * escaped so they match literally.
   */
  record TextContains(String term) implements TaskFilterClause {

    static final char ESCAPE = '!';

    @Override
    public String render(Map<String, Object> params) {
      params.put("search", "%" + escapeLike(term) + "%");
      return "(t.title ILIKE :search ESCAPE '!' OR t.description ILIKE :search ESCAPE '!')";
    }

    static String escapeLike(String value) {
      var escaped = new StringBuilder(value.length());
      for (char c : value.toCharArray()) {
        if (c == ESCAPE || c == '%' || c == '_') {
          escaped.append(ESCAPE);
        }
        escaped.append(c);
      }
      return escaped.toString();
    }
  }
}
