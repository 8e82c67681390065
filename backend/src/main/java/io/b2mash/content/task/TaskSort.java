package io.b2mash.content.task;

/**
 * Resolved ordering of a task listing. Rows with equal sort keys are ordered by creation time
 * (newest first) and then id, so paging through a stable data set never repeats or skips a row.
 */
public record TaskSort(Field field, boolean descending) {

  public static final TaskSort DEFAULT = new TaskSort(Field.CREATED_AT, true);

  public enum Field {
    CREATED_AT("createdAt", "t.created_at"),
    DUE_DATE("dueDate", "t.due_date"),
    PRIORITY(
        "priority",
        "CASE t.priority WHEN 'low' THEN 0 WHEN 'medium' THEN 1 WHEN 'high' THEN 2"
            + " WHEN 'critical' THEN 3 END");

    private final String parameter;
    private final String expression;

    Field(String parameter, String expression) {
      this.parameter = parameter;
      this.expression = expression;
    }

    static Field fromParameter(String parameter) {
      for (Field field : values()) {
        if (field.parameter.equals(parameter)) {
          return field;
        }
      }
      return null;
    }
  }

  /**
   * Resolves request parameters. Missing or unrecognized {@code sortBy} gives {@link #DEFAULT}
   * regardless of {@code sortOrder}; order is ascending only for an explicit {@code asc}.
   */
  public static TaskSort resolve(String sortBy, String sortOrder) {
    Field field = sortBy != null ? Field.fromParameter(sortBy) : null;
    if (field == null) {
      return DEFAULT;
    }
    return new TaskSort(field, !"asc".equalsIgnoreCase(sortOrder));
  }

  /** ORDER BY body (without the keyword). Tasks without a due date sort last either way. */
  public String toSql() {
    String direction = descending ? "DESC" : "ASC";
    var sql = new StringBuilder(field.expression).append(' ').append(direction);
    if (field == Field.DUE_DATE) {
      sql.append(" NULLS LAST");
    }
    if (field != Field.CREATED_AT) {
      sql.append(", t.created_at DESC");
    }
    sql.append(", t.id ASC");
    return sql.toString();
  }
}
