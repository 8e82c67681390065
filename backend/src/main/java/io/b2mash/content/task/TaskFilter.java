package io.b2mash.content.task;

/**
 * Raw listing parameters as received. {@code status} and {@code priority} are comma-separated
 * sets; every field is optional.
 */
public record TaskFilter(
    String status,
    String priority,
    String assigneeId,
    String search,
    String sortBy,
    String sortOrder,
    Integer page,
    Integer pageSize) {

  public static TaskFilter none() {
    return new TaskFilter(null, null, null, null, null, null, null, null);
  }
}
