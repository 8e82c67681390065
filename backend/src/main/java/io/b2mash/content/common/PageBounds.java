package io.b2mash.content.common;

/**
 * A normalized page window. The page number floors at 1 and the page size clamps to [1, 100];
 * missing values fall back to page 1 of 20.
 */
public record PageBounds(int page, int pageSize) {

  public static final int DEFAULT_PAGE_SIZE = 20;
  public static final int MAX_PAGE_SIZE = 100;

  public static PageBounds of(Integer page, Integer pageSize) {
    int resolvedPage = Math.max(page != null ? page : 1, 1);
    int resolvedSize =
        Math.min(Math.max(pageSize != null ? pageSize : DEFAULT_PAGE_SIZE, 1), MAX_PAGE_SIZE);
    return new PageBounds(resolvedPage, resolvedSize);
  }

  public long offset() {
    return (long) (page - 1) * pageSize;
  }

  /**
   * False when the window starts beyond the largest row offset JDBC accepts. Such a page is always
   * empty, so callers skip the row query and report the count alone.
   */
  public boolean isAddressable() {
    return offset() <= Integer.MAX_VALUE;
  }
}
