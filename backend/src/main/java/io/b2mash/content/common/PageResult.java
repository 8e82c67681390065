package io.b2mash.content.common;

import java.util.List;
import java.util.function.Function;

/** One page of a listing plus the total number of matching rows. */
public record PageResult<T>(List<T> items, long total, int page, int pageSize, boolean hasMore) {

  public static <T> PageResult<T> of(List<T> items, long total, PageBounds bounds) {
    boolean hasMore = bounds.offset() + items.size() < total;
    return new PageResult<>(List.copyOf(items), total, bounds.page(), bounds.pageSize(), hasMore);
  }

  public <R> PageResult<R> map(Function<? super T, ? extends R> mapper) {
    List<R> mapped = items.stream().<R>map(mapper).toList();
    return new PageResult<>(mapped, total, page, pageSize, hasMore);
  }
}
