package io.vaultledger.holdersbackend.service;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.ToIntFunction;
import reactor.core.publisher.Mono;

/**
 * Pulls every page out of an offset/limit source and folds them into one result.
 *
 * <p>Pages are requested one after the other at offsets 0, pageSize, 2 * pageSize, ... until a
 * page's count drops below the page size or {@code fetchAtMost} rows have been counted. When a page
 * carries several lists (one per sub-query), the largest count decides whether another page is
 * needed.
 */
public final class Paginator {

  @FunctionalInterface
  public interface PageFetcher<R> {
    Mono<R> fetch(int offset, int limit);
  }

  private Paginator() {}

  public static <R> Mono<R> paginate(
      PageFetcher<R> fetchPage,
      ToIntFunction<? super R> count,
      BinaryOperator<R> merge,
      PaginationOptions options) {
    return paginateMulti(fetchPage, page -> List.of(count.applyAsInt(page)), merge, options);
  }

  public static <R> Mono<R> paginateMulti(
      PageFetcher<R> fetchPage,
      Function<? super R, List<Integer>> counts,
      BinaryOperator<R> merge,
      PaginationOptions options) {
    PaginationOptions opts = options == null ? PaginationOptions.defaults() : options;
    // Fresh page list per subscription.
    return Mono.defer(() -> fetchFrom(fetchPage, counts, opts, 0, 0L, new ArrayList<R>()))
        .flatMap(
            pages -> {
              if (pages.isEmpty()) {
                return Mono.error(new IllegalStateException("No results found"));
              }
              R acc = pages.get(0);
              for (int i = 1; i < pages.size(); i++) {
                acc = merge.apply(acc, pages.get(i));
              }
              return Mono.just(acc);
            });
  }

  /** Merge function for pages that are plain row lists. */
  public static <T> List<T> concat(List<T> a, List<T> b) {
    List<T> out = new ArrayList<>(a.size() + b.size());
    out.addAll(a);
    out.addAll(b);
    return out;
  }

  private static <R> Mono<List<R>> fetchFrom(
      PageFetcher<R> fetchPage,
      Function<? super R, List<Integer>> counts,
      PaginationOptions opts,
      int offset,
      long fetched,
      List<R> pages) {
    if (fetched >= opts.fetchAtMost()) {
      return Mono.just(pages);
    }
    return fetchPage
        .fetch(offset, opts.pageSize())
        .switchIfEmpty(
            Mono.error(() -> new IllegalStateException("page at offset " + offset + " was empty")))
        .flatMap(
            page -> {
              pages.add(page);
              int pageCount = governingCount(counts.apply(page));
              if (pageCount < opts.pageSize()) {
                return Mono.just(pages);
              }
              Mono<List<R>> next =
                  Mono.defer(
                      () ->
                          fetchFrom(
                              fetchPage,
                              counts,
                              opts,
                              offset + opts.pageSize(),
                              fetched + pageCount,
                              pages));
              if (opts.delay().isZero()) return next;
              return Mono.delay(opts.delay()).then(next);
            });
  }

  private static int governingCount(List<Integer> counts) {
    int max = 0;
    if (counts == null) return max;
    for (Integer c : counts) {
      if (c != null && c > max) max = c;
    }
    return max;
  }
}
