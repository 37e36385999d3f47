package io.vaultledger.holdersbackend.service;

import java.time.Duration;

/**
 * @param pageSize rows requested per page
 * @param fetchAtMost stop once this many rows have been counted, even if the source has more
 * @param delay pause between page requests; keeps us under the source's rate limit
 */
public record PaginationOptions(int pageSize, long fetchAtMost, Duration delay) {
  public static final int DEFAULT_PAGE_SIZE = 10_000;
  public static final long DEFAULT_FETCH_AT_MOST = 1_000_000_000L;

  public PaginationOptions {
    if (pageSize < 1) throw new IllegalArgumentException("pageSize must be >= 1");
    delay = delay == null || delay.isNegative() ? Duration.ZERO : delay;
  }

  public static PaginationOptions defaults() {
    return new PaginationOptions(DEFAULT_PAGE_SIZE, DEFAULT_FETCH_AT_MOST, Duration.ZERO);
  }

  public static PaginationOptions ofPageSize(int pageSize) {
    return new PaginationOptions(pageSize, DEFAULT_FETCH_AT_MOST, Duration.ZERO);
  }
}
