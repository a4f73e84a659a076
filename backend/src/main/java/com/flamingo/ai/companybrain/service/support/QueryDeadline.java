package com.flamingo.ai.companybrain.service.support;

import java.time.Duration;

/**
 * Overall time budget of one question. Created when the request arrives and handed to every
 * collaborator call, which never waits past it.
 */
public final class QueryDeadline {

  private final long expiresAtNanos;

  private QueryDeadline(long expiresAtNanos) {
    this.expiresAtNanos = expiresAtNanos;
  }

  public static QueryDeadline after(Duration budget) {
    return new QueryDeadline(System.nanoTime() + budget.toNanos());
  }

  /** Time left before the deadline, never negative. */
  public Duration remaining() {
    long left = expiresAtNanos - System.nanoTime();
    return left > 0 ? Duration.ofNanos(left) : Duration.ZERO;
  }

  public boolean isExpired() {
    return remaining().isZero();
  }

  /** The smaller of the given per-call timeout and the time left. */
  public Duration cap(Duration perCallTimeout) {
    Duration left = remaining();
    return perCallTimeout.compareTo(left) < 0 ? perCallTimeout : left;
  }
}
