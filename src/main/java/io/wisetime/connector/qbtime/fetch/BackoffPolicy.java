/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.fetch;

import com.google.common.base.Preconditions;
import java.time.Duration;
import java.util.Random;

/**
 * Exponential backoff: the n-th retry waits {@code min(base * 2^(n-1), max)} plus a random jitter.
 */
public class BackoffPolicy {

  private final int maxRetries;
  private final Duration baseDelay;
  private final Duration maxDelay;
  private final Duration maxJitter;
  private final Random random;

  public BackoffPolicy(int maxRetries, Duration baseDelay, Duration maxDelay, Duration maxJitter, Random random) {
    Preconditions.checkArgument(maxRetries >= 0, "maxRetries must not be negative");
    Preconditions.checkArgument(!baseDelay.isNegative(), "baseDelay must not be negative");
    Preconditions.checkArgument(maxDelay.compareTo(baseDelay) >= 0, "maxDelay must not be below baseDelay");
    this.maxRetries = maxRetries;
    this.baseDelay = baseDelay;
    this.maxDelay = maxDelay;
    this.maxJitter = maxJitter;
    this.random = random;
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  /**
   * @param retry 1 for the first retry
   */
  public Duration delayForRetry(int retry) {
    Preconditions.checkArgument(retry >= 1, "retry starts at 1");
    final int doublings = Math.min(retry - 1, 30);
    final long exponential = baseDelay.toMillis() << doublings;
    final long capped = exponential < 0 ? maxDelay.toMillis() : Math.min(exponential, maxDelay.toMillis());
    final long jitter = maxJitter.isZero() ? 0 : (long) (random.nextDouble() * maxJitter.toMillis());
    return Duration.ofMillis(capped + jitter);
  }
}
