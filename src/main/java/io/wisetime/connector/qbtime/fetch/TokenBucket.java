/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.fetch;

import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import io.wisetime.connector.qbtime.util.CancelledException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Request permits shared by every fetch of the process.
 *
 * <p>Each {@link Limit} grants at most {@code permits} tokens per {@code window}. A withdrawn token returns to its
 * limit exactly one window after it was withdrawn, so no rolling window ever holds more grants than the limit allows.
 * Reservations are serialized; the wait for a reserved token happens outside the lock.
 */
public class TokenBucket {

  private static final Logger log = LoggerFactory.getLogger(TokenBucket.class);

  private final Ticker ticker;
  private final Sleeper sleeper;
  private final List<Window> windows;

  private long lastGrantNanos;
  private boolean granted;

  public TokenBucket(Ticker ticker, Sleeper sleeper, List<Limit> limits) {
    Preconditions.checkArgument(!limits.isEmpty(), "At least one limit is required");
    this.ticker = ticker;
    this.sleeper = sleeper;
    this.windows = limits.stream().map(Window::new).collect(ImmutableList.toImmutableList());
  }

  public static Limit limit(int permits, Duration window) {
    return new Limit(permits, window);
  }

  /**
   * Withdraws one token, suspending the caller until it is available.
   *
   * @throws CancelledException if the thread is interrupted while waiting
   */
  public void acquire() {
    final long waitNanos = reserve();
    if (waitNanos <= 0) {
      return;
    }
    log.debug("Waiting {} ms for a request token", waitNanos / 1_000_000);
    try {
      sleeper.sleep(Duration.ofNanos(waitNanos));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CancelledException("The request was cancelled while waiting for the QuickBooks Time rate limit.", e);
    }
  }

  /**
   * Books the earliest token available in every window and returns how long the caller has to wait for it.
   */
  synchronized long reserve() {
    final long now = ticker.read();
    long grantAt = granted ? Math.max(now, lastGrantNanos) : now;
    for (Window window : windows) {
      grantAt = Math.max(grantAt, window.earliestGrant(now));
    }
    for (Window window : windows) {
      window.record(grantAt);
    }
    lastGrantNanos = grantAt;
    granted = true;
    return grantAt - now;
  }

  @Override
  public String toString() {
    return windows.stream()
        .map(window -> window.limit.toString())
        .collect(Collectors.joining(", ", "TokenBucket[", "]"));
  }

  public static final class Limit {

    private final int permits;
    private final Duration window;

    private Limit(int permits, Duration window) {
      Preconditions.checkArgument(permits > 0, "permits must be positive");
      Preconditions.checkArgument(!window.isNegative() && !window.isZero(), "window must be positive");
      this.permits = permits;
      this.window = window;
    }

    public int getPermits() {
      return permits;
    }

    public Duration getWindow() {
      return window;
    }

    @Override
    public String toString() {
      return permits + "/" + window;
    }
  }

  private static final class Window {

    private final Limit limit;
    private final long windowNanos;
    // grant times of the last `permits` tokens, oldest first
    private final Deque<Long> grants = new ArrayDeque<>();

    private Window(Limit limit) {
      this.limit = limit;
      this.windowNanos = limit.window.toNanos();
    }

    private long earliestGrant(long now) {
      if (grants.size() < limit.permits) {
        return now;
      }
      return grants.peekFirst() + windowNanos;
    }

    private void record(long grantAt) {
      grants.addLast(grantAt);
      if (grants.size() > limit.permits) {
        grants.removeFirst();
      }
    }
  }
}
