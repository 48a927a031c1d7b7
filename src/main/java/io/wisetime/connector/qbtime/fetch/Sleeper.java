/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.fetch;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Blocks the calling thread. Replaced in tests so that waiting advances a fake ticker instead.
 */
@FunctionalInterface
public interface Sleeper {

  Sleeper SYSTEM = duration -> TimeUnit.NANOSECONDS.sleep(duration.toNanos());

  void sleep(Duration duration) throws InterruptedException;
}
