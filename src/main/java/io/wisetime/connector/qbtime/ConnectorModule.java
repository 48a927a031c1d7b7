/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime;

import static io.wisetime.connector.qbtime.ConnectorLauncher.QbTimeConfigKey.DOUBLE_TIME_CUSTOMFIELD_ID;
import static io.wisetime.connector.qbtime.ConnectorLauncher.QbTimeConfigKey.FETCH_THREADS;
import static io.wisetime.connector.qbtime.ConnectorLauncher.QbTimeConfigKey.RATE_LIMIT_PER_MINUTE;
import static io.wisetime.connector.qbtime.ConnectorLauncher.QbTimeConfigKey.RATE_LIMIT_PER_SECOND;
import static io.wisetime.connector.qbtime.ConnectorLauncher.QbTimeConfigKey.RETRY_BASE_DELAY_MS;
import static io.wisetime.connector.qbtime.ConnectorLauncher.QbTimeConfigKey.RETRY_JITTER_MS;
import static io.wisetime.connector.qbtime.ConnectorLauncher.QbTimeConfigKey.RETRY_MAX_ATTEMPTS;
import static io.wisetime.connector.qbtime.ConnectorLauncher.QbTimeConfigKey.RETRY_MAX_DELAY_MS;
import static io.wisetime.connector.qbtime.ConnectorLauncher.QbTimeConfigKey.WEEKLY_OVERTIME_HOURS;

import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.wisetime.connector.qbtime.config.ConnectorConfig;
import io.wisetime.connector.qbtime.fetch.BackoffPolicy;
import io.wisetime.connector.qbtime.fetch.Sleeper;
import io.wisetime.connector.qbtime.fetch.TokenBucket;
import io.wisetime.connector.qbtime.report.AggregationPolicy;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Process wide collaborators: the shared token bucket, retry policy, pay rules and the fetch thread pool.
 */
public class ConnectorModule extends AbstractModule {

  static final int DEFAULT_PER_SECOND = 3;
  static final int DEFAULT_PER_MINUTE = 300;
  static final int DEFAULT_FETCH_THREADS = 4;

  @Provides
  @Singleton
  Ticker ticker() {
    return Ticker.systemTicker();
  }

  @Provides
  @Singleton
  Sleeper sleeper() {
    return Sleeper.SYSTEM;
  }

  @Provides
  @Singleton
  Clock clock() {
    return Clock.systemUTC();
  }

  @Provides
  @Singleton
  TokenBucket tokenBucket(Ticker ticker, Sleeper sleeper) {
    return new TokenBucket(ticker, sleeper, ImmutableList.of(
        TokenBucket.limit(ConnectorConfig.getInt(RATE_LIMIT_PER_SECOND).orElse(DEFAULT_PER_SECOND),
            Duration.ofSeconds(1)),
        TokenBucket.limit(ConnectorConfig.getInt(RATE_LIMIT_PER_MINUTE).orElse(DEFAULT_PER_MINUTE),
            Duration.ofMinutes(1))));
  }

  @Provides
  @Singleton
  BackoffPolicy backoffPolicy() {
    return new BackoffPolicy(
        ConnectorConfig.getInt(RETRY_MAX_ATTEMPTS).orElse(5),
        Duration.ofMillis(ConnectorConfig.getLong(RETRY_BASE_DELAY_MS).orElse(1000L)),
        Duration.ofMillis(ConnectorConfig.getLong(RETRY_MAX_DELAY_MS).orElse(30_000L)),
        Duration.ofMillis(ConnectorConfig.getLong(RETRY_JITTER_MS).orElse(250L)),
        new SecureRandom());
  }

  @Provides
  @Singleton
  AggregationPolicy aggregationPolicy() {
    final AggregationPolicy.AggregationPolicyBuilder policy = AggregationPolicy.builder();
    ConnectorConfig.getInt(WEEKLY_OVERTIME_HOURS).ifPresent(hours -> policy.weeklyOvertimeThreshold(
        Duration.ofHours(hours)));
    ConnectorConfig.getString(DOUBLE_TIME_CUSTOMFIELD_ID).ifPresent(policy::doubleTimeCustomFieldId);
    return policy.build();
  }

  @Provides
  @Singleton
  ExecutorService fetchExecutor() {
    return Executors.newFixedThreadPool(ConnectorConfig.getInt(FETCH_THREADS).orElse(DEFAULT_FETCH_THREADS),
        new ThreadFactoryBuilder().setNameFormat("qbtime-fetch-%d").setDaemon(true).build());
  }
}
