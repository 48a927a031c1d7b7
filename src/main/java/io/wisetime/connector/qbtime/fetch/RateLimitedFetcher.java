/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.fetch;

import static io.wisetime.connector.qbtime.ConnectorLauncher.QbTimeConfigKey.PAGE_SIZE;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;
import com.google.gson.JsonObject;
import io.wisetime.connector.qbtime.QbTimeApiService;
import io.wisetime.connector.qbtime.config.ConnectorConfig;
import io.wisetime.connector.qbtime.model.ApiPage;
import io.wisetime.connector.qbtime.util.CancelledException;
import io.wisetime.connector.qbtime.util.ConnectorException;
import io.wisetime.connector.qbtime.util.ErrorKind;
import io.wisetime.connector.qbtime.util.MissingRequiredFilterException;
import io.wisetime.connector.qbtime.util.ValidationException;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import javax.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Traverses QuickBooks Time list endpoints page by page, within the shared {@link TokenBucket}.
 *
 * <p>Rate limited (429) and failed (5xx, no response) page requests are retried on the same page after a backoff
 * delay, without withdrawing another token. Authentication failures and other client errors are not retried.
 */
public class RateLimitedFetcher {

  private static final Logger log = LoggerFactory.getLogger(RateLimitedFetcher.class);

  static final int MAX_PAGE_SIZE = 200;
  static final int DEFAULT_PAGE_SIZE = 50;

  private final QbTimeApiService apiService;
  private final TokenBucket tokenBucket;
  private final BackoffPolicy backoffPolicy;
  private final Sleeper sleeper;

  @Inject
  public RateLimitedFetcher(QbTimeApiService apiService, TokenBucket tokenBucket, BackoffPolicy backoffPolicy,
                            Sleeper sleeper) {
    this.apiService = apiService;
    this.tokenBucket = tokenBucket;
    this.backoffPolicy = backoffPolicy;
    this.sleeper = sleeper;
  }

  public <T> PagedRecords<T> fetchAll(EndpointSpec<T> endpoint, Map<String, String> filters) {
    return fetchAll(endpoint, filters, defaultPageSize());
  }

  /**
   * Returns a lazy sequence over every record matching {@code filters}. Required filters are checked immediately;
   * nothing is requested until the sequence is iterated.
   *
   * @throws MissingRequiredFilterException if the endpoint needs a filter that is not present
   */
  public <T> PagedRecords<T> fetchAll(EndpointSpec<T> endpoint, Map<String, String> filters, int pageSize) {
    checkRequiredFilters(endpoint, filters);
    checkPageSize(pageSize);
    final ImmutableMap<String, String> traversalFilters = filters.entrySet().stream()
        .filter(entry -> !"page".equals(entry.getKey()) && !"limit".equals(entry.getKey()))
        .collect(ImmutableMap.toImmutableMap(Map.Entry::getKey, Map.Entry::getValue));
    return new PagedRecords<>(this, endpoint, traversalFilters, pageSize);
  }

  /**
   * Requests a single page.
   */
  public <T> ApiPage<T> fetchPage(EndpointSpec<T> endpoint, Map<String, String> filters, int page, int pageSize) {
    checkRequiredFilters(endpoint, filters);
    checkPageSize(pageSize);
    if (page < 1) {
      throw new ValidationException("page must be a positive number");
    }
    final Map<String, String> params = ImmutableMap.<String, String>builder()
        .putAll(filters)
        .put("page", Integer.toString(page))
        .put("limit", Integer.toString(pageSize))
        .buildKeepingLast();

    final ApiPage<T> result = withRetries(endpoint.getPath(), "page " + page, filters, () ->
        apiService.getPage(endpoint.getPath(), endpoint.getResultsKey(), endpoint.getRecordType(), params));
    log.debug("Fetched {} {} from page {}", result.getRecords().size(), endpoint.getPath(), page);
    return result;
  }

  /**
   * Requests a non-paginated endpoint and returns its {@code results.<resultsKey>} object.
   */
  public JsonObject fetchResult(String path, String resultsKey, Map<String, String> filters) {
    return withRetries(path, "result", filters, () -> apiService.getResult(path, resultsKey, filters));
  }

  /**
   * Runs a report endpoint and returns its {@code results.<resultsKey>} object.
   */
  public JsonObject fetchReport(String path, String resultsKey, JsonObject parameters) {
    return withRetries(path, "report", ImmutableMap.of(), () -> apiService.postReport(path, resultsKey, parameters));
  }

  /**
   * Takes one token, then runs {@code request} until it succeeds, fails for good, or retries run out.
   *
   * @param target what is requested from {@code path}, for messages
   */
  private <R> R withRetries(String path, String target, Map<String, String> filters, Supplier<R> request) {
    tokenBucket.acquire();
    int retry = 0;
    while (true) {
      if (Thread.currentThread().isInterrupted()) {
        throw new CancelledException("The request to QuickBooks Time was cancelled.");
      }
      try {
        return request.get();
      } catch (ConnectorException e) {
        if (!e.getKind().isRetryable()) {
          throw withRequestContext(e, path, target, filters);
        }
        if (retry >= backoffPolicy.getMaxRetries()) {
          log.error("Giving up on {} {} after {} retries: {}", path, target, retry, e.getMessage());
          throw e;
        }
        retry++;
        final Duration delay = backoffPolicy.delayForRetry(retry);
        log.warn("Request for {} {} failed ({}), retry {} of {} in {} ms",
            path, target, e.getKind().getCode(), retry, backoffPolicy.getMaxRetries(), delay.toMillis());
        pause(delay);
      }
    }
  }

  private void pause(Duration delay) {
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CancelledException("The request to QuickBooks Time was cancelled while waiting to retry.", e);
    }
  }

  private static ConnectorException withRequestContext(ConnectorException e, String path, String target,
                                                       Map<String, String> filters) {
    if (e.getKind() != ErrorKind.VALIDATION_ERROR) {
      return e;
    }
    return new ValidationException(String.format("%s (request: %s %s, filters %s)",
        e.getMessage(), path, target, filters), e);
  }

  private static void checkRequiredFilters(EndpointSpec<?> endpoint, Map<String, String> filters) {
    final Set<String> required = endpoint.getRequiredAnyOf();
    if (required.isEmpty()) {
      return;
    }
    final Set<String> present = filters.entrySet().stream()
        .filter(entry -> entry.getValue() != null && !entry.getValue().isEmpty())
        .map(Map.Entry::getKey)
        .collect(Collectors.toSet());
    if (Sets.intersection(required, present).isEmpty()) {
      throw new MissingRequiredFilterException(String.format(
          "At least one of these filters is required to list %s: %s", endpoint.getPath(),
          String.join(", ", required)));
    }
  }

  private static void checkPageSize(int pageSize) {
    if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
      throw new ValidationException("limit must be a number between 1 and " + MAX_PAGE_SIZE);
    }
  }

  /**
   * Page size used when a caller does not ask for one: {@code PAGE_SIZE}, or 50.
   */
  public static int defaultPageSize() {
    return Math.min(ConnectorConfig.getInt(PAGE_SIZE).orElse(DEFAULT_PAGE_SIZE), MAX_PAGE_SIZE);
  }
}
