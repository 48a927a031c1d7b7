/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.workflow;

import static io.wisetime.connector.qbtime.ConnectorLauncher.QbTimeConfigKey.WORKFLOW_TIMEOUT_SECONDS;

import com.google.common.base.Ticker;
import com.google.common.collect.Sets;
import io.wisetime.connector.qbtime.config.ConnectorConfig;
import io.wisetime.connector.qbtime.date.DateRange;
import io.wisetime.connector.qbtime.date.DateRangeResolver;
import io.wisetime.connector.qbtime.fetch.RateLimitedFetcher;
import io.wisetime.connector.qbtime.report.AccountingReports;
import io.wisetime.connector.qbtime.report.ReportAggregator;
import io.wisetime.connector.qbtime.tool.ToolParams;
import io.wisetime.connector.qbtime.util.CancelledException;
import io.wisetime.connector.qbtime.util.ConnectorException;
import io.wisetime.connector.qbtime.util.ServerException;
import io.wisetime.connector.qbtime.util.ValidationException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import javax.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs {@link WorkflowDefinition}s.
 *
 * <p>A run resolves its period, then runs its fetch steps in waves: every step whose requirements are met runs
 * concurrently on the fetch executor, all of them sharing the connector's token bucket. Report steps then run in
 * declared order. A failing step that is not mandatory is recorded as a {@link WorkflowError} and the steps
 * requiring it are skipped; a failing mandatory step fails the run.
 *
 * <p>Runs are bounded by a timeout. When it expires, or the calling thread is interrupted, outstanding fetches are
 * interrupted and a {@link CancelledException} is thrown. Nothing of the run is returned in that case.
 */
public class WorkflowOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(WorkflowOrchestrator.class);

  static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);

  private final RateLimitedFetcher fetcher;
  private final ReportAggregator aggregator;
  private final AccountingReports reports;
  private final DateRangeResolver dateRangeResolver;
  private final AccountingWorkflows workflows;
  private final ExecutorService fetchExecutor;
  private final Ticker ticker;

  @Inject
  public WorkflowOrchestrator(RateLimitedFetcher fetcher, ReportAggregator aggregator, AccountingReports reports,
                              DateRangeResolver dateRangeResolver, AccountingWorkflows workflows,
                              ExecutorService fetchExecutor, Ticker ticker) {
    this.fetcher = fetcher;
    this.aggregator = aggregator;
    this.reports = reports;
    this.dateRangeResolver = dateRangeResolver;
    this.workflows = workflows;
    this.fetchExecutor = fetchExecutor;
    this.ticker = ticker;
  }

  /**
   * Runs the named workflow within the configured timeout.
   *
   * @throws ValidationException if there is no workflow of that name
   */
  public WorkflowResult execute(String name, ToolParams params) {
    final WorkflowDefinition definition = workflows.get(name)
        .orElseThrow(() -> new ValidationException("There is no workflow named " + name));
    return execute(definition, params, timeout());
  }

  public WorkflowResult execute(WorkflowDefinition definition, ToolParams params, Duration timeout) {
    return new Run(definition, params, timeout).execute();
  }

  private static Duration timeout() {
    return ConnectorConfig.getLong(WORKFLOW_TIMEOUT_SECONDS)
        .map(Duration::ofSeconds)
        .orElse(DEFAULT_TIMEOUT);
  }

  private class Run {

    private final WorkflowDefinition definition;
    private final ToolParams params;
    private final Duration timeout;
    private final long deadline;
    private final Set<String> completed = new HashSet<>();
    private final Set<String> failed = new HashSet<>();
    private final Map<String, Object> output = new LinkedHashMap<>();
    private final List<WorkflowError> errors = new ArrayList<>();
    private WorkflowState state;
    private WorkflowContext context;

    private Run(WorkflowDefinition definition, ToolParams params, Duration timeout) {
      this.definition = definition;
      this.params = params;
      this.timeout = timeout;
      this.deadline = ticker.read() + timeout.toNanos();
    }

    WorkflowResult execute() {
      transition(WorkflowState.RESOLVING);
      final DateRange dateRange = definition.getDateRange().resolve(params, dateRangeResolver);
      context = new WorkflowContext(params, dateRange, fetcher, aggregator, reports);
      log.info("Running workflow {} for {}", definition.getName(), dateRange);

      transition(WorkflowState.FETCHING);
      runFetchWaves();

      transition(WorkflowState.AGGREGATING);
      runReports();

      transition(WorkflowState.ASSEMBLING);
      final WorkflowState outcome = errors.isEmpty() ? WorkflowState.DONE : WorkflowState.PARTIALLY_FAILED;
      transition(outcome);
      return new WorkflowResult(definition.getName(), outcome, dateRange, output, errors);
    }

    private void runFetchWaves() {
      final List<WorkflowStep> pending = definition.getSteps().stream()
          .filter(step -> step.getPhase() == WorkflowStep.Phase.FETCH)
          .collect(Collectors.toCollection(ArrayList::new));
      while (!pending.isEmpty()) {
        checkCancelled();
        pending.removeIf(this::skipIfBlocked);
        final List<WorkflowStep> wave = pending.stream()
            .filter(step -> completed.containsAll(step.getRequires()))
            .collect(Collectors.toList());
        if (wave.isEmpty() && !pending.isEmpty()) {
          throw new IllegalStateException(String.format("Workflow %s has steps that can never run: %s",
              definition.getName(), pending.stream().map(WorkflowStep::getKey).collect(Collectors.toList())));
        }
        pending.removeAll(wave);
        runWave(wave);
      }
    }

    private void runWave(List<WorkflowStep> wave) {
      final Map<WorkflowStep, Future<Object>> running = new LinkedHashMap<>();
      try {
        wave.forEach(step -> running.put(step, fetchExecutor.submit(() -> step.getAction().run(context))));
        for (Map.Entry<WorkflowStep, Future<Object>> entry : running.entrySet()) {
          try {
            complete(entry.getKey(), entry.getValue().get(remainingNanos(), TimeUnit.NANOSECONDS));
          } catch (ExecutionException e) {
            stepFailed(entry.getKey(), e.getCause());
          }
        }
      } catch (TimeoutException e) {
        throw timedOut();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new CancelledException(String.format("The %s workflow was cancelled.", definition.getName()), e);
      } finally {
        // no-op for steps that already finished
        running.values().forEach(future -> future.cancel(true));
      }
    }

    private void runReports() {
      for (WorkflowStep step : definition.getSteps()) {
        if (step.getPhase() != WorkflowStep.Phase.REPORT || skipIfBlocked(step)) {
          continue;
        }
        checkCancelled();
        if (!completed.containsAll(step.getRequires())) {
          throw new IllegalStateException(String.format("Report %s of workflow %s requires %s before it is declared",
              step.getKey(), definition.getName(), Sets.difference(step.getRequires(), completed)));
        }
        try {
          final Object report = step.getAction().run(context);
          complete(step, report);
          if (report != null) {
            output.put(step.getKey(), report);
          }
        } catch (CancelledException e) {
          throw e;
        } catch (RuntimeException e) {
          stepFailed(step, e);
        }
      }
    }

    /**
     * Skips {@code step} when something it requires failed or was skipped itself.
     */
    private boolean skipIfBlocked(WorkflowStep step) {
      final Set<String> missing = Sets.intersection(step.getRequires(), failed);
      if (missing.isEmpty()) {
        return false;
      }
      if (step.isMandatory()) {
        throw new ServerException(String.format("Could not prepare %s because %s failed.",
            step.getKey(), String.join(", ", missing)));
      }
      log.info("Skipping {} of workflow {}, it requires {}", step.getKey(), definition.getName(), missing);
      failed.add(step.getKey());
      return true;
    }

    private void complete(WorkflowStep step, Object result) {
      context.put(step.getKey(), result);
      completed.add(step.getKey());
    }

    private void stepFailed(WorkflowStep step, Throwable cause) {
      if (cause instanceof CancelledException) {
        throw (CancelledException) cause;
      }
      if (step.isMandatory()) {
        log.warn("Mandatory step {} of workflow {} failed: {}", step.getKey(), definition.getName(),
            cause.getMessage());
        if (cause instanceof RuntimeException) {
          throw (RuntimeException) cause;
        }
        if (cause instanceof Error) {
          throw (Error) cause;
        }
        throw new ServerException("An unexpected error occurred while preparing " + step.getKey() + ".", cause);
      }

      final String message;
      if (cause instanceof ConnectorException) {
        message = cause.getMessage();
        log.warn("Step {} of workflow {} failed: {}", step.getKey(), definition.getName(), message);
      } else {
        message = "An unexpected error occurred while preparing " + step.getKey() + ".";
        log.error("Step {} of workflow {} failed", step.getKey(), definition.getName(), cause);
      }
      errors.add(new WorkflowError(step.getKey(), message));
      failed.add(step.getKey());
    }

    private void checkCancelled() {
      if (Thread.currentThread().isInterrupted()) {
        throw new CancelledException(String.format("The %s workflow was cancelled.", definition.getName()));
      }
      if (remainingNanos() == 0) {
        throw timedOut();
      }
    }

    private long remainingNanos() {
      return Math.max(0, deadline - ticker.read());
    }

    private CancelledException timedOut() {
      log.warn("Workflow {} did not finish within {}", definition.getName(), timeout);
      return new CancelledException(String.format("The %s workflow did not finish within %d seconds and was "
          + "cancelled. Please try a shorter period.", definition.getName(), timeout.getSeconds()));
    }

    private void transition(WorkflowState next) {
      log.debug("Workflow {}: {} -> {}", definition.getName(), state, next);
      state = next;
    }
  }
}
