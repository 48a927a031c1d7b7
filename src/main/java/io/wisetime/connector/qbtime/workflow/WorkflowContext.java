/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.workflow;

import com.google.common.collect.ImmutableList;
import io.wisetime.connector.qbtime.date.DateRange;
import io.wisetime.connector.qbtime.fetch.RateLimitedFetcher;
import io.wisetime.connector.qbtime.model.Employee;
import io.wisetime.connector.qbtime.model.Group;
import io.wisetime.connector.qbtime.model.JobCode;
import io.wisetime.connector.qbtime.report.AccountingReports;
import io.wisetime.connector.qbtime.report.ReferenceData;
import io.wisetime.connector.qbtime.report.ReportAggregator;
import io.wisetime.connector.qbtime.tool.ToolParams;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * State shared by the steps of one workflow run: parameters, the resolved period, collaborators and the outputs of
 * the steps completed so far.
 */
public class WorkflowContext {

  public static final String USERS = "users";
  public static final String GROUPS = "groups";
  public static final String JOBCODES = "jobcodes";
  public static final String TIMESHEETS = "timesheets";

  private final ToolParams params;
  private final DateRange dateRange;
  private final RateLimitedFetcher fetcher;
  private final ReportAggregator aggregator;
  private final AccountingReports reports;
  private final Map<String, Object> outputs = new ConcurrentHashMap<>();

  WorkflowContext(ToolParams params, DateRange dateRange, RateLimitedFetcher fetcher, ReportAggregator aggregator,
                  AccountingReports reports) {
    this.params = params;
    this.dateRange = dateRange;
    this.fetcher = fetcher;
    this.aggregator = aggregator;
    this.reports = reports;
  }

  public ToolParams params() {
    return params;
  }

  public DateRange dateRange() {
    return dateRange;
  }

  public RateLimitedFetcher fetcher() {
    return fetcher;
  }

  public ReportAggregator aggregator() {
    return aggregator;
  }

  public AccountingReports reports() {
    return reports;
  }

  public boolean has(String key) {
    return outputs.containsKey(key);
  }

  public <T> T get(String key, Class<T> type) {
    final Object output = outputs.get(key);
    if (output == null) {
      throw new IllegalStateException("No output " + key + " available");
    }
    return type.cast(output);
  }

  @SuppressWarnings("unchecked")
  public <T> List<T> getList(String key, Class<T> elementType) {
    return (List<T>) get(key, List.class);
  }

  /**
   * Employees, groups and jobcodes fetched so far, reporting only entries within the workflow's period. Anything
   * that was not fetched is empty.
   */
  public ReferenceData reference() {
    return ReferenceData.of(
        optionalList(USERS, Employee.class),
        optionalList(GROUPS, Group.class),
        optionalList(JOBCODES, JobCode.class))
        .withReportingPeriod(dateRange);
  }

  void put(String key, Object output) {
    if (output != null) {
      outputs.put(key, output);
    }
  }

  private <T> List<T> optionalList(String key, Class<T> elementType) {
    return Optional.ofNullable(outputs.get(key))
        .map(output -> getList(key, elementType))
        .orElse(ImmutableList.of());
  }
}
