/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.workflow;

import com.google.common.collect.ImmutableList;
import io.wisetime.connector.qbtime.date.DateRange;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Value;

/**
 * Reports of one workflow run, in declared order, with the failures of the steps that were left out.
 */
@Value
public class WorkflowResult {

  String name;
  WorkflowState state;
  DateRange dateRange;
  Map<String, Object> reports;
  List<WorkflowError> errors;

  public WorkflowResult(String name, WorkflowState state, DateRange dateRange, Map<String, Object> reports,
                        List<WorkflowError> errors) {
    this.name = name;
    this.state = state;
    this.dateRange = dateRange;
    this.reports = Collections.unmodifiableMap(new LinkedHashMap<>(reports));
    this.errors = ImmutableList.copyOf(errors);
  }

  public <T> Optional<T> getReport(String key, Class<T> type) {
    return Optional.ofNullable(reports.get(key)).map(type::cast);
  }
}
