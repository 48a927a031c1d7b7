/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.workflow;

import io.wisetime.connector.qbtime.date.DateRange;
import io.wisetime.connector.qbtime.date.DateRangeResolver;
import io.wisetime.connector.qbtime.tool.ToolParams;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class WorkflowDefinition {

  /**
   * Works out the period a workflow covers from its parameters.
   */
  @FunctionalInterface
  public interface RangeResolution {
    DateRange resolve(ToolParams params, DateRangeResolver resolver);
  }

  String name;
  String description;
  RangeResolution dateRange;
  @Singular
  List<WorkflowStep> steps;
}
