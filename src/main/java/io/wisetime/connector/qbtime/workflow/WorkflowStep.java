/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.workflow;

import com.google.common.collect.ImmutableSet;
import java.util.Set;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * One named output of a workflow. FETCH steps load data from QuickBooks Time and may run concurrently; REPORT steps
 * reduce fetched data and run one after the other, in declared order.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class WorkflowStep {

  public enum Phase {
    FETCH,
    REPORT
  }

  @FunctionalInterface
  public interface Action {
    Object run(WorkflowContext context);
  }

  String key;
  Phase phase;
  Set<String> requires;
  boolean mandatory;
  Action action;

  public static WorkflowStep fetch(String key, Action action) {
    return new WorkflowStep(key, Phase.FETCH, ImmutableSet.of(), false, action);
  }

  public static WorkflowStep report(String key, Action action) {
    return new WorkflowStep(key, Phase.REPORT, ImmutableSet.of(), false, action);
  }

  /**
   * The step only runs once the outputs of {@code keys} are available, and is skipped if any of them failed.
   */
  public WorkflowStep requiring(String... keys) {
    return new WorkflowStep(key, phase, ImmutableSet.<String>builder().addAll(requires).add(keys).build(),
        mandatory, action);
  }

  /**
   * A failure of a mandatory step fails the whole workflow.
   */
  public WorkflowStep asMandatory() {
    return new WorkflowStep(key, phase, requires, true, action);
  }
}
