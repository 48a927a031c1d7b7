/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.workflow;

import lombok.Value;

/**
 * A non-fatal failure of one workflow step.
 */
@Value
public class WorkflowError {
  String source;
  String message;
}
