/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.tool;

import java.util.List;
import lombok.Value;

/**
 * A jobcode with its children, for the hierarchy tool.
 */
@Value
public class JobCodeNode {
  long id;
  String name;
  String type;
  boolean billable;
  boolean active;
  List<JobCodeNode> children;
}
