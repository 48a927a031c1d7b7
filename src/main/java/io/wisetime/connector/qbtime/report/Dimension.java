/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.report;

/**
 * What aggregated totals are keyed by.
 */
public enum Dimension {

  EMPLOYEE,

  JOBCODE,

  GROUP,

  /**
   * The top-level jobcode of the entry's jobcode, i.e. the client when jobcodes are organised client / project / task.
   */
  CLIENT
}
