/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.report;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Time and cost totals for one key of a report. Cost fields are null, and left out of the JSON output, when an
 * hourly rate was missing for any of the entries involved.
 */
@Value
@Builder(toBuilder = true)
public class Totals {

  long regularSeconds;
  long overtimeSeconds;
  long doubletimeSeconds;
  long ptoSeconds;
  long totalSeconds;
  int entryCount;

  BigDecimal regularCost;
  BigDecimal overtimeCost;
  BigDecimal doubletimeCost;
  BigDecimal ptoCost;
  BigDecimal totalCost;

  public boolean hasCost() {
    return totalCost != null;
  }

  /**
   * Worked seconds, i.e. everything but PTO.
   */
  public long getWorkedSeconds() {
    return regularSeconds + overtimeSeconds + doubletimeSeconds;
  }
}
