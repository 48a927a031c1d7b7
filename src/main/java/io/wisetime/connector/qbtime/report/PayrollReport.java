/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.report;

import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Payroll for a pay period: overall totals and totals per employee, keyed by user id.
 */
@Value
public class PayrollReport {

  Totals totals;
  Map<Long, UserPayroll> byUser;

  public PayrollReport(Totals totals, Map<Long, UserPayroll> byUser) {
    this.totals = totals;
    this.byUser = ImmutableMap.copyOf(byUser);
  }

  @Value
  @Builder
  public static class UserPayroll {
    String name;
    String payrollId;
    long regularSeconds;
    long overtimeSeconds;
    long doubletimeSeconds;
    long ptoSeconds;
    long totalSeconds;
    int timesheetCount;
    BigDecimal regularCost;
    BigDecimal overtimeCost;
    BigDecimal doubletimeCost;
    BigDecimal ptoCost;
    BigDecimal totalCost;
  }
}
