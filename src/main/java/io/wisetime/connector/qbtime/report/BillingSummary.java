/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.report;

import java.math.BigDecimal;
import java.util.Collection;
import lombok.Value;

@Value
public class BillingSummary {

  long billableSeconds;
  long unbillableSeconds;
  BigDecimal amount;

  public static BillingSummary sum(Collection<BillingSummary> summaries) {
    long billable = 0;
    long unbillable = 0;
    BigDecimal amount = BigDecimal.ZERO;
    for (BillingSummary summary : summaries) {
      billable += summary.billableSeconds;
      unbillable += summary.unbillableSeconds;
      amount = amount.add(summary.amount);
    }
    return new BillingSummary(billable, unbillable, amount);
  }
}
