/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.report;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Billable amount for one client over a period.
 */
@Value
@Builder
public class InvoiceSummary {

  public enum RateSource {
    PARAMETER,
    JOBCODE
  }

  long clientId;
  String clientName;
  String periodStart;
  String periodEnd;
  BigDecimal hourlyRate;
  RateSource rateSource;
  long billableSeconds;
  long unbillableSeconds;
  BigDecimal billableHours;
  BigDecimal amount;
}
