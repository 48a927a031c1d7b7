/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.report;

import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Revenue against labor cost. Profit and margin are null when the labor cost is not known.
 */
@Value
public class ProfitabilityReport {

  List<Line> lines;
  Line totals;

  @Value
  @Builder
  public static class Line {
    long id;
    String name;
    long workedSeconds;
    long billableSeconds;
    BigDecimal revenue;
    BigDecimal laborCost;
    BigDecimal profit;
    BigDecimal marginPercent;
  }
}
