/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.report;

import java.math.BigDecimal;
import java.util.List;
import lombok.Value;

@Value
public class UtilizationReport {

  List<Line> lines;
  BigDecimal overallPercent;

  @Value
  public static class Line {
    long userId;
    String name;
    long workedSeconds;
    long billableSeconds;
    BigDecimal utilizationPercent;
  }
}
