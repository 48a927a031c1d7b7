/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.report;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import lombok.Builder;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

/**
 * Pay rules applied by {@link ReportAggregator}.
 *
 * <p>Double time is never derived from hours: only entries flagged by the source data are double time, either
 * through the entry's own flag or through the custom field named by {@code doubleTimeCustomFieldId}.
 */
@Value
@Builder
public class AggregationPolicy {

  public static final BigDecimal OVERTIME_MULTIPLIER = new BigDecimal("1.5");
  public static final BigDecimal DOUBLE_TIME_MULTIPLIER = new BigDecimal("2");

  @Builder.Default
  Duration weeklyOvertimeThreshold = Duration.ofHours(40);

  String doubleTimeCustomFieldId;

  public static AggregationPolicy standard() {
    return AggregationPolicy.builder().build();
  }

  public Optional<String> getDoubleTimeCustomFieldId() {
    return Optional.ofNullable(StringUtils.trimToNull(doubleTimeCustomFieldId));
  }

  static boolean isTruthy(String value) {
    if (value == null) {
      return false;
    }
    switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "yes":
      case "y":
      case "true":
      case "1":
      case "double time":
      case "doubletime":
        return true;
      default:
        return false;
    }
  }
}
