/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.date;

import io.wisetime.connector.qbtime.util.ValidationException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import lombok.Value;

/**
 * Inclusive range of calendar dates. Rendered as {@code YYYY-MM-DD} for QuickBooks Time.
 */
@Value
public class DateRange {

  LocalDate startDate;
  LocalDate endDate;

  private DateRange(LocalDate startDate, LocalDate endDate) {
    this.startDate = startDate;
    this.endDate = endDate;
  }

  public static DateRange of(LocalDate startDate, LocalDate endDate) {
    if (startDate.isAfter(endDate)) {
      throw new ValidationException(String.format("The start date %s is after the end date %s.", startDate, endDate));
    }
    return new DateRange(startDate, endDate);
  }

  public static DateRange singleDay(LocalDate date) {
    return new DateRange(date, date);
  }

  public String getStart() {
    return startDate.toString();
  }

  public String getEnd() {
    return endDate.toString();
  }

  public long lengthInDays() {
    return ChronoUnit.DAYS.between(startDate, endDate) + 1;
  }

  public boolean contains(LocalDate date) {
    return !date.isBefore(startDate) && !date.isAfter(endDate);
  }

  /**
   * This range, extended back to the Monday of the ISO week its start date falls in.
   */
  public DateRange fromStartOfWeek() {
    return new DateRange(startDate.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)), endDate);
  }

  @Override
  public String toString() {
    return startDate + " to " + endDate;
  }
}
