/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.report;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Predicate;
import lombok.Value;

/**
 * Named rows of totals along one dimension, with the totals of the rows shown.
 */
@Value
public class TotalsReport {

  Dimension dimension;
  List<Row> rows;
  Totals totals;

  public static TotalsReport of(AggregateTotals aggregate, ReferenceData reference) {
    return of(aggregate, reference, totals -> true);
  }

  /**
   * @param include rows whose totals fail this test are left out, and do not count towards the report totals
   */
  public static TotalsReport of(AggregateTotals aggregate, ReferenceData reference, Predicate<Totals> include) {
    final Dimension dimension = aggregate.getDimension();
    final List<Row> rows = aggregate.getByKey().entrySet().stream()
        .filter(entry -> include.test(entry.getValue()))
        .map(entry -> new Row(entry.getKey(), nameOf(dimension, entry.getKey(), reference), entry.getValue()))
        .collect(ImmutableList.toImmutableList());
    return new TotalsReport(dimension, rows,
        ReportAggregator.sum(rows.stream().map(Row::getTotals).collect(ImmutableList.toImmutableList())));
  }

  private static String nameOf(Dimension dimension, long key, ReferenceData reference) {
    if (dimension == Dimension.JOBCODE) {
      return reference.getJobCodes().get(key).isPresent() ? reference.getJobCodes().path(key) : null;
    }
    if (dimension == Dimension.GROUP && key == 0) {
      return "No department";
    }
    return reference.nameOf(dimension, key).orElse(null);
  }

  @Value
  public static class Row {
    long id;
    String name;
    Totals totals;
  }
}
