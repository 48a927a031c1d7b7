/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.report;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import io.wisetime.connector.qbtime.date.DateRange;
import io.wisetime.connector.qbtime.model.JobCode;
import io.wisetime.connector.qbtime.model.TimeEntry;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import javax.inject.Inject;

/**
 * Builds the derived reports of the accounting workflows from {@link ReportAggregator} output.
 */
public class AccountingReports {

  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
  private static final BigDecimal SECONDS_PER_HOUR = BigDecimal.valueOf(3600);

  private final ReportAggregator aggregator;

  @Inject
  public AccountingReports(ReportAggregator aggregator) {
    this.aggregator = aggregator;
  }

  public TotalsReport totals(Collection<TimeEntry> entries, Dimension dimension, ReferenceData reference) {
    return TotalsReport.of(aggregator.aggregate(entries, dimension, reference), reference);
  }

  public TotalsReport overtime(Collection<TimeEntry> entries, ReferenceData reference) {
    return TotalsReport.of(aggregator.aggregate(entries, Dimension.EMPLOYEE, reference), reference,
        totals -> totals.getOvertimeSeconds() > 0 || totals.getDoubletimeSeconds() > 0);
  }

  public TotalsReport pto(Collection<TimeEntry> entries, ReferenceData reference) {
    return TotalsReport.of(aggregator.aggregate(entries, Dimension.EMPLOYEE, reference), reference,
        totals -> totals.getPtoSeconds() > 0);
  }

  /**
   * Revenue, labor cost and margin per jobcode along {@code dimension} (JOBCODE or CLIENT).
   */
  public ProfitabilityReport profitability(Collection<TimeEntry> entries, Dimension dimension,
                                           ReferenceData reference) {
    final AggregateTotals labor = aggregator.aggregate(entries, dimension, reference);
    final ImmutableSortedMap<Long, BillingSummary> billing = aggregator.billing(entries, dimension, reference, null);
    final List<ProfitabilityReport.Line> lines = labor.getByKey().entrySet().stream()
        .map(entry -> line(entry.getKey(), reference.nameOf(dimension, entry.getKey()).orElse(null),
            entry.getValue(), billing.get(entry.getKey())))
        .collect(ImmutableList.toImmutableList());
    final ProfitabilityReport.Line totals = line(0, null, labor.getTotals(),
        BillingSummary.sum(billing.values()));
    return new ProfitabilityReport(lines, totals);
  }

  /**
   * Profit for a single project subtree, from its labor totals and billing.
   */
  public ProfitabilityReport.Line profitMargin(JobCode project, Totals labor, BillingSummary billing) {
    return line(project.getId(), project.getName(), labor, billing);
  }

  public UtilizationReport utilization(Collection<TimeEntry> entries, ReferenceData reference) {
    final AggregateTotals worked = aggregator.aggregate(entries, Dimension.EMPLOYEE, reference);
    final ImmutableSortedMap<Long, BillingSummary> billing =
        aggregator.billing(entries, Dimension.EMPLOYEE, reference, null);
    final List<UtilizationReport.Line> lines = worked.getByKey().entrySet().stream()
        .map(entry -> {
          final long billable = Optional.ofNullable(billing.get(entry.getKey()))
              .map(BillingSummary::getBillableSeconds)
              .orElse(0L);
          final long workedSeconds = entry.getValue().getWorkedSeconds();
          return new UtilizationReport.Line(entry.getKey(),
              reference.nameOf(Dimension.EMPLOYEE, entry.getKey()).orElse(null),
              workedSeconds, billable, percent(billable, workedSeconds));
        })
        .collect(ImmutableList.toImmutableList());
    final long totalWorked = lines.stream().mapToLong(UtilizationReport.Line::getWorkedSeconds).sum();
    final long totalBillable = lines.stream().mapToLong(UtilizationReport.Line::getBillableSeconds).sum();
    return new UtilizationReport(lines, percent(totalBillable, totalWorked));
  }

  /**
   * @param hourlyRate rate to bill all worked time at; when null, each jobcode's billable rate applies
   */
  public InvoiceSummary invoice(JobCode client, DateRange period, Collection<TimeEntry> entries,
                                ReferenceData reference, BigDecimal hourlyRate) {
    final BillingSummary billing = BillingSummary.sum(
        aggregator.billing(entries, Dimension.CLIENT, reference, hourlyRate).values());
    final InvoiceSummary.InvoiceSummaryBuilder summary = InvoiceSummary.builder()
        .clientId(client.getId())
        .clientName(client.getName())
        .periodStart(period.getStart())
        .periodEnd(period.getEnd())
        .billableSeconds(billing.getBillableSeconds())
        .unbillableSeconds(billing.getUnbillableSeconds())
        .billableHours(BigDecimal.valueOf(billing.getBillableSeconds())
            .divide(SECONDS_PER_HOUR, 2, RoundingMode.HALF_UP))
        .amount(billing.getAmount());
    if (hourlyRate != null) {
      summary.hourlyRate(hourlyRate).rateSource(InvoiceSummary.RateSource.PARAMETER);
    } else {
      summary.hourlyRate(ReportAggregator.billingRateOf(client.getId(), reference).orElse(null))
          .rateSource(InvoiceSummary.RateSource.JOBCODE);
    }
    return summary.build();
  }

  private static ProfitabilityReport.Line line(long id, String name, Totals labor, BillingSummary billing) {
    final BillingSummary bill = billing == null ? new BillingSummary(0, 0, BigDecimal.ZERO) : billing;
    final ProfitabilityReport.Line.LineBuilder line = ProfitabilityReport.Line.builder()
        .id(id)
        .name(name)
        .workedSeconds(labor.getWorkedSeconds())
        .billableSeconds(bill.getBillableSeconds())
        .revenue(bill.getAmount())
        .laborCost(labor.getTotalCost());
    if (labor.hasCost()) {
      final BigDecimal profit = bill.getAmount().subtract(labor.getTotalCost());
      line.profit(profit);
      if (bill.getAmount().signum() != 0) {
        line.marginPercent(profit.multiply(HUNDRED).divide(bill.getAmount(), 2, RoundingMode.HALF_UP));
      }
    }
    return line.build();
  }

  private static BigDecimal percent(long part, long whole) {
    if (whole == 0) {
      return BigDecimal.ZERO.setScale(2, RoundingMode.UNNECESSARY);
    }
    return BigDecimal.valueOf(part).multiply(HUNDRED).divide(BigDecimal.valueOf(whole), 2, RoundingMode.HALF_UP);
  }
}
