/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.report;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableSortedMap;
import io.wisetime.connector.qbtime.model.Employee;
import io.wisetime.connector.qbtime.model.JobCode;
import io.wisetime.connector.qbtime.model.JobCodeType;
import io.wisetime.connector.qbtime.model.TimeEntry;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;
import javax.inject.Inject;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reduces time entries into regular, overtime, double time and PTO totals, with labor cost where hourly rates are
 * known.
 *
 * <p>Overtime is computed per employee and ISO week. Entries count towards the week of their {@code date}, in
 * start time order; the first {@link AggregationPolicy#getWeeklyOvertimeThreshold()} of regular time in a week is
 * regular, the remainder is overtime. Paid breaks are regular time but, like PTO and double time, never count
 * towards the threshold. Unpaid breaks are not paid time and are left out entirely.
 *
 * <p>With a {@link ReferenceData#getReportingPeriod() reporting period}, entries outside it are only used to fill the
 * weekly threshold and are not reported.
 */
public class ReportAggregator {

  private static final Logger log = LoggerFactory.getLogger(ReportAggregator.class);

  private static final BigDecimal SECONDS_PER_HOUR = BigDecimal.valueOf(3600);
  private static final int CURRENCY_SCALE = 2;

  private static final Comparator<TimeEntry> START_ORDER = Comparator
      .comparingLong(ReportAggregator::startEpochSecond)
      .thenComparing(TimeEntry::getDate, Comparator.nullsLast(Comparator.<String>naturalOrder()))
      .thenComparingLong(TimeEntry::getId);

  private final AggregationPolicy policy;

  @Inject
  public ReportAggregator(AggregationPolicy policy) {
    this.policy = policy;
  }

  public AggregateTotals aggregate(Collection<TimeEntry> entries, Dimension dimension, ReferenceData reference) {
    return aggregate(entries, dimension, reference, false);
  }

  /**
   * @param includeZeroTime when true, every key the reference data knows for {@code dimension} is present, with zero
   *                        totals if it has no entries; when false only keys with entries are present
   */
  public AggregateTotals aggregate(Collection<TimeEntry> entries, Dimension dimension, ReferenceData reference,
                                   boolean includeZeroTime) {
    final SortedMap<Long, Accumulator> accumulators = new TreeMap<>();
    if (includeZeroTime) {
      reference.keysOf(dimension).forEach(key -> {
        final boolean costKnown = dimension != Dimension.EMPLOYEE || reference.rateOf(key).isPresent();
        accumulators.put(key, new Accumulator(costKnown));
      });
    }

    for (EntrySplit split : split(entries, reference)) {
      final long key = keyOf(split.getEntry(), dimension, reference);
      accumulators.computeIfAbsent(key, k -> new Accumulator(true))
          .add(split, reference.rateOf(split.getEntry().getUserId()));
    }

    final ImmutableSortedMap<Long, Totals> byKey = accumulators.entrySet().stream()
        .collect(ImmutableSortedMap.toImmutableSortedMap(
            Comparator.<Long>naturalOrder(), Map.Entry::getKey, entry -> entry.getValue().toTotals()));
    return new AggregateTotals(dimension, byKey, sum(byKey.values()));
  }

  /**
   * Totals per calendar date of the entries.
   */
  public ImmutableSortedMap<LocalDate, Totals> dailyTotals(Collection<TimeEntry> entries, ReferenceData reference) {
    final SortedMap<LocalDate, Accumulator> accumulators = new TreeMap<>();
    for (EntrySplit split : split(entries, reference)) {
      accumulators.computeIfAbsent(split.getEntry().getLocalDate(), k -> new Accumulator(true))
          .add(split, reference.rateOf(split.getEntry().getUserId()));
    }
    return accumulators.entrySet().stream()
        .collect(ImmutableSortedMap.toImmutableSortedMap(
            Comparator.<LocalDate>naturalOrder(), Map.Entry::getKey, entry -> entry.getValue().toTotals()));
  }

  /**
   * Billable time and amount per dimension key. Worked time (not PTO) is billed at {@code rateOverride} when given,
   * otherwise at the billable rate of the entry's jobcode or its closest ancestor that has one. Time without a rate
   * is reported as unbillable. No overtime multiplier applies to billing.
   */
  public ImmutableSortedMap<Long, BillingSummary> billing(Collection<TimeEntry> entries, Dimension dimension,
                                                          ReferenceData reference, BigDecimal rateOverride) {
    final SortedMap<Long, long[]> seconds = new TreeMap<>();
    final SortedMap<Long, BigDecimal> rateSeconds = new TreeMap<>();
    for (EntrySplit split : split(entries, reference)) {
      final long key = keyOf(split.getEntry(), dimension, reference);
      final long worked = split.getRegularSeconds() + split.getOvertimeSeconds() + split.getDoubletimeSeconds();
      final long[] keySeconds = seconds.computeIfAbsent(key, k -> new long[2]);
      rateSeconds.putIfAbsent(key, BigDecimal.ZERO);
      final Optional<BigDecimal> rate = rateOverride != null
          ? Optional.of(rateOverride)
          : billingRateOf(split.getEntry().getJobcodeId(), reference);
      if (rate.isPresent()) {
        keySeconds[0] += worked;
        rateSeconds.merge(key, rate.get().multiply(BigDecimal.valueOf(worked)), BigDecimal::add);
      } else {
        keySeconds[1] += worked;
      }
    }
    return seconds.entrySet().stream()
        .collect(ImmutableSortedMap.toImmutableSortedMap(Comparator.<Long>naturalOrder(), Map.Entry::getKey,
            entry -> new BillingSummary(entry.getValue()[0], entry.getValue()[1],
                toCurrency(rateSeconds.get(entry.getKey()), BigDecimal.ONE))));
  }

  /**
   * Billable rate of the jobcode, or of its closest ancestor with one.
   */
  public static Optional<BigDecimal> billingRateOf(long jobcodeId, ReferenceData reference) {
    return reference.getJobCodes().ancestry(jobcodeId).stream()
        .map(JobCode::getBillingRate)
        .flatMap(Optional::stream)
        .findFirst();
  }

  /**
   * Builds the payroll report: overall totals and totals per employee.
   */
  public PayrollReport payrollReport(Collection<TimeEntry> entries, ReferenceData reference,
                                     boolean includeZeroTime) {
    final AggregateTotals byEmployee = aggregate(entries, Dimension.EMPLOYEE, reference, includeZeroTime);
    final Map<Long, PayrollReport.UserPayroll> byUser = new LinkedHashMap<>();
    byEmployee.getByKey().forEach((userId, totals) -> {
      final Optional<Employee> employee = reference.employee(userId);
      byUser.put(userId, PayrollReport.UserPayroll.builder()
          .name(employee.map(Employee::getDisplayName).orElse(null))
          .payrollId(employee.map(Employee::getPayrollId).orElse(null))
          .regularSeconds(totals.getRegularSeconds())
          .overtimeSeconds(totals.getOvertimeSeconds())
          .doubletimeSeconds(totals.getDoubletimeSeconds())
          .ptoSeconds(totals.getPtoSeconds())
          .totalSeconds(totals.getTotalSeconds())
          .timesheetCount(totals.getEntryCount())
          .regularCost(totals.getRegularCost())
          .overtimeCost(totals.getOvertimeCost())
          .doubletimeCost(totals.getDoubletimeCost())
          .ptoCost(totals.getPtoCost())
          .totalCost(totals.getTotalCost())
          .build());
    });
    return new PayrollReport(byEmployee.getTotals(), byUser);
  }

  /**
   * Sums totals. Cost is only summed when every input has one.
   */
  public static Totals sum(Collection<Totals> totals) {
    long regular = 0;
    long overtime = 0;
    long doubletime = 0;
    long pto = 0;
    int count = 0;
    boolean costKnown = true;
    BigDecimal regularCost = BigDecimal.ZERO;
    BigDecimal overtimeCost = BigDecimal.ZERO;
    BigDecimal doubletimeCost = BigDecimal.ZERO;
    BigDecimal ptoCost = BigDecimal.ZERO;
    for (Totals item : totals) {
      regular += item.getRegularSeconds();
      overtime += item.getOvertimeSeconds();
      doubletime += item.getDoubletimeSeconds();
      pto += item.getPtoSeconds();
      count += item.getEntryCount();
      if (item.hasCost()) {
        regularCost = regularCost.add(item.getRegularCost());
        overtimeCost = overtimeCost.add(item.getOvertimeCost());
        doubletimeCost = doubletimeCost.add(item.getDoubletimeCost());
        ptoCost = ptoCost.add(item.getPtoCost());
      } else {
        costKnown = false;
      }
    }
    final Totals.TotalsBuilder builder = Totals.builder()
        .regularSeconds(regular)
        .overtimeSeconds(overtime)
        .doubletimeSeconds(doubletime)
        .ptoSeconds(pto)
        .totalSeconds(regular + overtime + doubletime + pto)
        .entryCount(count);
    if (costKnown) {
      builder.regularCost(regularCost)
          .overtimeCost(overtimeCost)
          .doubletimeCost(doubletimeCost)
          .ptoCost(ptoCost)
          .totalCost(regularCost.add(overtimeCost).add(doubletimeCost));
    }
    return builder.build();
  }

  /**
   * Classifies every paid entry into regular, overtime, double time and PTO seconds.
   */
  @VisibleForTesting
  List<EntrySplit> split(Collection<TimeEntry> entries, ReferenceData reference) {
    final List<EntrySplit> splits = new ArrayList<>();
    final Map<EmployeeWeek, List<TimeEntry>> accumulating = new LinkedHashMap<>();
    final JobCodeTree jobCodes = reference.getJobCodes();

    for (TimeEntry entry : entries) {
      final JobCodeType type = jobCodes.effectiveType(entry.getJobcodeId());
      final long seconds = entry.getDurationSeconds();
      if (type == JobCodeType.UNPAID_BREAK) {
        log.debug("Skipping unpaid break {}", entry.getId());
      } else if (type == JobCodeType.PAID_BREAK) {
        splits.add(new EntrySplit(entry, seconds, 0, 0, 0));
      } else if (type == JobCodeType.PTO) {
        splits.add(new EntrySplit(entry, 0, 0, 0, seconds));
      } else if (isDoubleTime(entry)) {
        splits.add(new EntrySplit(entry, 0, 0, seconds, 0));
      } else {
        accumulating.computeIfAbsent(EmployeeWeek.of(entry), key -> new ArrayList<>()).add(entry);
      }
    }

    final long threshold = policy.getWeeklyOvertimeThreshold().getSeconds();
    accumulating.values().forEach(weekEntries -> {
      weekEntries.sort(START_ORDER);
      long worked = 0;
      for (TimeEntry entry : weekEntries) {
        final long seconds = entry.getDurationSeconds();
        final long regular = Math.max(0, Math.min(seconds, threshold - worked));
        splits.add(new EntrySplit(entry, regular, seconds - regular, 0, 0));
        worked += seconds;
      }
    });
    if (reference.getReportingPeriod().isEmpty()) {
      return splits;
    }
    return splits.stream()
        .filter(split -> split.getEntry().getDate() == null || reference.isReported(split.getEntry().getLocalDate()))
        .collect(Collectors.toList());
  }

  private boolean isDoubleTime(TimeEntry entry) {
    if (entry.isDoubleTime()) {
      return true;
    }
    return policy.getDoubleTimeCustomFieldId()
        .map(fieldId -> entry.getCustomFields().get(fieldId))
        .map(AggregationPolicy::isTruthy)
        .orElse(false);
  }

  private static long keyOf(TimeEntry entry, Dimension dimension, ReferenceData reference) {
    switch (dimension) {
      case EMPLOYEE:
        return entry.getUserId();
      case JOBCODE:
        return entry.getJobcodeId();
      case GROUP:
        return reference.groupOf(entry.getUserId());
      case CLIENT:
        return reference.getJobCodes().rootOf(entry.getJobcodeId());
      default:
        throw new IllegalArgumentException("Unsupported dimension " + dimension);
    }
  }

  private static long startEpochSecond(TimeEntry entry) {
    return entry.getStartTime()
        .map(OffsetDateTime::toEpochSecond)
        .orElseGet(() -> entry.getDate() == null
            ? Long.MIN_VALUE
            : entry.getLocalDate().atStartOfDay().toEpochSecond(ZoneOffset.UTC));
  }

  private static BigDecimal toCurrency(BigDecimal rateSeconds, BigDecimal multiplier) {
    return rateSeconds.multiply(multiplier).divide(SECONDS_PER_HOUR, CURRENCY_SCALE, RoundingMode.HALF_UP);
  }

  /**
   * Seconds of one entry by pay category. The four parts add up to the entry's duration.
   */
  @Value
  static class EntrySplit {
    TimeEntry entry;
    long regularSeconds;
    long overtimeSeconds;
    long doubletimeSeconds;
    long ptoSeconds;
  }

  @Value
  private static class EmployeeWeek {
    long userId;
    int weekBasedYear;
    int week;

    static EmployeeWeek of(TimeEntry entry) {
      final LocalDate date = entry.getLocalDate();
      return new EmployeeWeek(entry.getUserId(), date.get(IsoFields.WEEK_BASED_YEAR),
          date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
    }
  }

  /**
   * Running totals for one key. Cost is accumulated as rate times seconds and only converted to currency once.
   */
  private static class Accumulator {

    private long regular;
    private long overtime;
    private long doubletime;
    private long pto;
    private int count;
    private boolean costKnown;
    private BigDecimal regularRateSeconds = BigDecimal.ZERO;
    private BigDecimal overtimeRateSeconds = BigDecimal.ZERO;
    private BigDecimal doubletimeRateSeconds = BigDecimal.ZERO;
    private BigDecimal ptoRateSeconds = BigDecimal.ZERO;

    private Accumulator(boolean costKnown) {
      this.costKnown = costKnown;
    }

    private void add(EntrySplit split, Optional<BigDecimal> rate) {
      regular += split.getRegularSeconds();
      overtime += split.getOvertimeSeconds();
      doubletime += split.getDoubletimeSeconds();
      pto += split.getPtoSeconds();
      count++;
      if (!rate.isPresent()) {
        costKnown = false;
        return;
      }
      final BigDecimal hourly = rate.get();
      regularRateSeconds = regularRateSeconds.add(hourly.multiply(BigDecimal.valueOf(split.getRegularSeconds())));
      overtimeRateSeconds = overtimeRateSeconds.add(hourly.multiply(BigDecimal.valueOf(split.getOvertimeSeconds())));
      doubletimeRateSeconds = doubletimeRateSeconds
          .add(hourly.multiply(BigDecimal.valueOf(split.getDoubletimeSeconds())));
      ptoRateSeconds = ptoRateSeconds.add(hourly.multiply(BigDecimal.valueOf(split.getPtoSeconds())));
    }

    private Totals toTotals() {
      final Totals.TotalsBuilder builder = Totals.builder()
          .regularSeconds(regular)
          .overtimeSeconds(overtime)
          .doubletimeSeconds(doubletime)
          .ptoSeconds(pto)
          .totalSeconds(regular + overtime + doubletime + pto)
          .entryCount(count);
      if (costKnown) {
        final BigDecimal regularCost = toCurrency(regularRateSeconds, BigDecimal.ONE);
        final BigDecimal overtimeCost = toCurrency(overtimeRateSeconds, AggregationPolicy.OVERTIME_MULTIPLIER);
        final BigDecimal doubletimeCost = toCurrency(doubletimeRateSeconds, AggregationPolicy.DOUBLE_TIME_MULTIPLIER);
        builder.regularCost(regularCost)
            .overtimeCost(overtimeCost)
            .doubletimeCost(doubletimeCost)
            .ptoCost(toCurrency(ptoRateSeconds, BigDecimal.ONE))
            .totalCost(regularCost.add(overtimeCost).add(doubletimeCost));
      }
      return builder.build();
    }
  }
}
