/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.workflow;

import static io.wisetime.connector.qbtime.workflow.WorkflowContext.GROUPS;
import static io.wisetime.connector.qbtime.workflow.WorkflowContext.JOBCODES;
import static io.wisetime.connector.qbtime.workflow.WorkflowContext.TIMESHEETS;
import static io.wisetime.connector.qbtime.workflow.WorkflowContext.USERS;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;
import io.wisetime.connector.qbtime.date.DateRange;
import io.wisetime.connector.qbtime.date.DateRangeResolver;
import io.wisetime.connector.qbtime.fetch.EndpointSpec;
import io.wisetime.connector.qbtime.model.JobCode;
import io.wisetime.connector.qbtime.model.TimeEntry;
import io.wisetime.connector.qbtime.report.BillingSummary;
import io.wisetime.connector.qbtime.report.Dimension;
import io.wisetime.connector.qbtime.report.JobCodeTree;
import io.wisetime.connector.qbtime.report.TotalsReport;
import io.wisetime.connector.qbtime.tool.ToolParams;
import io.wisetime.connector.qbtime.util.ValidationException;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.IsoFields;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The named accounting workflows.
 */
public class AccountingWorkflows {

  private static final Logger log = LoggerFactory.getLogger(AccountingWorkflows.class);

  public static final String BIWEEKLY_PAYROLL = "biweekly_payroll";
  public static final String MONTH_END_CLOSING = "month_end_closing";
  public static final String QUARTERLY_TAX_PREP = "quarterly_tax_prep";
  public static final String CLIENT_INVOICE = "client_invoice";
  public static final String PROJECT_PROFITABILITY = "project_profitability";

  static final String CLIENT = "client";
  static final String PROJECT = "project";

  private final Map<String, WorkflowDefinition> definitions = ImmutableMap.<String, WorkflowDefinition>builder()
      .put(BIWEEKLY_PAYROLL, biweeklyPayroll())
      .put(MONTH_END_CLOSING, monthEndClosing())
      .put(QUARTERLY_TAX_PREP, quarterlyTaxPrep())
      .put(CLIENT_INVOICE, clientInvoice())
      .put(PROJECT_PROFITABILITY, projectProfitability())
      .build();

  public Optional<WorkflowDefinition> get(String name) {
    return Optional.ofNullable(definitions.get(name));
  }

  public Set<String> names() {
    return definitions.keySet();
  }

  static WorkflowDefinition biweeklyPayroll() {
    return WorkflowDefinition.builder()
        .name(BIWEEKLY_PAYROLL)
        .description("Payroll for the 14 day pay period ending on end_date (default today)")
        .dateRange((params, resolver) -> DateRangeResolver.payPeriodEndingOn(params.getString("end_date")
            .map(end -> resolver.resolveEnd(end, resolver.today()))
            .orElseGet(resolver::today)))
        .step(users().asMandatory())
        .step(groups())
        .step(jobCodes())
        .step(timesheets())
        .step(WorkflowStep.report("payroll_summary", ctx -> ctx.aggregator()
            .payrollReport(entries(ctx), ctx.reference(), ctx.params().getBoolean("include_zero_time", false)))
            .requiring(TIMESHEETS))
        .step(WorkflowStep.report("overtime_report", ctx -> ctx.reports().overtime(entries(ctx), ctx.reference()))
            .requiring(TIMESHEETS))
        .step(WorkflowStep.report("pto_usage", ctx -> ctx.reports().pto(entries(ctx), ctx.reference()))
            .requiring(TIMESHEETS))
        .step(departmentBreakdown())
        .build();
  }

  static WorkflowDefinition monthEndClosing() {
    return WorkflowDefinition.builder()
        .name(MONTH_END_CLOSING)
        .description("Month end close for month and year (default the previous month)")
        .dateRange(AccountingWorkflows::month)
        .step(users().asMandatory())
        .step(groups())
        .step(jobCodes())
        .step(timesheets())
        .step(WorkflowStep.report("monthly_payroll_summary", ctx -> ctx.aggregator()
            .payrollReport(entries(ctx), ctx.reference(), ctx.params().getBoolean("include_zero_time", false)))
            .requiring(TIMESHEETS))
        .step(WorkflowStep.report("client_billing_summary", ctx -> ctx.reports()
            .profitability(entries(ctx), Dimension.CLIENT, ctx.reference()))
            .requiring(TIMESHEETS, JOBCODES))
        .step(WorkflowStep.report("project_profitability", ctx -> ctx.reports()
            .profitability(entries(ctx), Dimension.JOBCODE, ctx.reference()))
            .requiring(TIMESHEETS, JOBCODES))
        .step(WorkflowStep.report("employee_utilization", ctx -> ctx.reports()
            .utilization(entries(ctx), ctx.reference()))
            .requiring(TIMESHEETS, JOBCODES))
        .build();
  }

  static WorkflowDefinition quarterlyTaxPrep() {
    return WorkflowDefinition.builder()
        .name(QUARTERLY_TAX_PREP)
        .description("Wage and hour totals for quarter and year (default the last completed quarter)")
        .dateRange(AccountingWorkflows::quarter)
        .step(users().asMandatory())
        .step(groups())
        .step(jobCodes())
        .step(timesheets())
        .step(WorkflowStep.report("wages_by_employee", ctx -> ctx.reports()
            .totals(entries(ctx), Dimension.EMPLOYEE, ctx.reference()))
            .requiring(TIMESHEETS))
        .step(WorkflowStep.report("hours_summary", ctx -> ctx.aggregator()
            .aggregate(entries(ctx), Dimension.EMPLOYEE, ctx.reference()).getTotals())
            .requiring(TIMESHEETS))
        .step(WorkflowStep.report("overtime_wages", ctx -> ctx.reports().overtime(entries(ctx), ctx.reference()))
            .requiring(TIMESHEETS))
        .step(WorkflowStep.report("pto_payouts", ctx -> ctx.reports().pto(entries(ctx), ctx.reference()))
            .requiring(TIMESHEETS))
        .step(departmentBreakdown())
        .build();
  }

  static WorkflowDefinition clientInvoice() {
    return WorkflowDefinition.builder()
        .name(CLIENT_INVOICE)
        .description("Invoice data for client_name between start_date and end_date (default last month)")
        .dateRange((params, resolver) -> {
          params.requireString("client_name");
          params.getAmount("hourly_rate");
          return explicitRange(params, resolver, "last month");
        })
        .step(jobCodes().asMandatory())
        .step(WorkflowStep.fetch(CLIENT, ctx -> lookup(ctx, ctx.params().requireString("client_name"), "client"))
            .requiring(JOBCODES)
            .asMandatory())
        .step(timesheetsUnder(CLIENT))
        .step(users())
        .step(WorkflowStep.report("hours_by_employee", ctx -> ctx.reports()
            .totals(entries(ctx), Dimension.EMPLOYEE, ctx.reference()))
            .requiring(TIMESHEETS))
        .step(WorkflowStep.report("hours_by_task", ctx -> ctx.reports()
            .totals(entries(ctx), Dimension.JOBCODE, ctx.reference()))
            .requiring(TIMESHEETS))
        .step(WorkflowStep.report("daily_breakdown", ctx -> ctx.aggregator()
            .dailyTotals(entries(ctx), ctx.reference()))
            .requiring(TIMESHEETS))
        .step(WorkflowStep.report("invoice_summary", ctx -> ctx.reports()
            .invoice(ctx.get(CLIENT, JobCode.class), ctx.dateRange(), entries(ctx), ctx.reference(),
                ctx.params().getAmount("hourly_rate").orElse(null)))
            .requiring(TIMESHEETS))
        .build();
  }

  static WorkflowDefinition projectProfitability() {
    return WorkflowDefinition.builder()
        .name(PROJECT_PROFITABILITY)
        .description("Labor cost against billing for project_name (default year to date)")
        .dateRange((params, resolver) -> {
          params.requireString("project_name");
          return explicitRange(params, resolver, "year to date");
        })
        .step(jobCodes().asMandatory())
        .step(WorkflowStep.fetch(PROJECT, ctx -> lookup(ctx, ctx.params().requireString("project_name"), "project"))
            .requiring(JOBCODES)
            .asMandatory())
        .step(timesheetsUnder(PROJECT))
        .step(users())
        .step(WorkflowStep.report("hours_by_employee", ctx -> ctx.reports()
            .totals(entries(ctx), Dimension.EMPLOYEE, ctx.reference()))
            .requiring(TIMESHEETS))
        .step(WorkflowStep.report("labor_costs", ctx -> ctx.reports()
            .totals(entries(ctx), Dimension.JOBCODE, ctx.reference()))
            .requiring(TIMESHEETS))
        .step(WorkflowStep.report("billing", ctx -> BillingSummary.sum(ctx.aggregator()
            .billing(entries(ctx), Dimension.CLIENT, ctx.reference(), null).values()))
            .requiring(TIMESHEETS))
        .step(WorkflowStep.report("profit_margin", ctx -> ctx.reports()
            .profitMargin(ctx.get(PROJECT, JobCode.class), ctx.get("labor_costs", TotalsReport.class).getTotals(),
                ctx.get("billing", BillingSummary.class)))
            .requiring("labor_costs", "billing"))
        .build();
  }

  private static WorkflowStep users() {
    return WorkflowStep.fetch(USERS, ctx -> ctx.fetcher()
        .fetchAll(EndpointSpec.USERS, ImmutableMap.of("active", "both"))
        .toList());
  }

  private static WorkflowStep groups() {
    return WorkflowStep.fetch(GROUPS, ctx -> ctx.fetcher()
        .fetchAll(EndpointSpec.GROUPS, ImmutableMap.of("active", "both"))
        .toList());
  }

  /**
   * All jobcodes, including inactive and PTO ones, so that every timesheet can be classified.
   */
  private static WorkflowStep jobCodes() {
    return WorkflowStep.fetch(JOBCODES, ctx -> ctx.fetcher()
        .fetchAll(EndpointSpec.JOBCODES, ImmutableMap.of("active", "both", "type", "all"))
        .toList());
  }

  /**
   * Timesheets from the Monday of the week the period starts in, so that weekly overtime is complete for the first
   * week. Reports leave out the entries before the period.
   */
  private static WorkflowStep timesheets() {
    return WorkflowStep.fetch(TIMESHEETS, ctx -> ctx.fetcher()
        .fetchAll(EndpointSpec.TIMESHEETS, periodFilters(ctx.dateRange().fromStartOfWeek()))
        .toList());
  }

  /**
   * Timesheets recorded against the jobcode found by step {@code jobCodeKey}, or any of its descendants.
   */
  private static WorkflowStep timesheetsUnder(String jobCodeKey) {
    return WorkflowStep.fetch(TIMESHEETS, ctx -> {
      final JobCode jobCode = ctx.get(jobCodeKey, JobCode.class);
      final Set<Long> jobCodeIds = ctx.reference().getJobCodes().subtree(jobCode.getId());
      return ctx.fetcher()
          .fetchAll(EndpointSpec.TIMESHEETS, ImmutableMap.<String, String>builder()
              .putAll(periodFilters(ctx.dateRange()))
              .put("jobcode_ids", Joiner.on(',').join(jobCodeIds))
              .build())
          .toList();
    }).requiring(jobCodeKey);
  }

  private static WorkflowStep departmentBreakdown() {
    return WorkflowStep.report("department_breakdown", ctx -> ctx.reports()
        .totals(entries(ctx), Dimension.GROUP, ctx.reference()))
        .requiring(TIMESHEETS, USERS);
  }

  private static Map<String, String> periodFilters(DateRange dateRange) {
    return ImmutableMap.of("start_date", dateRange.getStart(), "end_date", dateRange.getEnd());
  }

  private static List<TimeEntry> entries(WorkflowContext ctx) {
    return ctx.getList(TIMESHEETS, TimeEntry.class);
  }

  /**
   * The jobcode matching {@code name} (wildcards allowed) closest to the top of the hierarchy.
   */
  static JobCode lookup(WorkflowContext ctx, String name, String noun) {
    final JobCodeTree tree = ctx.reference().getJobCodes();
    final List<JobCode> matches = tree.findByName(name);
    if (matches.isEmpty()) {
      throw new ValidationException(String.format("No %s named \"%s\" was found in QuickBooks Time.", noun, name));
    }
    final JobCode match = matches.stream()
        .min(Comparator.<JobCode>comparingInt(jobCode -> tree.ancestry(jobCode.getId()).size())
            .thenComparingLong(JobCode::getId))
        .get();
    if (matches.size() > 1) {
      log.info("{} jobcodes match \"{}\", using {}", matches.size(), name, tree.path(match.getId()));
    }
    return match;
  }

  private static DateRange explicitRange(ToolParams params, DateRangeResolver resolver, String defaultPeriod) {
    final Optional<String> start = params.getString("start_date");
    final Optional<String> end = params.getString("end_date");
    final LocalDate today = resolver.today();
    if (start.isEmpty() && end.isEmpty()) {
      return resolver.resolve(defaultPeriod, today);
    }
    if (start.isEmpty()) {
      throw new ValidationException("start_date is required when end_date is given");
    }
    return DateRange.of(resolver.toDate(start.get(), today),
        end.map(value -> resolver.resolveEnd(value, today)).orElse(today));
  }

  private static DateRange month(ToolParams params, DateRangeResolver resolver) {
    final YearMonth previous = YearMonth.from(resolver.today()).minusMonths(1);
    final int month = params.getInt("month").orElse(previous.getMonthValue());
    if (month < 1 || month > 12) {
      throw new ValidationException("month must be between 1 and 12");
    }
    final int year = params.getInt("year")
        .orElse(params.has("month") ? resolver.today().getYear() : previous.getYear());
    return DateRangeResolver.month(YearMonth.of(year, month));
  }

  private static DateRange quarter(ToolParams params, DateRangeResolver resolver) {
    final LocalDate inPreviousQuarter = resolver.today().minusMonths(3);
    final int quarter = params.getInt("quarter").orElse(inPreviousQuarter.get(IsoFields.QUARTER_OF_YEAR));
    final int year = params.getInt("year")
        .orElse(params.has("quarter") ? resolver.today().getYear() : inPreviousQuarter.getYear());
    return DateRangeResolver.quarter(quarter, year);
  }
}
