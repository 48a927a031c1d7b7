/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.workflow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.wisetime.connector.qbtime.RandomDataGenerator;
import io.wisetime.connector.qbtime.date.DateRange;
import io.wisetime.connector.qbtime.fetch.EndpointSpec;
import io.wisetime.connector.qbtime.fetch.PagedRecords;
import io.wisetime.connector.qbtime.fetch.RateLimitedFetcher;
import io.wisetime.connector.qbtime.model.Group;
import io.wisetime.connector.qbtime.model.JobCodeType;
import io.wisetime.connector.qbtime.model.TimeEntry;
import io.wisetime.connector.qbtime.report.AggregationPolicy;
import io.wisetime.connector.qbtime.report.BillingSummary;
import io.wisetime.connector.qbtime.report.InvoiceSummary;
import io.wisetime.connector.qbtime.report.PayrollReport;
import io.wisetime.connector.qbtime.report.ProfitabilityReport;
import io.wisetime.connector.qbtime.report.TotalsReport;
import io.wisetime.connector.qbtime.tool.ToolParams;
import io.wisetime.connector.qbtime.util.AuthException;
import io.wisetime.connector.qbtime.util.ServerException;
import io.wisetime.connector.qbtime.util.ValidationException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AccountingWorkflowsTest {

  private static final RandomDataGenerator RANDOM_DATA_GENERATOR = new RandomDataGenerator();

  private static final long EMPLOYEE_ID = 1;
  private static final long DEPARTMENT_ID = 100;
  private static final long ACME = 1;
  private static final long WEBSITE = 2;
  private static final long NESTED_ACME = 3;
  private static final long OTHER = 9;

  private RateLimitedFetcher fetcherMock;
  private ExecutorService executor;
  private WorkflowOrchestrator orchestrator;
  private Group department;

  @BeforeEach
  void setup() {
    fetcherMock = mock(RateLimitedFetcher.class);
    executor = Executors.newFixedThreadPool(4);
    final Injector injector = Guice.createInjector(binder -> {
      binder.bind(RateLimitedFetcher.class).toInstance(fetcherMock);
      binder.bind(AggregationPolicy.class).toInstance(AggregationPolicy.standard());
      binder.bind(Clock.class).toInstance(Clock.fixed(Instant.parse("2024-12-31T12:00:00Z"), ZoneOffset.UTC));
      binder.bind(ExecutorService.class).toInstance(executor);
      binder.bind(Ticker.class).toInstance(Ticker.systemTicker());
    });
    orchestrator = injector.getInstance(WorkflowOrchestrator.class);

    department = RANDOM_DATA_GENERATOR.randomGroup(DEPARTMENT_ID);
    serve(EndpointSpec.USERS, ImmutableList.of(RANDOM_DATA_GENERATOR.employee(EMPLOYEE_ID, DEPARTMENT_ID, "20")));
    serve(EndpointSpec.GROUPS, ImmutableList.of(department));
    serve(EndpointSpec.JOBCODES, ImmutableList.of(
        RANDOM_DATA_GENERATOR.jobCode(ACME, 0, "Acme Corp", JobCodeType.REGULAR)
            .setBillable(true)
            .setBillableRate(new BigDecimal("100")),
        RANDOM_DATA_GENERATOR.jobCode(WEBSITE, ACME, "Website", JobCodeType.REGULAR),
        RANDOM_DATA_GENERATOR.jobCode(OTHER, 0, "Other", JobCodeType.REGULAR),
        RANDOM_DATA_GENERATOR.jobCode(NESTED_ACME, OTHER, "Acme Corporation", JobCodeType.REGULAR)));
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void biweeklyPayroll() {
    serve(EndpointSpec.TIMESHEETS, workWeek(LocalDate.of(2024, 12, 23), 5, 9));

    final WorkflowResult result = orchestrator.execute(AccountingWorkflows.BIWEEKLY_PAYROLL, ToolParams.empty());

    assertThat(result.getState()).isEqualTo(WorkflowState.DONE);
    assertThat(result.getDateRange())
        .isEqualTo(DateRange.of(LocalDate.of(2024, 12, 18), LocalDate.of(2024, 12, 31)));
    verify(fetcherMock).fetchAll(EndpointSpec.TIMESHEETS,
        ImmutableMap.of("start_date", "2024-12-16", "end_date", "2024-12-31"));
    verify(fetcherMock).fetchAll(EndpointSpec.JOBCODES, ImmutableMap.of("active", "both", "type", "all"));
    assertThat(result.getReports().keySet())
        .containsExactly("payroll_summary", "overtime_report", "pto_usage", "department_breakdown");

    final PayrollReport payroll = result.getReport("payroll_summary", PayrollReport.class).orElseThrow();
    assertThat(payroll.getTotals().getOvertimeSeconds()).isEqualTo(18_000);
    assertThat(payroll.getTotals().getTotalCost()).isEqualByComparingTo("950.00");
    assertThat(result.getReport("pto_usage", TotalsReport.class).orElseThrow().getRows()).isEmpty();

    final TotalsReport departments = result.getReport("department_breakdown", TotalsReport.class).orElseThrow();
    assertThat(departments.getRows()).extracting(TotalsReport.Row::getName).containsExactly(department.getName());
  }

  @Test
  void biweeklyPayroll_counts_whole_week_before_period_start() {
    // the period starts on Wednesday 12/18; Monday and Tuesday fill the first 18 hours of that week
    serve(EndpointSpec.TIMESHEETS, workWeek(LocalDate.of(2024, 12, 16), 5, 9));

    final WorkflowResult result = orchestrator.execute(AccountingWorkflows.BIWEEKLY_PAYROLL, ToolParams.empty());

    final PayrollReport payroll = result.getReport("payroll_summary", PayrollReport.class).orElseThrow();
    assertThat(payroll.getTotals().getRegularSeconds())
        .as("Wednesday, Thursday and the first 4 hours of Friday")
        .isEqualTo(79_200);
    assertThat(payroll.getTotals().getOvertimeSeconds()).isEqualTo(18_000);
    assertThat(payroll.getTotals().getEntryCount())
        .as("entries before the period are not reported")
        .isEqualTo(3);
    assertThat(payroll.getTotals().getTotalCost()).isEqualByComparingTo("590.00");
  }

  @Test
  void monthEndClosing_fetches_from_start_of_week() {
    serve(EndpointSpec.TIMESHEETS, ImmutableList.of());

    orchestrator.execute(AccountingWorkflows.MONTH_END_CLOSING, ToolParams.empty());

    verify(fetcherMock).fetchAll(EndpointSpec.TIMESHEETS,
        ImmutableMap.of("start_date", "2024-10-28", "end_date", "2024-11-30"));
  }

  @Test
  void biweeklyPayroll_ending_on_given_date() {
    serve(EndpointSpec.TIMESHEETS, ImmutableList.of());

    final WorkflowResult result = orchestrator.execute(AccountingWorkflows.BIWEEKLY_PAYROLL,
        ToolParams.of(ImmutableMap.of("end_date", "12/14/2024")));

    assertThat(result.getDateRange())
        .isEqualTo(DateRange.of(LocalDate.of(2024, 12, 1), LocalDate.of(2024, 12, 14)));
  }

  @Test
  void biweeklyPayroll_timesheet_failure_leaves_reports_out() {
    doThrow(new ServerException("QuickBooks Time is currently unavailable (503). Please try again later."))
        .when(fetcherMock).fetchAll(eq(EndpointSpec.TIMESHEETS), anyMap());

    final WorkflowResult result = orchestrator.execute(AccountingWorkflows.BIWEEKLY_PAYROLL, ToolParams.empty());

    assertThat(result.getState()).isEqualTo(WorkflowState.PARTIALLY_FAILED);
    assertThat(result.getReports()).isEmpty();
    assertThat(result.getErrors()).extracting(WorkflowError::getSource).containsExactly("timesheets");
  }

  @Test
  void biweeklyPayroll_users_failure_fails_workflow() {
    serve(EndpointSpec.TIMESHEETS, ImmutableList.of());
    doThrow(new AuthException("Your QuickBooks Time connection has expired. Please reconnect your account."))
        .when(fetcherMock).fetchAll(eq(EndpointSpec.USERS), anyMap());

    assertThatThrownBy(() -> orchestrator.execute(AccountingWorkflows.BIWEEKLY_PAYROLL, ToolParams.empty()))
        .isInstanceOf(AuthException.class);
  }

  @Test
  void monthEndClosing_periods() {
    serve(EndpointSpec.TIMESHEETS, ImmutableList.of());

    assertThat(orchestrator.execute(AccountingWorkflows.MONTH_END_CLOSING, ToolParams.empty()).getDateRange())
        .isEqualTo(DateRange.of(LocalDate.of(2024, 11, 1), LocalDate.of(2024, 11, 30)));
    assertThat(orchestrator.execute(AccountingWorkflows.MONTH_END_CLOSING,
        ToolParams.of(ImmutableMap.of("month", 2, "year", 2024))).getDateRange())
        .isEqualTo(DateRange.of(LocalDate.of(2024, 2, 1), LocalDate.of(2024, 2, 29)));
    assertThat(orchestrator.execute(AccountingWorkflows.MONTH_END_CLOSING,
        ToolParams.of(ImmutableMap.of("month", "3"))).getDateRange().getStart())
        .isEqualTo("2024-03-01");
    assertThatThrownBy(() -> orchestrator.execute(AccountingWorkflows.MONTH_END_CLOSING,
        ToolParams.of(ImmutableMap.of("month", 13))))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void monthEndClosing_reports() {
    serve(EndpointSpec.TIMESHEETS, ImmutableList.of(
        RANDOM_DATA_GENERATOR.timeEntry(EMPLOYEE_ID, WEBSITE, LocalDate.of(2024, 11, 4), Duration.ofHours(2)),
        RANDOM_DATA_GENERATOR.timeEntry(EMPLOYEE_ID, OTHER, LocalDate.of(2024, 11, 5), Duration.ofHours(2))));

    final WorkflowResult result = orchestrator.execute(AccountingWorkflows.MONTH_END_CLOSING, ToolParams.empty());

    assertThat(result.getReports().keySet()).containsExactly("monthly_payroll_summary", "client_billing_summary",
        "project_profitability", "employee_utilization");
    final ProfitabilityReport clients =
        result.getReport("client_billing_summary", ProfitabilityReport.class).orElseThrow();
    assertThat(clients.getLines()).extracting(ProfitabilityReport.Line::getId).containsExactly(ACME, OTHER);
    assertThat(clients.getTotals().getRevenue()).isEqualByComparingTo("200.00");
  }

  @Test
  void quarterlyTaxPrep_periods() {
    serve(EndpointSpec.TIMESHEETS, ImmutableList.of());

    final WorkflowResult lastQuarter =
        orchestrator.execute(AccountingWorkflows.QUARTERLY_TAX_PREP, ToolParams.empty());
    assertThat(lastQuarter.getDateRange())
        .isEqualTo(DateRange.of(LocalDate.of(2024, 7, 1), LocalDate.of(2024, 9, 30)));
    assertThat(lastQuarter.getReports().keySet()).containsExactly("wages_by_employee", "hours_summary",
        "overtime_wages", "pto_payouts", "department_breakdown");

    assertThat(orchestrator.execute(AccountingWorkflows.QUARTERLY_TAX_PREP,
        ToolParams.of(ImmutableMap.of("quarter", 1))).getDateRange())
        .isEqualTo(DateRange.of(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 3, 31)));
    assertThatThrownBy(() -> orchestrator.execute(AccountingWorkflows.QUARTERLY_TAX_PREP,
        ToolParams.of(ImmutableMap.of("quarter", 5))))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void clientInvoice() {
    serve(EndpointSpec.TIMESHEETS, ImmutableList.of(
        RANDOM_DATA_GENERATOR.timeEntry(EMPLOYEE_ID, WEBSITE, LocalDate.of(2024, 11, 4), Duration.ofHours(2))));

    final WorkflowResult result = orchestrator.execute(AccountingWorkflows.CLIENT_INVOICE,
        ToolParams.of(ImmutableMap.of("client_name", "acme*")));

    assertThat(result.getState()).isEqualTo(WorkflowState.DONE);
    verify(fetcherMock).fetchAll(EndpointSpec.TIMESHEETS, ImmutableMap.of(
        "start_date", "2024-11-01", "end_date", "2024-11-30", "jobcode_ids", "1,2"));
    assertThat(result.getReports().keySet())
        .containsExactly("hours_by_employee", "hours_by_task", "daily_breakdown", "invoice_summary");

    final InvoiceSummary invoice = result.getReport("invoice_summary", InvoiceSummary.class).orElseThrow();
    assertThat(invoice.getClientId()).isEqualTo(ACME);
    assertThat(invoice.getRateSource()).isEqualTo(InvoiceSummary.RateSource.JOBCODE);
    assertThat(invoice.getAmount()).isEqualByComparingTo("200.00");
    assertThat(result.getReport("hours_by_task", TotalsReport.class).orElseThrow().getRows())
        .extracting(TotalsReport.Row::getName).containsExactly("Acme Corp > Website");
  }

  @Test
  void clientInvoice_with_rate_and_dates() {
    serve(EndpointSpec.TIMESHEETS, ImmutableList.of(
        RANDOM_DATA_GENERATOR.timeEntry(EMPLOYEE_ID, WEBSITE, LocalDate.of(2024, 12, 2), Duration.ofHours(2))));

    final WorkflowResult result = orchestrator.execute(AccountingWorkflows.CLIENT_INVOICE, ToolParams.of(
        ImmutableMap.of("client_name", "Acme Corp", "hourly_rate", "150", "start_date", "12/01/2024",
            "end_date", "December 15, 2024")));

    assertThat(result.getDateRange())
        .isEqualTo(DateRange.of(LocalDate.of(2024, 12, 1), LocalDate.of(2024, 12, 15)));
    final InvoiceSummary invoice = result.getReport("invoice_summary", InvoiceSummary.class).orElseThrow();
    assertThat(invoice.getRateSource()).isEqualTo(InvoiceSummary.RateSource.PARAMETER);
    assertThat(invoice.getAmount()).isEqualByComparingTo("300.00");
  }

  @Test
  void clientInvoice_client_not_found() {
    assertThatThrownBy(() -> orchestrator.execute(AccountingWorkflows.CLIENT_INVOICE,
        ToolParams.of(ImmutableMap.of("client_name", "Globex"))))
        .isInstanceOf(ValidationException.class)
        .hasMessage("No client named \"Globex\" was found in QuickBooks Time.");
  }

  @Test
  void clientInvoice_parameters_checked_before_fetching() {
    assertThatThrownBy(() -> orchestrator.execute(AccountingWorkflows.CLIENT_INVOICE, ToolParams.empty()))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("client_name");
    assertThatThrownBy(() -> orchestrator.execute(AccountingWorkflows.CLIENT_INVOICE,
        ToolParams.of(ImmutableMap.of("client_name", "Acme Corp", "hourly_rate", "-5"))))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("hourly_rate");
    assertThatThrownBy(() -> orchestrator.execute(AccountingWorkflows.CLIENT_INVOICE,
        ToolParams.of(ImmutableMap.of("client_name", "Acme Corp", "end_date", "2024-12-15"))))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("start_date");

    verifyNoInteractions(fetcherMock);
  }

  @Test
  void projectProfitability() {
    serve(EndpointSpec.TIMESHEETS, ImmutableList.of(
        RANDOM_DATA_GENERATOR.timeEntry(EMPLOYEE_ID, WEBSITE, LocalDate.of(2024, 6, 3), Duration.ofHours(2))));

    final WorkflowResult result = orchestrator.execute(AccountingWorkflows.PROJECT_PROFITABILITY,
        ToolParams.of(ImmutableMap.of("project_name", "website")));

    assertThat(result.getDateRange())
        .isEqualTo(DateRange.of(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 12, 31)));
    verify(fetcherMock).fetchAll(EndpointSpec.TIMESHEETS, ImmutableMap.of(
        "start_date", "2024-01-01", "end_date", "2024-12-31", "jobcode_ids", "2"));
    assertThat(result.getReport("billing", BillingSummary.class).orElseThrow().getAmount())
        .isEqualByComparingTo("200.00");

    final ProfitabilityReport.Line margin =
        result.getReport("profit_margin", ProfitabilityReport.Line.class).orElseThrow();
    assertThat(margin.getName()).isEqualTo("Website");
    assertThat(margin.getLaborCost()).isEqualByComparingTo("40.00");
    assertThat(margin.getProfit()).isEqualByComparingTo("160.00");
    assertThat(margin.getMarginPercent()).isEqualByComparingTo("80.00");
  }

  @Test
  void names() {
    assertThat(new AccountingWorkflows().names()).containsExactlyInAnyOrder(AccountingWorkflows.BIWEEKLY_PAYROLL,
        AccountingWorkflows.MONTH_END_CLOSING, AccountingWorkflows.QUARTERLY_TAX_PREP,
        AccountingWorkflows.CLIENT_INVOICE, AccountingWorkflows.PROJECT_PROFITABILITY);
  }

  @SuppressWarnings("unchecked")
  private <T> void serve(EndpointSpec<T> endpoint, List<T> records) {
    final PagedRecords<T> pagedRecords = mock(PagedRecords.class);
    when(pagedRecords.toList()).thenReturn(records);
    doReturn(pagedRecords).when(fetcherMock).fetchAll(eq(endpoint), anyMap());
  }

  private static List<TimeEntry> workWeek(LocalDate monday, int days, int hours) {
    final ImmutableList.Builder<TimeEntry> entries = ImmutableList.builder();
    for (int day = 0; day < days; day++) {
      entries.add(
          RANDOM_DATA_GENERATOR.timeEntry(EMPLOYEE_ID, ACME, monday.plusDays(day), Duration.ofHours(hours)));
    }
    return entries.build();
  }
}
