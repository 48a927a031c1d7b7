/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.tool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.inject.Guice;
import io.wisetime.connector.qbtime.QbTimeApiService;
import io.wisetime.connector.qbtime.RandomDataGenerator;
import io.wisetime.connector.qbtime.date.DateRange;
import io.wisetime.connector.qbtime.fetch.BackoffPolicy;
import io.wisetime.connector.qbtime.fetch.Sleeper;
import io.wisetime.connector.qbtime.fetch.TokenBucket;
import io.wisetime.connector.qbtime.model.ApiPage;
import io.wisetime.connector.qbtime.model.CustomField;
import io.wisetime.connector.qbtime.model.Employee;
import io.wisetime.connector.qbtime.model.JobCodeType;
import io.wisetime.connector.qbtime.model.TimeEntry;
import io.wisetime.connector.qbtime.report.AggregationPolicy;
import io.wisetime.connector.qbtime.util.AuthException;
import io.wisetime.connector.qbtime.workflow.WorkflowOrchestrator;
import io.wisetime.connector.qbtime.workflow.WorkflowResult;
import io.wisetime.connector.qbtime.workflow.WorkflowState;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class ToolDispatcherTest {

  private static final RandomDataGenerator RANDOM_DATA_GENERATOR = new RandomDataGenerator();

  private final QbTimeApiService apiServiceMock = mock(QbTimeApiService.class);
  private final WorkflowOrchestrator orchestratorMock = mock(WorkflowOrchestrator.class);
  private final Map<String, List<?>> served = new HashMap<>();
  private ToolDispatcher dispatcher;

  @BeforeEach
  void setup() {
    dispatcher = Guice.createInjector(binder -> {
      binder.bind(QbTimeApiService.class).toInstance(apiServiceMock);
      binder.bind(QbTimeApiService.QbTimeApi.class).toInstance(mock(QbTimeApiService.QbTimeApi.class));
      binder.bind(WorkflowOrchestrator.class).toInstance(orchestratorMock);
      binder.bind(TokenBucket.class).toInstance(mock(TokenBucket.class));
      binder.bind(Sleeper.class).toInstance(mock(Sleeper.class));
      binder.bind(BackoffPolicy.class).toInstance(
          new BackoffPolicy(1, Duration.ofMillis(10), Duration.ofMillis(10), Duration.ZERO, new Random()));
      binder.bind(AggregationPolicy.class).toInstance(AggregationPolicy.standard());
      binder.bind(Clock.class).toInstance(Clock.fixed(Instant.parse("2024-12-31T12:00:00Z"), ZoneOffset.UTC));
    }).getInstance(ToolDispatcher.class);

    when(apiServiceMock.getPage(anyString(), anyString(), any(), anyMap())).thenAnswer(invocation ->
        new ApiPage<Object>()
            .setRecords(ImmutableList.<Object>copyOf(served.getOrDefault(invocation.getArgument(0),
                ImmutableList.of())))
            .setMore(false));
  }

  @Test
  void call_unknown_tool() {
    final ToolResult result = dispatcher.call("payroll_report", ToolParams.empty());

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.getError().getCode()).isEqualTo("validation_error");
    assertThat(result.getError().getMessage())
        .startsWith("Unknown tool: payroll_report.")
        .contains("get_payroll");
  }

  @Test
  void suggest() {
    assertThat(ToolDispatcher.suggest("create_Invoice")).contains("prepare_client_invoice");
    assertThat(ToolDispatcher.suggest("custom_field_list")).contains("get_custom_fields");
    assertThat(ToolDispatcher.suggest("frobnicate")).isEqualTo("Please check the list of available tools.");
    assertThat(ToolDispatcher.suggest(null)).isEqualTo("Please check the list of available tools.");
  }

  @Test
  void toolNames() {
    assertThat(dispatcher.toolNames()).contains("get_jobcodes", "get_timesheets", "get_payroll",
        "get_timesheet", "get_current_totals", "get_custom_fields", "get_last_modified", "get_project_report",
        "prepare_biweekly_payroll", "month_end_closing", "quarterly_tax_prep", "prepare_client_invoice",
        "analyze_project_profitability", "resolve_date_range", "translate_terms");
  }

  @Test
  void getJobCodes_translates_filters() {
    served.put("jobcodes", ImmutableList.of(
        RANDOM_DATA_GENERATOR.jobCode(1, 0, "Vacation", JobCodeType.PTO),
        RANDOM_DATA_GENERATOR.jobCode(2, 0, "Sick leave", JobCodeType.PTO)));

    final ToolResult result = dispatcher.call("get_jobcodes", ToolParams.parse(
        "{\"type\": \"Vacation\", \"active\": \"Both\", \"parent_ids\": [7, 8], \"name\": \"V*\"}"));

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.getResult().getAsJsonObject().get("count").getAsInt()).isEqualTo(2);
    assertThat(result.getResult().getAsJsonObject().has("page")).isFalse();
    assertThat(requestFilters("jobcodes"))
        .containsEntry("type", "pto")
        .containsEntry("active", "both")
        .containsEntry("parent_ids", "7,8")
        .containsEntry("name", "V*")
        .containsEntry("page", "1");
  }

  @Test
  void getJobCodes_invalid_parameters() {
    assertThat(dispatcher.call("get_jobcodes", ToolParams.of(ImmutableMap.of("type", "overtime")))
        .getError().getMessage()).startsWith("type must be one of");
    assertThat(dispatcher.call("get_jobcodes", ToolParams.of(ImmutableMap.of("limit", 500)))
        .getError().getCode()).isEqualTo("validation_error");
    assertThat(dispatcher.call("get_jobcodes", ToolParams.of(ImmutableMap.of("ids", "1,x")))
        .getError().getCode()).isEqualTo("validation_error");
    verifyNoInteractions(apiServiceMock);
  }

  @Test
  void getTimesheets_requires_a_filter() {
    final ToolResult result = dispatcher.call("get_timesheets", ToolParams.of(ImmutableMap.of("user_ids", "3")));

    assertThat(result.getError().getCode()).isEqualTo("missing_required_filter");
    verifyNoInteractions(apiServiceMock);
  }

  @Test
  void getTimesheets_with_period() {
    final ToolResult result = dispatcher.call("get_timesheets", ToolParams.of(ImmutableMap.of(
        "period", "last month", "jobcode_type", "vacation", "on_the_clock", "No")));

    assertThat(result.isSuccess()).isTrue();
    assertThat(requestFilters("timesheets"))
        .containsEntry("start_date", "2024-11-01")
        .containsEntry("end_date", "2024-11-30")
        .containsEntry("jobcode_type", "pto")
        .containsEntry("on_the_clock", "no");
  }

  @Test
  void getTimesheets_natural_language_dates() {
    dispatcher.call("get_timesheets", ToolParams.of(ImmutableMap.of(
        "start_date", "December 1, 2024", "modified_since", "2024-12-01")));

    assertThat(requestFilters("timesheets"))
        .containsEntry("start_date", "2024-12-01")
        .containsEntry("end_date", "2024-12-31")
        .containsEntry("modified_since", "2024-12-01T00:00:00Z");
  }

  @Test
  void getTimesheets_single_page() {
    final TimeEntry entry = RANDOM_DATA_GENERATOR.randomTimeEntry(1, 10, LocalDate.of(2024, 12, 2));
    when(apiServiceMock.getPage(eq("timesheets"), anyString(), any(), anyMap())).thenAnswer(invocation ->
        new ApiPage<Object>().setRecords(ImmutableList.of(entry)).setMore(true));

    final ToolResult result = dispatcher.call("get_timesheets", ToolParams.of(ImmutableMap.of(
        "start_date", "2024-12-01", "end_date", "2024-12-07", "page", 2, "limit", 10)));

    final JsonObject json = result.getResult().getAsJsonObject();
    assertThat(json.get("page").getAsInt()).isEqualTo(2);
    assertThat(json.get("more").getAsBoolean()).isTrue();
    assertThat(json.get("count").getAsInt()).isEqualTo(1);
    assertThat(requestFilters("timesheets")).containsEntry("page", "2").containsEntry("limit", "10");
  }

  @Test
  void getJobCode_not_found() {
    final ToolResult result = dispatcher.call("get_jobcode", ToolParams.of(ImmutableMap.of("id", 42)));

    assertThat(result.getError().getCode()).isEqualTo("validation_error");
    assertThat(result.getError().getMessage()).isEqualTo("No jobcode with id 42 was found.");
  }

  @Test
  void getTimesheets_page_without_limit_uses_default_page_size() {
    dispatcher.call("get_timesheets", ToolParams.of(ImmutableMap.of(
        "start_date", "2024-12-01", "end_date", "2024-12-07", "page", 3)));

    assertThat(requestFilters("timesheets")).containsEntry("page", "3").containsEntry("limit", "50");
  }

  @Test
  void getTimesheet_by_id() {
    served.put("timesheets", ImmutableList.of(
        RANDOM_DATA_GENERATOR.timeEntry(1, 10, LocalDate.of(2024, 12, 2), Duration.ofHours(3))));

    final ToolResult result = dispatcher.call("get_timesheet", ToolParams.of(ImmutableMap.of("id", 99)));

    assertThat(result.getResult().getAsJsonObject().get("duration").getAsLong()).isEqualTo(10_800);
    assertThat(requestFilters("timesheets")).containsEntry("ids", "99");
  }

  @Test
  void getTimesheet_not_found() {
    final ToolResult result = dispatcher.call("get_timesheet", ToolParams.of(ImmutableMap.of("id", 5)));

    assertThat(result.getError().getCode()).isEqualTo("validation_error");
    assertThat(result.getError().getMessage()).isEqualTo("No timesheet with id 5 was found.");
    assertThat(dispatcher.call("get_timesheet", ToolParams.of(ImmutableMap.of("id", -1)))
        .getError().getMessage()).isEqualTo("id must be a positive number");
  }

  @Test
  void getUser_includes_inactive_users() {
    served.put("users", ImmutableList.of(RANDOM_DATA_GENERATOR.employee(12, 0, "30")));

    final ToolResult result = dispatcher.call("get_user", ToolParams.of(ImmutableMap.of("id", 12)));

    assertThat(result.getResult().getAsJsonObject().get("id").getAsLong()).isEqualTo(12);
    assertThat(requestFilters("users")).containsEntry("ids", "12").containsEntry("active", "both");
  }

  @Test
  void searchJobCodes_requires_name() {
    assertThat(dispatcher.call("search_jobcodes", ToolParams.empty()).getError().getCode())
        .isEqualTo("validation_error");
    verifyNoInteractions(apiServiceMock);

    dispatcher.call("search_jobcodes", ToolParams.of(ImmutableMap.of("name", "Acme*", "type", "vacation")));

    assertThat(requestFilters("jobcodes")).containsEntry("name", "Acme*").containsEntry("type", "pto");
  }

  @Test
  void getCurrentTimesheets() {
    served.put("current_timesheets", ImmutableList.of(
        RANDOM_DATA_GENERATOR.timeEntry(1, 10, LocalDate.of(2024, 12, 31), Duration.ofHours(1))));

    final ToolResult result = dispatcher.call("get_current_timesheets",
        ToolParams.of(ImmutableMap.of("group_ids", "4,5")));

    assertThat(result.getResult().getAsJsonObject().get("count").getAsInt()).isEqualTo(1);
    assertThat(requestFilters("current_timesheets")).containsEntry("group_ids", "4,5");
  }

  @Test
  void getCurrentTotals_checks_customfield_query() {
    assertThat(dispatcher.call("get_current_totals", ToolParams.of(ImmutableMap.of("customfield_query", "19142")))
        .getError().getMessage()).startsWith("customfield_query must look like");
    verifyNoInteractions(apiServiceMock);

    dispatcher.call("get_current_totals", ToolParams.of(ImmutableMap.of(
        "user_ids", "3", "customfield_query", "19142|in|Site A")));

    assertThat(requestFilters("current_totals"))
        .containsEntry("user_ids", "3")
        .containsEntry("customfield_query", "19142|in|Site A");
  }

  @Test
  void getCustomFields() {
    served.put("customfields", ImmutableList.of(
        new CustomField().setId(19142).setName("Site").setAppliesTo("timesheet").setType("managed-list")));

    final ToolResult result = dispatcher.call("get_custom_fields",
        ToolParams.of(ImmutableMap.of("applies_to", "timesheet", "active", "yes")));

    final JsonObject json = result.getResult().getAsJsonObject();
    assertThat(json.get("count").getAsInt()).isEqualTo(1);
    assertThat(requestFilters("customfields"))
        .containsEntry("applies_to", "timesheet")
        .containsEntry("active", "yes");
    assertThat(dispatcher.call("get_custom_fields", ToolParams.of(ImmutableMap.of("applies_to", "invoice")))
        .getError().getCode()).isEqualTo("validation_error");
  }

  @Test
  void getLastModified() {
    final JsonObject timestamps = new JsonObject();
    timestamps.addProperty("timesheets", "2024-12-30T10:00:00+00:00");
    when(apiServiceMock.getResult(eq("last_modified_timestamps"), eq("last_modified_timestamps"), anyMap()))
        .thenReturn(timestamps);

    final ToolResult result = dispatcher.call("get_last_modified",
        ToolParams.of(ImmutableMap.of("types", "Timesheets, users")));

    assertThat(result.getResult().getAsJsonObject().get("timesheets").getAsString())
        .isEqualTo("2024-12-30T10:00:00+00:00");
    verify(apiServiceMock).getResult("last_modified_timestamps", "last_modified_timestamps",
        ImmutableMap.of("types", "timesheets,users"));
  }

  @Test
  void getLastModified_unknown_type() {
    final ToolResult result = dispatcher.call("get_last_modified",
        ToolParams.of(ImmutableMap.of("types", "timesheets,invoices")));

    assertThat(result.getError().getCode()).isEqualTo("validation_error");
    assertThat(result.getError().getMessage()).startsWith("Unknown type invoices.");
    verifyNoInteractions(apiServiceMock);
  }

  @Test
  void getProjectReport_posts_report_parameters() {
    final JsonObject report = new JsonObject();
    report.add("totals", new JsonObject());
    when(apiServiceMock.postReport(eq("reports/project"), eq("project_report"), any())).thenReturn(report);

    final ToolResult result = dispatcher.call("get_project_report", ToolParams.parse(
        "{\"period\": \"last month\", \"jobcode_ids\": [7, 8], \"jobcode_type\": \"vacation\","
            + " \"customfielditems\": {\"19142\": [\"Site A\", \"Site B\"]}}"));

    assertThat(result.isSuccess()).isTrue();
    final ArgumentCaptor<JsonObject> parameters = ArgumentCaptor.forClass(JsonObject.class);
    verify(apiServiceMock).postReport(eq("reports/project"), eq("project_report"), parameters.capture());
    final JsonObject sent = parameters.getValue();
    assertThat(sent.get("start_date").getAsString()).isEqualTo("2024-11-01");
    assertThat(sent.get("end_date").getAsString()).isEqualTo("2024-11-30");
    assertThat(sent.getAsJsonArray("jobcode_ids")).hasSize(2);
    assertThat(sent.get("jobcode_type").getAsString()).isEqualTo("pto");
    assertThat(sent.getAsJsonObject("customfielditems").getAsJsonArray("19142").get(1).getAsString())
        .isEqualTo("Site B");
    assertThat(sent.has("user_ids")).isFalse();
  }

  @Test
  void getProjectReport_requires_jobcodes() {
    final ToolResult result = dispatcher.call("get_project_report",
        ToolParams.of(ImmutableMap.of("period", "last month")));

    assertThat(result.getError().getCode()).isEqualTo("missing_required_filter");
    verifyNoInteractions(apiServiceMock);
  }

  @Test
  void getJobCodeHierarchy() {
    served.put("jobcodes", ImmutableList.of(
        RANDOM_DATA_GENERATOR.jobCode(1, 0, "Acme Corp", JobCodeType.REGULAR),
        RANDOM_DATA_GENERATOR.jobCode(2, 1, "Website", JobCodeType.REGULAR),
        RANDOM_DATA_GENERATOR.jobCode(3, 0, "Annual leave", JobCodeType.PTO)));

    final ToolResult result = dispatcher.call("get_jobcode_hierarchy", ToolParams.empty());

    final JsonArray roots = result.getResult().getAsJsonArray();
    assertThat(roots).hasSize(2);
    final JsonObject acme = roots.get(0).getAsJsonObject();
    assertThat(acme.get("name").getAsString()).isEqualTo("Acme Corp");
    assertThat(acme.getAsJsonArray("children").get(0).getAsJsonObject().get("name").getAsString())
        .isEqualTo("Website");
    assertThat(roots.get(1).getAsJsonObject().get("type").getAsString()).isEqualTo("pto");
    assertThat(requestFilters("jobcodes")).containsEntry("active", "yes").containsEntry("type", "all");
  }

  @Test
  void getCurrentUser() {
    when(apiServiceMock.getCurrentUser()).thenReturn(new Employee().setId(7).setFirstName("Jo").setLastName("Park"));

    final ToolResult result = dispatcher.call("get_current_user", ToolParams.empty());

    assertThat(result.getResult().getAsJsonObject().get("id").getAsLong()).isEqualTo(7);
    assertThat(result.getResult().getAsJsonObject().get("first_name").getAsString()).isEqualTo("Jo");
  }

  @Test
  void call_maps_connector_errors() {
    when(apiServiceMock.getCurrentUser()).thenThrow(
        new AuthException("Your QuickBooks Time connection has expired. Please reconnect your account."));

    final ToolResult result = dispatcher.call("get_current_user", ToolParams.empty());

    assertThat(result.getError().getCode()).isEqualTo("auth_error");
    assertThat(result.getError().getMessage()).contains("reconnect");
  }

  @Test
  void call_hides_unexpected_errors() {
    when(apiServiceMock.getCurrentUser()).thenThrow(new IllegalStateException("connection pool shut down"));

    final ToolResult result = dispatcher.call("get_current_user", ToolParams.empty());

    assertThat(result.getError().getCode()).isEqualTo("server_error");
    assertThat(result.getError().getMessage()).doesNotContain("pool");
  }

  @Test
  void getPayroll() {
    served.put("users", ImmutableList.of(RANDOM_DATA_GENERATOR.employee(1, 0, "20")));
    served.put("jobcodes", ImmutableList.of(RANDOM_DATA_GENERATOR.jobCode(10, 0, "Acme Corp", JobCodeType.REGULAR)));
    served.put("timesheets", ImmutableList.of(
        RANDOM_DATA_GENERATOR.timeEntry(1, 10, LocalDate.of(2024, 11, 4), Duration.ofHours(2))));

    final ToolResult result = dispatcher.call("get_payroll", ToolParams.of(ImmutableMap.of("period", "last month")));

    final JsonObject json = result.getResult().getAsJsonObject();
    assertThat(json.getAsJsonObject("totals").get("total_seconds").getAsLong()).isEqualTo(7200);
    assertThat(json.getAsJsonObject("totals").get("total_cost").getAsBigDecimal()).isEqualByComparingTo("40");
    assertThat(json.getAsJsonObject("by_user").has("1")).isTrue();
  }

  @Test
  void getPayroll_requires_period() {
    final ToolResult result = dispatcher.call("get_payroll_by_jobcode", ToolParams.empty());

    assertThat(result.getError().getCode()).isEqualTo("missing_required_filter");
    verifyNoInteractions(apiServiceMock);
  }

  @Test
  void workflow_tools_delegate_to_orchestrator() {
    final ToolParams params = ToolParams.of(ImmutableMap.of("client_name", "Acme Corp"));
    final DateRange period = DateRange.of(LocalDate.of(2024, 11, 1), LocalDate.of(2024, 11, 30));
    when(orchestratorMock.execute("client_invoice", params)).thenReturn(new WorkflowResult("client_invoice",
        WorkflowState.DONE, period, ImmutableMap.of("invoice_summary", "ok"), ImmutableList.of()));

    final ToolResult result = dispatcher.call("prepare_client_invoice", params);

    verify(orchestratorMock).execute("client_invoice", params);
    final JsonObject json = result.getResult().getAsJsonObject();
    assertThat(json.get("state").getAsString()).isEqualTo("done");
    assertThat(json.getAsJsonObject("date_range").get("start_date").getAsString()).isEqualTo("2024-11-01");
    assertThat(json.getAsJsonArray("errors")).isEmpty();
  }

  @Test
  void resolveDateRange() {
    final ToolResult result = dispatcher.call("resolve_date_range",
        ToolParams.of(ImmutableMap.of("expression", "last month", "anchor_date", "2024-03-15")));

    assertThat(result.getResult().getAsJsonObject().get("start_date").getAsString()).isEqualTo("2024-02-01");
    assertThat(result.getResult().getAsJsonObject().get("end_date").getAsString()).isEqualTo("2024-02-29");

    assertThat(dispatcher.call("resolve_date_range", ToolParams.of(ImmutableMap.of("expression", "someday")))
        .getError().getCode()).isEqualTo("unparseable_date");
    assertThat(dispatcher.call("resolve_date_range",
        ToolParams.of(ImmutableMap.of("expression", "today", "anchor_date", "15/03/2024")))
        .getError().getCode()).isEqualTo("validation_error");
  }

  @Test
  void translateTerms() {
    final JsonObject toService = dispatcher.call("translate_terms", ToolParams.of(ImmutableMap.of(
        "terms", "employee, vacation, invoice", "text", "Vacation by department"))).getResult().getAsJsonObject();

    assertThat(toService.getAsJsonObject("terms").get("employee").getAsString()).isEqualTo("user");
    assertThat(toService.getAsJsonObject("terms").get("vacation").getAsString()).isEqualTo("pto");
    assertThat(toService.getAsJsonObject("terms").get("invoice").getAsString()).isEqualTo("invoice");
    assertThat(toService.get("text").getAsString()).isEqualTo("pto by group");

    final JsonObject toAccounting = dispatcher.call("translate_terms", ToolParams.of(ImmutableMap.of(
        "terms", "user,group", "direction", "to_accounting"))).getResult().getAsJsonObject();
    assertThat(toAccounting.getAsJsonObject("terms").get("group").getAsString()).isEqualTo("department");

    assertThat(dispatcher.call("translate_terms", ToolParams.empty()).getError().getCode())
        .isEqualTo("validation_error");
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private Map<String, String> requestFilters(String endpoint) {
    final ArgumentCaptor<Map<String, String>> filters = ArgumentCaptor.forClass((Class) Map.class);
    verify(apiServiceMock).getPage(eq(endpoint), anyString(), any(), filters.capture());
    return filters.getValue();
  }
}
