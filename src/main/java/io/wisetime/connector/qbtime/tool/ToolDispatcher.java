/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.tool;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import io.wisetime.connector.qbtime.QbTimeApiService;
import io.wisetime.connector.qbtime.date.DateRange;
import io.wisetime.connector.qbtime.date.DateRangeResolver;
import io.wisetime.connector.qbtime.fetch.EndpointSpec;
import io.wisetime.connector.qbtime.fetch.RateLimitedFetcher;
import io.wisetime.connector.qbtime.model.ApiPage;
import io.wisetime.connector.qbtime.model.JobCode;
import io.wisetime.connector.qbtime.model.TimeEntry;
import io.wisetime.connector.qbtime.report.AccountingReports;
import io.wisetime.connector.qbtime.report.Dimension;
import io.wisetime.connector.qbtime.report.JobCodeTree;
import io.wisetime.connector.qbtime.report.ReferenceData;
import io.wisetime.connector.qbtime.report.ReportAggregator;
import io.wisetime.connector.qbtime.util.ConnectorException;
import io.wisetime.connector.qbtime.util.ErrorKind;
import io.wisetime.connector.qbtime.util.MissingRequiredFilterException;
import io.wisetime.connector.qbtime.util.ValidationException;
import io.wisetime.connector.qbtime.vocabulary.VocabularyMapper;
import io.wisetime.connector.qbtime.workflow.AccountingWorkflows;
import io.wisetime.connector.qbtime.workflow.WorkflowOrchestrator;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import javax.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for tool calls. Validates parameters, routes the call to the QuickBooks Time tools, the reporting
 * engine or a workflow, and turns every failure into an error code with a message the user can act on.
 */
public class ToolDispatcher {

  private static final Logger log = LoggerFactory.getLogger(ToolDispatcher.class);

  /**
   * Hints for unknown tool names, keyed by a fragment of the attempted name.
   */
  private static final Map<String, String> SUGGESTIONS = ImmutableMap.<String, String>builder()
      .put("payroll", "Did you mean \"get_payroll\" or \"prepare_biweekly_payroll\"?")
      .put("invoice", "Did you mean \"prepare_client_invoice\" or \"get_project_report\"?")
      .put("profit", "Did you mean \"analyze_project_profitability\"?")
      .put("hours", "Did you mean \"get_timesheets\" or \"get_current_totals\"?")
      .put("custom", "Did you mean \"get_custom_fields\"?")
      .put("modified", "Did you mean \"get_last_modified\"?")
      .put("employee", "Did you mean \"get_users\"?")
      .put("department", "Did you mean \"get_groups\"?")
      .put("client", "Did you mean \"get_jobcodes\" or \"get_jobcode_hierarchy\"?")
      .put("project", "Did you mean \"get_jobcodes\" or \"get_jobcode_hierarchy\"?")
      .put("pto", "Did you mean \"get_timesheets\" with jobcode_type \"pto\"?")
      .put("vacation", "Did you mean \"get_timesheets\" with jobcode_type \"pto\"?")
      .put("tax", "Did you mean \"quarterly_tax_prep\"?")
      .put("date", "Did you mean \"resolve_date_range\"?")
      .build();

  private static final Set<String> LAST_MODIFIED_TYPES = ImmutableSet.of(
      "users", "groups", "jobcodes", "timesheets", "custom_fields", "projects", "locations", "clients");

  @FunctionalInterface
  interface Tool {
    Object call(ToolParams params);
  }

  private final QbTimeApiService apiService;
  private final RateLimitedFetcher fetcher;
  private final ReportAggregator aggregator;
  private final AccountingReports reports;
  private final DateRangeResolver dateRangeResolver;
  private final VocabularyMapper vocabulary;
  private final WorkflowOrchestrator orchestrator;
  private final Map<String, Tool> tools;

  @Inject
  public ToolDispatcher(QbTimeApiService apiService, RateLimitedFetcher fetcher, ReportAggregator aggregator,
                        AccountingReports reports, DateRangeResolver dateRangeResolver, VocabularyMapper vocabulary,
                        WorkflowOrchestrator orchestrator) {
    this.apiService = apiService;
    this.fetcher = fetcher;
    this.aggregator = aggregator;
    this.reports = reports;
    this.dateRangeResolver = dateRangeResolver;
    this.vocabulary = vocabulary;
    this.orchestrator = orchestrator;
    this.tools = ImmutableMap.<String, Tool>builder()
        .put("get_jobcodes", this::getJobCodes)
        .put("get_jobcode", this::getJobCode)
        .put("search_jobcodes", this::searchJobCodes)
        .put("get_jobcode_hierarchy", this::getJobCodeHierarchy)
        .put("get_timesheets", this::getTimesheets)
        .put("get_timesheet", this::getTimesheet)
        .put("get_current_timesheets", this::getCurrentTimesheets)
        .put("get_current_totals", this::getCurrentTotals)
        .put("get_users", this::getUsers)
        .put("get_user", this::getUser)
        .put("get_groups", this::getGroups)
        .put("get_current_user", params -> apiService.getCurrentUser())
        .put("get_custom_fields", this::getCustomFields)
        .put("get_last_modified", this::getLastModified)
        .put("get_payroll", this::getPayroll)
        .put("get_payroll_by_jobcode", this::getPayrollByJobCode)
        .put("get_project_report", this::getProjectReport)
        .put("resolve_date_range", this::resolveDateRange)
        .put("translate_terms", this::translateTerms)
        .put("prepare_biweekly_payroll", workflow(AccountingWorkflows.BIWEEKLY_PAYROLL))
        .put("month_end_closing", workflow(AccountingWorkflows.MONTH_END_CLOSING))
        .put("quarterly_tax_prep", workflow(AccountingWorkflows.QUARTERLY_TAX_PREP))
        .put("prepare_client_invoice", workflow(AccountingWorkflows.CLIENT_INVOICE))
        .put("analyze_project_profitability", workflow(AccountingWorkflows.PROJECT_PROFITABILITY))
        .build();
  }

  public Set<String> toolNames() {
    return tools.keySet();
  }

  /**
   * Runs a tool. Never throws: failures are returned as a {@link ToolResult} error.
   */
  public ToolResult call(String name, ToolParams params) {
    final Tool tool = tools.get(name == null ? "" : name);
    if (tool == null) {
      return ToolResult.failure(ErrorKind.VALIDATION_ERROR, String.format("Unknown tool: %s. %s", name,
          suggest(name)));
    }
    try {
      log.debug("Calling {} with {}", name, params);
      return ToolResult.success(tool.call(params));
    } catch (ConnectorException e) {
      log.warn("Tool {} failed with {}: {}", name, e.getKind().getCode(), e.getMessage());
      return ToolResult.failure(e.getKind(), e.getMessage());
    } catch (RuntimeException e) {
      log.error("Unexpected error in tool {}", name, e);
      return ToolResult.failure(ErrorKind.SERVER_ERROR,
          "An unexpected error occurred while processing your request. Please try again later.");
    }
  }

  static String suggest(String attempted) {
    final String lower = attempted == null ? "" : attempted.toLowerCase(Locale.ROOT);
    return SUGGESTIONS.entrySet().stream()
        .filter(entry -> lower.contains(entry.getKey()))
        .map(Map.Entry::getValue)
        .findFirst()
        .orElse("Please check the list of available tools.");
  }

  private Object getJobCodes(ToolParams params) {
    final Map<String, String> filters = new LinkedHashMap<>();
    putIds(filters, params, "ids");
    putIds(filters, params, "parent_ids");
    params.getString("name").ifPresent(name -> filters.put("name", name));
    params.getActive().ifPresent(active -> filters.put("active", active));
    params.getJobCodeType(vocabulary::toServiceTerm).ifPresent(type -> filters.put("type", type));
    putModified(filters, params);
    return list(EndpointSpec.JOBCODES, filters, params);
  }

  private Object getJobCode(ToolParams params) {
    final long id = requireId(params);
    final List<JobCode> found = fetcher.fetchAll(EndpointSpec.JOBCODES,
        ImmutableMap.of("ids", Long.toString(id), "active", "both", "type", "all")).toList();
    return found.stream()
        .findFirst()
        .orElseThrow(() -> new ValidationException("No jobcode with id " + id + " was found."));
  }

  /**
   * Jobcodes whose name matches {@code name}, which may use {@code *} as a wildcard.
   */
  private Object searchJobCodes(ToolParams params) {
    final Map<String, String> filters = new LinkedHashMap<>();
    filters.put("name", params.requireString("name"));
    params.getActive().ifPresent(active -> filters.put("active", active));
    params.getJobCodeType(vocabulary::toServiceTerm).ifPresent(type -> filters.put("type", type));
    putModified(filters, params);
    return list(EndpointSpec.JOBCODES, filters, params);
  }

  private Object getJobCodeHierarchy(ToolParams params) {
    final JobCodeTree tree = new JobCodeTree(allJobCodes(params.getActive().orElse("yes")));
    final Optional<Long> rootId = params.getLong("id");
    if (rootId.isPresent()) {
      return tree.get(rootId.get())
          .map(root -> node(root, tree))
          .orElseThrow(() -> new ValidationException("No jobcode with id " + rootId.get() + " was found."));
    }
    return tree.childrenOf(JobCode.TOP_LEVEL).stream()
        .map(root -> node(root, tree))
        .collect(ImmutableList.toImmutableList());
  }

  private static JobCodeNode node(JobCode jobCode, JobCodeTree tree) {
    return new JobCodeNode(jobCode.getId(), jobCode.getName(),
        tree.effectiveType(jobCode.getId()).getServiceName(), jobCode.isBillable(), jobCode.isActive(),
        tree.childrenOf(jobCode.getId()).stream()
            .map(child -> node(child, tree))
            .collect(ImmutableList.toImmutableList()));
  }

  private Object getTimesheets(ToolParams params) {
    final Map<String, String> filters = new LinkedHashMap<>();
    putIds(filters, params, "ids");
    putIds(filters, params, "user_ids");
    putIds(filters, params, "jobcode_ids");
    putIds(filters, params, "group_ids");
    period(params).ifPresent(range -> {
      filters.put("start_date", range.getStart());
      filters.put("end_date", range.getEnd());
    });
    putModified(filters, params);
    params.getString("on_the_clock").ifPresent(value -> filters.put("on_the_clock", choice("on_the_clock", value)));
    params.getString("jobcode_type").ifPresent(type ->
        filters.put("jobcode_type", vocabulary.toServiceTerm(type).toLowerCase(Locale.ROOT)));
    return list(EndpointSpec.TIMESHEETS, filters, params);
  }

  private Object getTimesheet(ToolParams params) {
    final long id = requireId(params);
    return fetcher.fetchAll(EndpointSpec.TIMESHEETS, ImmutableMap.of("ids", Long.toString(id))).toList().stream()
        .findFirst()
        .orElseThrow(() -> new ValidationException("No timesheet with id " + id + " was found."));
  }

  /**
   * Timesheets of users who are on the clock now.
   */
  private Object getCurrentTimesheets(ToolParams params) {
    final Map<String, String> filters = new LinkedHashMap<>();
    putIds(filters, params, "user_ids");
    putIds(filters, params, "group_ids");
    putIds(filters, params, "jobcode_ids");
    return list(EndpointSpec.CURRENT_TIMESHEETS, filters, params);
  }

  private Object getCurrentTotals(ToolParams params) {
    final Map<String, String> filters = new LinkedHashMap<>();
    putIds(filters, params, "user_ids");
    putIds(filters, params, "group_ids");
    putIds(filters, params, "jobcode_ids");
    params.getString("customfield_query").ifPresent(query -> {
      if (Splitter.on('|').splitToList(query).size() != 3) {
        throw new ValidationException("customfield_query must look like <customfield_id>|<op>|<value>");
      }
      filters.put("customfield_query", query);
    });
    return list(EndpointSpec.CURRENT_TOTALS, filters, params);
  }

  private Object getUsers(ToolParams params) {
    final Map<String, String> filters = new LinkedHashMap<>();
    putIds(filters, params, "ids");
    putIds(filters, params, "group_ids");
    putIds(filters, params, "payroll_ids");
    params.getString("first_name").ifPresent(name -> filters.put("first_name", name));
    params.getString("last_name").ifPresent(name -> filters.put("last_name", name));
    params.getActive().ifPresent(active -> filters.put("active", active));
    putModified(filters, params);
    return list(EndpointSpec.USERS, filters, params);
  }

  private Object getUser(ToolParams params) {
    final long id = requireId(params);
    return fetcher.fetchAll(EndpointSpec.USERS, ImmutableMap.of("ids", Long.toString(id), "active", "both"))
        .toList().stream()
        .findFirst()
        .orElseThrow(() -> new ValidationException("No user with id " + id + " was found."));
  }

  private Object getGroups(ToolParams params) {
    final Map<String, String> filters = new LinkedHashMap<>();
    putIds(filters, params, "ids");
    params.getString("name").ifPresent(name -> filters.put("name", name));
    params.getActive().ifPresent(active -> filters.put("active", active));
    putModified(filters, params);
    return list(EndpointSpec.GROUPS, filters, params);
  }

  /**
   * Custom tracking fields. Their ids are what {@code DOUBLE_TIME_CUSTOMFIELD_ID} refers to.
   */
  private Object getCustomFields(ToolParams params) {
    final Map<String, String> filters = new LinkedHashMap<>();
    putIds(filters, params, "ids");
    params.getActive().ifPresent(active -> filters.put("active", active));
    params.getChoice("applies_to", ImmutableSet.of("timesheet", "user", "jobcode"))
        .ifPresent(appliesTo -> filters.put("applies_to", appliesTo));
    params.getChoice("value_type", ImmutableSet.of("managed-list", "free-form"))
        .ifPresent(valueType -> filters.put("value_type", valueType));
    return list(EndpointSpec.CUSTOM_FIELDS, filters, params);
  }

  /**
   * Latest modification timestamp per object type, for all types unless {@code types} names some.
   */
  private Object getLastModified(ToolParams params) {
    final List<String> types = params.getNames("types");
    final List<String> unknown = types.stream()
        .filter(type -> !LAST_MODIFIED_TYPES.contains(type))
        .collect(ImmutableList.toImmutableList());
    if (!unknown.isEmpty()) {
      throw new ValidationException(String.format("Unknown type %s. Valid types are: %s",
          String.join(", ", unknown), String.join(", ", LAST_MODIFIED_TYPES)));
    }
    final Map<String, String> filters = types.isEmpty()
        ? ImmutableMap.of()
        : ImmutableMap.of("types", String.join(",", types));
    return fetcher.fetchResult("last_modified_timestamps", "last_modified_timestamps", filters);
  }

  private Object getPayroll(ToolParams params) {
    final DateRange range = requirePeriod(params);
    final ReferenceData reference = referenceData().withReportingPeriod(range);
    return aggregator.payrollReport(timesheets(range.fromStartOfWeek()), reference,
        params.getBoolean("include_zero_time", false));
  }

  private Object getPayrollByJobCode(ToolParams params) {
    final DateRange range = requirePeriod(params);
    final ReferenceData reference = referenceData().withReportingPeriod(range);
    return reports.totals(timesheets(range.fromStartOfWeek()), Dimension.JOBCODE, reference);
  }

  /**
   * Time totals for jobcodes over a period, as computed by QuickBooks Time's project report.
   */
  private Object getProjectReport(ToolParams params) {
    final DateRange range = requirePeriod(params);
    final List<Long> jobCodeIds = params.getIds("jobcode_ids");
    if (jobCodeIds.isEmpty()) {
      throw new MissingRequiredFilterException("Please provide the jobcode_ids to report on.");
    }
    final JsonObject report = new JsonObject();
    report.addProperty("start_date", range.getStart());
    report.addProperty("end_date", range.getEnd());
    report.add("jobcode_ids", idArray(jobCodeIds));
    final List<Long> userIds = params.getIds("user_ids");
    if (!userIds.isEmpty()) {
      report.add("user_ids", idArray(userIds));
    }
    final List<Long> groupIds = params.getIds("group_ids");
    if (!groupIds.isEmpty()) {
      report.add("group_ids", idArray(groupIds));
    }
    params.getJobCodeType("jobcode_type", vocabulary::toServiceTerm)
        .ifPresent(type -> report.addProperty("jobcode_type", type));
    final Map<String, List<String>> customFieldItems = params.getValueLists("customfielditems");
    if (!customFieldItems.isEmpty()) {
      final JsonObject items = new JsonObject();
      customFieldItems.forEach((fieldId, values) -> {
        final JsonArray array = new JsonArray();
        values.forEach(array::add);
        items.add(fieldId, array);
      });
      report.add("customfielditems", items);
    }
    return fetcher.fetchReport("reports/project", "project_report", report);
  }

  private Object resolveDateRange(ToolParams params) {
    final String expression = params.requireString("expression");
    final LocalDate anchor = params.getString("anchor_date")
        .map(value -> {
          try {
            return LocalDate.parse(value);
          } catch (DateTimeParseException e) {
            throw new ValidationException("anchor_date must be a date such as 2024-12-31", e);
          }
        })
        .orElseGet(dateRangeResolver::today);
    return dateRangeResolver.resolve(expression, anchor);
  }

  private Object translateTerms(ToolParams params) {
    final boolean toAccounting = "to_accounting".equals(params.getString("direction").orElse("to_service"));
    final Map<String, Object> result = new LinkedHashMap<>();
    params.getString("text").ifPresent(text -> result.put("text", toAccounting ? text : vocabulary.translate(text)));
    final String terms = params.getString("terms").orElse(null);
    if (terms != null) {
      final Map<String, String> translated = new LinkedHashMap<>();
      for (String term : terms.split(",")) {
        final String trimmed = term.trim();
        if (!trimmed.isEmpty()) {
          translated.put(trimmed,
              toAccounting ? vocabulary.toAccountingTerm(trimmed) : vocabulary.toServiceTerm(trimmed));
        }
      }
      result.put("terms", translated);
    }
    if (result.isEmpty()) {
      throw new ValidationException("Please provide terms (comma separated) or text to translate.");
    }
    return result;
  }

  private Tool workflow(String name) {
    return params -> orchestrator.execute(name, params);
  }

  private <T> RecordList<T> list(EndpointSpec<T> endpoint, Map<String, String> filters, ToolParams params) {
    final Optional<Integer> limit = params.getLimit();
    if (params.has("page")) {
      final ApiPage<T> page = fetcher.fetchPage(endpoint, filters, params.getPage(),
          limit.orElseGet(RateLimitedFetcher::defaultPageSize));
      return RecordList.page(page.getRecords(), params.getPage(), page.isMore());
    }
    final List<T> records = limit.isPresent()
        ? fetcher.fetchAll(endpoint, filters, limit.get()).toList()
        : fetcher.fetchAll(endpoint, filters).toList();
    return RecordList.all(records);
  }

  private List<TimeEntry> timesheets(DateRange range) {
    return fetcher.fetchAll(EndpointSpec.TIMESHEETS,
        ImmutableMap.of("start_date", range.getStart(), "end_date", range.getEnd())).toList();
  }

  private ReferenceData referenceData() {
    return ReferenceData.of(
        fetcher.fetchAll(EndpointSpec.USERS, ImmutableMap.of("active", "both")).toList(),
        fetcher.fetchAll(EndpointSpec.GROUPS, ImmutableMap.of("active", "both")).toList(),
        allJobCodes("both"));
  }

  private List<JobCode> allJobCodes(String active) {
    return fetcher.fetchAll(EndpointSpec.JOBCODES, ImmutableMap.of("active", active, "type", "all")).toList();
  }

  /**
   * The period named by {@code period}, or by {@code start_date} and {@code end_date} (default today). Both accept
   * natural language.
   */
  private Optional<DateRange> period(ToolParams params) {
    final LocalDate today = dateRangeResolver.today();
    final Optional<String> period = params.getString("period");
    if (period.isPresent()) {
      return Optional.of(dateRangeResolver.resolve(period.get(), today));
    }
    final Optional<String> start = params.getString("start_date");
    final Optional<String> end = params.getString("end_date");
    if (start.isEmpty()) {
      if (end.isPresent()) {
        throw new ValidationException("start_date is required when end_date is given");
      }
      return Optional.empty();
    }
    return Optional.of(DateRange.of(dateRangeResolver.toDate(start.get(), today),
        end.map(value -> dateRangeResolver.resolveEnd(value, today)).orElse(today)));
  }

  private DateRange requirePeriod(ToolParams params) {
    return period(params).orElseThrow(() -> new MissingRequiredFilterException(
        "Please provide start_date and end_date, or a period such as \"last month\"."));
  }

  private static long requireId(ToolParams params) {
    final long id = params.getLong("id").orElseThrow(() -> new ValidationException("id is required"));
    if (id <= 0) {
      throw new ValidationException("id must be a positive number");
    }
    return id;
  }

  private static JsonArray idArray(List<Long> ids) {
    final JsonArray array = new JsonArray();
    ids.forEach(array::add);
    return array;
  }

  private static void putIds(Map<String, String> filters, ToolParams params, String name) {
    final List<Long> ids = params.getIds(name);
    if (!ids.isEmpty()) {
      filters.put(name, Joiner.on(',').join(ids));
    }
  }

  private static void putModified(Map<String, String> filters, ToolParams params) {
    params.getTimestamp("modified_before").ifPresent(value -> filters.put("modified_before", value));
    params.getTimestamp("modified_since").ifPresent(value -> filters.put("modified_since", value));
  }

  private static String choice(String name, String value) {
    final String lower = value.toLowerCase(Locale.ROOT);
    if (!"yes".equals(lower) && !"no".equals(lower) && !"both".equals(lower)) {
      throw new ValidationException(name + " must be one of yes, no, both");
    }
    return lower;
  }
}
