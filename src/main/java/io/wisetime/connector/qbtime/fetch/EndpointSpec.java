/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.fetch;

import com.google.common.collect.ImmutableSet;
import io.wisetime.connector.qbtime.model.CurrentTotals;
import io.wisetime.connector.qbtime.model.CustomField;
import io.wisetime.connector.qbtime.model.Employee;
import io.wisetime.connector.qbtime.model.Group;
import io.wisetime.connector.qbtime.model.JobCode;
import io.wisetime.connector.qbtime.model.TimeEntry;
import lombok.Value;

/**
 * A paginated QuickBooks Time list endpoint.
 *
 * <p>{@code requiredAnyOf} lists filters of which at least one must be present; empty when the endpoint accepts
 * unfiltered requests.
 */
@Value
public class EndpointSpec<T> {

  public static final EndpointSpec<JobCode> JOBCODES =
      new EndpointSpec<>("jobcodes", "jobcodes", JobCode.class, ImmutableSet.of());

  public static final EndpointSpec<TimeEntry> TIMESHEETS =
      new EndpointSpec<>("timesheets", "timesheets", TimeEntry.class,
          ImmutableSet.of("ids", "start_date", "modified_before", "modified_since"));

  public static final EndpointSpec<TimeEntry> CURRENT_TIMESHEETS =
      new EndpointSpec<>("current_timesheets", "timesheets", TimeEntry.class, ImmutableSet.of());

  public static final EndpointSpec<CurrentTotals> CURRENT_TOTALS =
      new EndpointSpec<>("current_totals", "current_totals", CurrentTotals.class, ImmutableSet.of());

  public static final EndpointSpec<CustomField> CUSTOM_FIELDS =
      new EndpointSpec<>("customfields", "customfields", CustomField.class, ImmutableSet.of());

  public static final EndpointSpec<Employee> USERS =
      new EndpointSpec<>("users", "users", Employee.class, ImmutableSet.of());

  public static final EndpointSpec<Group> GROUPS =
      new EndpointSpec<>("groups", "groups", Group.class, ImmutableSet.of());

  String path;
  String resultsKey;
  Class<T> recordType;
  ImmutableSet<String> requiredAnyOf;
}
