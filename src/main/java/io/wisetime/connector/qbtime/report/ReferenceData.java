/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.report;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.wisetime.connector.qbtime.date.DateRange;
import io.wisetime.connector.qbtime.model.Employee;
import io.wisetime.connector.qbtime.model.Group;
import io.wisetime.connector.qbtime.model.JobCode;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Employees, groups and jobcodes a report is computed against. Read-only for the duration of a report.
 */
public class ReferenceData {

  private final ImmutableMap<Long, Employee> employees;
  private final ImmutableMap<Long, Group> groups;
  private final JobCodeTree jobCodes;
  private final DateRange reportingPeriod;

  public ReferenceData(Collection<Employee> employees, Collection<Group> groups, JobCodeTree jobCodes) {
    this(employees.stream()
            .collect(ImmutableMap.toImmutableMap(Employee::getId, Function.identity(), (first, second) -> second)),
        groups.stream()
            .collect(ImmutableMap.toImmutableMap(Group::getId, Function.identity(), (first, second) -> second)),
        jobCodes, null);
  }

  private ReferenceData(ImmutableMap<Long, Employee> employees, ImmutableMap<Long, Group> groups,
                        JobCodeTree jobCodes, DateRange reportingPeriod) {
    this.employees = employees;
    this.groups = groups;
    this.jobCodes = jobCodes;
    this.reportingPeriod = reportingPeriod;
  }

  public static ReferenceData of(Collection<Employee> employees, Collection<Group> groups,
                                 Collection<JobCode> jobCodes) {
    return new ReferenceData(employees, groups, new JobCodeTree(jobCodes));
  }

  public static ReferenceData empty() {
    return new ReferenceData(ImmutableList.of(), ImmutableList.of(), JobCodeTree.empty());
  }

  /**
   * Copy of this reference data that reports only entries dated within {@code period}. Entries outside it still
   * count towards the weekly overtime threshold, so callers can pass the whole ISO week around the period edges.
   */
  public ReferenceData withReportingPeriod(DateRange period) {
    return new ReferenceData(employees, groups, jobCodes, period);
  }

  public Optional<DateRange> getReportingPeriod() {
    return Optional.ofNullable(reportingPeriod);
  }

  /**
   * Whether an entry on {@code date} belongs in reports; always true without a reporting period.
   */
  public boolean isReported(LocalDate date) {
    return reportingPeriod == null || reportingPeriod.contains(date);
  }

  public Optional<Employee> employee(long id) {
    return Optional.ofNullable(employees.get(id));
  }

  public Optional<Group> group(long id) {
    return Optional.ofNullable(groups.get(id));
  }

  public Optional<BigDecimal> rateOf(long employeeId) {
    return employee(employeeId).flatMap(Employee::getRate);
  }

  /**
   * Group of the employee; 0 when the employee is unknown or in no group.
   */
  public long groupOf(long employeeId) {
    return employee(employeeId).map(Employee::getGroupId).orElse(0L);
  }

  public JobCodeTree getJobCodes() {
    return jobCodes;
  }

  public Collection<Employee> getEmployees() {
    return employees.values();
  }

  public Collection<Group> getGroups() {
    return groups.values();
  }

  /**
   * Every key the given dimension can take according to this reference data.
   */
  public Set<Long> keysOf(Dimension dimension) {
    switch (dimension) {
      case EMPLOYEE:
        return employees.keySet();
      case GROUP:
        return groups.keySet();
      case JOBCODE:
        return jobCodes.ids();
      case CLIENT:
        return jobCodes.all().stream()
            .filter(JobCode::isTopLevel)
            .map(JobCode::getId)
            .collect(ImmutableSet.toImmutableSet());
      default:
        throw new IllegalArgumentException("Unsupported dimension " + dimension);
    }
  }

  /**
   * Display name of a dimension key, when known.
   */
  public Optional<String> nameOf(Dimension dimension, long key) {
    switch (dimension) {
      case EMPLOYEE:
        return employee(key).map(Employee::getDisplayName);
      case GROUP:
        return group(key).map(Group::getName);
      case JOBCODE:
      case CLIENT:
        return jobCodes.get(key).map(JobCode::getName);
      default:
        return Optional.empty();
    }
  }
}
