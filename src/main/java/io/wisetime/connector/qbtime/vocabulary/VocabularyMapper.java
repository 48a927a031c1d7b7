/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.vocabulary;

import com.google.common.collect.ImmutableMap;
import java.util.Comparator;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Translates between the words accountants use and the QuickBooks Time vocabulary.
 *
 * <p>Several accounting terms map to the same service term. In particular projects and clients are both jobcodes,
 * so {@code toAccountingTerm("jobcode")} returns {@code "jobcode"}: callers that need to know which one was meant
 * must keep the original term next to the resolved id. Unknown terms are returned unchanged in both directions.
 */
public class VocabularyMapper {

  private static final Map<String, String> TO_SERVICE = ImmutableMap.<String, String>builder()
      .put("employee", "user")
      .put("staff", "user")
      .put("worker", "user")
      .put("department", "group")
      .put("team", "group")
      .put("project", "jobcode")
      .put("client", "jobcode")
      .put("task", "jobcode")
      .put("job", "jobcode")
      .put("vacation", "pto")
      .put("sick time", "pto")
      .put("sick leave", "pto")
      .put("paid time off", "pto")
      .put("holiday", "pto")
      .put("regular hours", "regular")
      .put("standard time", "regular")
      .put("break", "paid_break")
      .put("lunch", "unpaid_break")
      .put("time card", "timesheet")
      .put("punch card", "timesheet")
      .put("time entry", "timesheet")
      .put("punch", "timesheet")
      .put("clock in", "timesheet")
      .put("hours worked", "timesheet")
      .build();

  private static final Map<String, String> TO_ACCOUNTING = ImmutableMap.<String, String>builder()
      .put("user", "employee")
      .put("group", "department")
      .put("jobcode", "jobcode")
      .put("pto", "vacation")
      .put("regular", "regular hours")
      .put("paid_break", "break")
      .put("unpaid_break", "lunch")
      .put("timesheet", "time card")
      .build();

  // longest phrase first so that "sick time" wins over a shorter overlapping term
  private static final Pattern PHRASES = Pattern.compile(TO_SERVICE.keySet().stream()
      .sorted(Comparator.comparingInt(String::length).reversed())
      .map(Pattern::quote)
      .collect(Collectors.joining("|", "\\b(", ")\\b")), Pattern.CASE_INSENSITIVE);

  public String toServiceTerm(String term) {
    return lookup(TO_SERVICE, term);
  }

  public String toAccountingTerm(String serviceTerm) {
    return lookup(TO_ACCOUNTING, serviceTerm);
  }

  public boolean isAccountingTerm(String term) {
    return term != null && TO_SERVICE.containsKey(normalize(term));
  }

  /**
   * Replaces every known accounting phrase in {@code text} with its service term, e.g.
   * {@code "Vacation"} becomes {@code "pto"}.
   */
  public String translate(String text) {
    if (text == null) {
      return null;
    }
    final Matcher matcher = PHRASES.matcher(text);
    final StringBuilder translated = new StringBuilder();
    while (matcher.find()) {
      matcher.appendReplacement(translated, Matcher.quoteReplacement(TO_SERVICE.get(normalize(matcher.group(1)))));
    }
    matcher.appendTail(translated);
    return translated.toString();
  }

  private static String lookup(Map<String, String> table, String term) {
    if (term == null) {
      return null;
    }
    return table.getOrDefault(normalize(term), term);
  }

  private static String normalize(String term) {
    return term.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
  }
}
