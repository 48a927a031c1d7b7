/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.date;

import static io.wisetime.connector.qbtime.ConnectorLauncher.QbTimeConfigKey.FISCAL_YEAR_START_MONTH;
import static io.wisetime.connector.qbtime.ConnectorLauncher.QbTimeConfigKey.TIMEZONE;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.wisetime.connector.qbtime.config.ConnectorConfig;
import io.wisetime.connector.qbtime.util.AmbiguousDateException;
import io.wisetime.connector.qbtime.util.UnparseableDateException;
import io.wisetime.connector.qbtime.util.ValidationException;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves date expressions such as "last month", "12/31/2024" or "December 1, 2024 to December 15, 2024" into
 * a {@link DateRange}. Relative expressions are resolved against an explicit anchor date.
 */
public class DateRangeResolver {

  private static final Logger log = LoggerFactory.getLogger(DateRangeResolver.class);

  /**
   * Standard QuickBooks Time pay period: 14 days, both ends inclusive.
   */
  public static final int BIWEEKLY_PERIOD_DAYS = 14;

  private static final List<DateTimeFormatter> LITERAL_FORMATS = ImmutableList.of(
      literal("uuuu-MM-dd"),       // 2024-12-31
      literal("M/d/uuuu"),         // 12/31/2024
      literal("M-d-uuuu"),         // 12-31-2024
      literal("MMMM d, uuuu"),     // December 31, 2024
      literal("MMM d, uuuu"),      // Dec 31, 2024
      literal("d MMMM uuuu"),      // 31 December 2024
      literal("d MMM uuuu")        // 31 Dec 2024
  );

  private static final Pattern RANGE = Pattern.compile("^(.+?)\\s+(?:to|through|until|-)\\s+(.+)$");

  private static final Map<String, Function<LocalDate, DateRange>> RELATIVE =
      ImmutableMap.<String, Function<LocalDate, DateRange>>builder()
          .put("today", DateRange::singleDay)
          .put("yesterday", anchor -> DateRange.singleDay(anchor.minusDays(1)))
          .put("this week", DateRangeResolver::weekOf)
          .put("last week", anchor -> weekOf(anchor.minusWeeks(1)))
          .put("this month", anchor -> month(YearMonth.from(anchor)))
          .put("last month", anchor -> month(YearMonth.from(anchor).minusMonths(1)))
          .put("this quarter", anchor -> quarterOf(anchor))
          .put("last quarter", anchor -> quarterOf(anchor.minusMonths(3)))
          .put("this year", anchor ->
              DateRange.of(anchor.withDayOfYear(1), anchor.with(TemporalAdjusters.lastDayOfYear())))
          .put("last year", anchor -> {
            final LocalDate lastYear = anchor.minusYears(1);
            return DateRange.of(lastYear.withDayOfYear(1), lastYear.with(TemporalAdjusters.lastDayOfYear()));
          })
          .put("year to date", anchor -> DateRange.of(anchor.withDayOfYear(1), anchor))
          .put("ytd", anchor -> DateRange.of(anchor.withDayOfYear(1), anchor))
          .build();

  private static final List<String> FISCAL = ImmutableList.of("this fiscal year", "last fiscal year",
      "fiscal year to date");

  private final Clock clock;

  @Inject
  public DateRangeResolver(Clock clock) {
    this.clock = clock;
  }

  /**
   * Resolves {@code expression} against today's date in the configured time zone.
   */
  public DateRange resolve(String expression) {
    return resolve(expression, today());
  }

  /**
   * @param anchor the date relative expressions are resolved against; may be null when only literals are expected
   * @throws UnparseableDateException if the expression is not understood
   * @throws AmbiguousDateException if the expression is understood but needs information that is not available
   */
  public DateRange resolve(String expression, LocalDate anchor) {
    if (StringUtils.isBlank(expression)) {
      throw new UnparseableDateException("Please provide a date, e.g. 12/31/2024 or \"last month\".");
    }
    final String normalized = StringUtils.normalizeSpace(expression).toLowerCase(Locale.ROOT);

    final Optional<DateRange> single = resolveSingle(normalized, anchor);
    if (single.isPresent()) {
      return single.get();
    }

    final Matcher range = RANGE.matcher(normalized);
    if (range.matches()) {
      final Optional<DateRange> from = resolveSingle(range.group(1), anchor);
      final Optional<DateRange> to = resolveSingle(range.group(2), anchor);
      if (from.isPresent() && to.isPresent()) {
        return DateRange.of(from.get().getStartDate(), to.get().getEndDate());
      }
    }

    throw new UnparseableDateException(String.format(
        "Could not understand the date \"%s\". Please use a date like 12/31/2024 or \"December 31, 2024\", "
            + "or an expression like \"last month\".", expression.trim()));
  }

  /**
   * The first day of the resolved range, for parameters that take a single date.
   */
  public LocalDate toDate(String expression, LocalDate anchor) {
    return resolve(expression, anchor).getStartDate();
  }

  /**
   * The last day of the resolved range, for parameters that take a single date.
   */
  public LocalDate resolveEnd(String expression, LocalDate anchor) {
    return resolve(expression, anchor).getEndDate();
  }

  public LocalDate today() {
    return LocalDate.now(clock.withZone(zone()));
  }

  public static DateRange payPeriodEndingOn(LocalDate endDate) {
    return DateRange.of(endDate.minusDays(BIWEEKLY_PERIOD_DAYS - 1), endDate);
  }

  public static DateRange month(YearMonth month) {
    return DateRange.of(month.atDay(1), month.atEndOfMonth());
  }

  /**
   * @param quarter 1 (Jan to Mar) to 4 (Oct to Dec)
   */
  public static DateRange quarter(int quarter, int year) {
    if (quarter < 1 || quarter > 4) {
      throw new ValidationException("quarter must be between 1 and 4");
    }
    final YearMonth first = YearMonth.of(year, (quarter - 1) * 3 + 1);
    return DateRange.of(first.atDay(1), first.plusMonths(2).atEndOfMonth());
  }

  private Optional<DateRange> resolveSingle(String normalized, LocalDate anchor) {
    final Function<LocalDate, DateRange> relative = RELATIVE.get(normalized);
    if (relative != null) {
      return Optional.of(relative.apply(requireAnchor(normalized, anchor)));
    }
    if (FISCAL.contains(normalized)) {
      return Optional.of(fiscal(normalized, requireAnchor(normalized, anchor)));
    }
    return parseLiteral(normalized).map(DateRange::singleDay);
  }

  private DateRange fiscal(String expression, LocalDate anchor) {
    final int startMonth = ConnectorConfig.getInt(FISCAL_YEAR_START_MONTH)
        .orElseThrow(() -> new AmbiguousDateException(String.format(
            "\"%s\" depends on your fiscal calendar, which is not configured. "
                + "Please give explicit dates instead.", expression)));
    if (startMonth < 1 || startMonth > 12) {
      throw new AmbiguousDateException("The configured fiscal year start month is not a valid month.");
    }
    YearMonth fiscalStart = YearMonth.of(anchor.getYear(), startMonth);
    if (fiscalStart.atDay(1).isAfter(anchor)) {
      fiscalStart = fiscalStart.minusYears(1);
    }
    switch (expression) {
      case "last fiscal year":
        return DateRange.of(fiscalStart.minusYears(1).atDay(1), fiscalStart.atDay(1).minusDays(1));
      case "fiscal year to date":
        return DateRange.of(fiscalStart.atDay(1), anchor);
      default:
        return DateRange.of(fiscalStart.atDay(1), fiscalStart.plusYears(1).atDay(1).minusDays(1));
    }
  }

  private static LocalDate requireAnchor(String expression, LocalDate anchor) {
    if (anchor == null) {
      throw new AmbiguousDateException(String.format(
          "\"%s\" is relative to today's date, which is not known here. Please give explicit dates.", expression));
    }
    return anchor;
  }

  private static Optional<LocalDate> parseLiteral(String value) {
    for (DateTimeFormatter format : LITERAL_FORMATS) {
      try {
        return Optional.of(LocalDate.parse(value, format));
      } catch (DateTimeParseException e) {
        log.trace("\"{}\" is not in format {}", value, format);
      }
    }
    return Optional.empty();
  }

  private static DateRange weekOf(LocalDate date) {
    final LocalDate monday = date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    return DateRange.of(monday, monday.plusDays(6));
  }

  private static DateRange quarterOf(LocalDate date) {
    return quarter(date.get(IsoFields.QUARTER_OF_YEAR), date.getYear());
  }

  private static DateTimeFormatter literal(String pattern) {
    return new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .appendPattern(pattern)
        .toFormatter(Locale.ENGLISH)
        .withResolverStyle(ResolverStyle.STRICT);
  }

  private static ZoneId zone() {
    return ZoneId.of(ConnectorConfig.getString(TIMEZONE).orElse("UTC"));
  }
}
