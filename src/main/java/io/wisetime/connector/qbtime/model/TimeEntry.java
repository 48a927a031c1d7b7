/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.model;

import com.google.gson.annotations.SerializedName;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;
import org.apache.commons.lang3.StringUtils;

/**
 * A QuickBooks Time timesheet. Regular timesheets carry start and end, manual ones only a duration.
 */
@Getter
@Setter
@Accessors(chain = true)
public class TimeEntry {

  @SerializedName("id")
  private long id;

  @SerializedName("user_id")
  private long userId;

  @SerializedName("jobcode_id")
  private long jobcodeId;

  @SerializedName("start")
  private String start;

  @SerializedName("end")
  private String end;

  @SerializedName("duration")
  private long duration;

  @SerializedName("date")
  private String date;

  @SerializedName("locked")
  private int locked;

  @SerializedName("notes")
  private String notes;

  @SerializedName("customfields")
  private Map<String, String> customFields;

  @SerializedName("last_modified")
  private String lastModified;

  @SerializedName("type")
  private String type;

  @SerializedName("on_the_clock")
  private boolean onTheClock;

  @SerializedName(value = "double_time", alternate = {"doubletime"})
  private boolean doubleTime;

  public boolean isLocked() {
    return locked > 0;
  }

  public Map<String, String> getCustomFields() {
    return customFields == null ? Collections.emptyMap() : customFields;
  }

  public LocalDate getLocalDate() {
    return LocalDate.parse(date);
  }

  public Optional<OffsetDateTime> getStartTime() {
    return parseTimestamp(start);
  }

  public Optional<OffsetDateTime> getEndTime() {
    return parseTimestamp(end);
  }

  /**
   * Worked seconds. Falls back to end minus start when the service reported no duration.
   */
  public long getDurationSeconds() {
    if (duration > 0) {
      return duration;
    }
    final Optional<OffsetDateTime> startTime = getStartTime();
    final Optional<OffsetDateTime> endTime = getEndTime();
    if (startTime.isPresent() && endTime.isPresent()) {
      return Math.max(0, endTime.get().toEpochSecond() - startTime.get().toEpochSecond());
    }
    return 0;
  }

  private static Optional<OffsetDateTime> parseTimestamp(String value) {
    if (StringUtils.isBlank(value)) {
      return Optional.empty();
    }
    try {
      return Optional.of(OffsetDateTime.parse(value));
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }
}
