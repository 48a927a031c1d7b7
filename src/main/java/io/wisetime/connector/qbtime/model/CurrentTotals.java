/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.model;

import com.google.gson.annotations.SerializedName;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

/**
 * Live shift and day totals of one user.
 */
@Getter
@Setter
@Accessors(chain = true)
public class CurrentTotals {

  @SerializedName("user_id")
  private long userId;

  @SerializedName("group_id")
  private long groupId;

  @SerializedName("on_the_clock")
  private boolean onTheClock;

  @SerializedName("shift_seconds")
  private long shiftSeconds;

  @SerializedName("day_seconds")
  private long daySeconds;
}
