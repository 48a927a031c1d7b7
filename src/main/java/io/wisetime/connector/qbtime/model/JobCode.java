/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.model;

import com.google.gson.annotations.SerializedName;
import java.math.BigDecimal;
import java.util.Optional;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

/**
 * A QuickBooks Time jobcode: a client, project or task, or a non-billable category such as PTO.
 */
@Getter
@Setter
@Accessors(chain = true)
public class JobCode {

  public static final long TOP_LEVEL = 0;

  @SerializedName("id")
  private long id;

  @SerializedName("parent_id")
  private long parentId;

  @SerializedName("name")
  private String name;

  @SerializedName("short_code")
  private String shortCode;

  @SerializedName("type")
  private JobCodeType type;

  @SerializedName("has_children")
  private boolean hasChildren;

  @SerializedName("billable")
  private boolean billable;

  @SerializedName("billable_rate")
  private BigDecimal billableRate;

  @SerializedName("active")
  private boolean active;

  public boolean isTopLevel() {
    return parentId == TOP_LEVEL;
  }

  public Optional<BigDecimal> getBillingRate() {
    return Optional.ofNullable(billableRate).filter(rate -> billable && rate.signum() > 0);
  }
}
