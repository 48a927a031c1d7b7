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
import org.apache.commons.lang3.StringUtils;

/**
 * A QuickBooks Time user.
 */
@Getter
@Setter
@Accessors(chain = true)
public class Employee {

  @SerializedName("id")
  private long id;

  @SerializedName("first_name")
  private String firstName;

  @SerializedName("last_name")
  private String lastName;

  @SerializedName("active")
  private boolean active;

  @SerializedName("group_id")
  private long groupId;

  @SerializedName("payroll_id")
  private String payrollId;

  @SerializedName("employee_number")
  private long employeeNumber;

  @SerializedName(value = "hourly_rate", alternate = {"pay_rate"})
  private BigDecimal hourlyRate;

  @SerializedName("hire_date")
  private String hireDate;

  public Optional<BigDecimal> getRate() {
    return Optional.ofNullable(hourlyRate).filter(rate -> rate.signum() > 0);
  }

  public String getDisplayName() {
    return StringUtils.normalizeSpace(StringUtils.defaultString(firstName) + " " + StringUtils.defaultString(lastName));
  }
}
