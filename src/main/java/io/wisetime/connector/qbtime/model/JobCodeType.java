/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.model;

import com.google.gson.annotations.SerializedName;
import java.util.Arrays;
import java.util.Optional;

public enum JobCodeType {

  @SerializedName("regular")
  REGULAR("regular"),

  @SerializedName("pto")
  PTO("pto"),

  @SerializedName("paid_break")
  PAID_BREAK("paid_break"),

  @SerializedName("unpaid_break")
  UNPAID_BREAK("unpaid_break");

  private final String serviceName;

  JobCodeType(String serviceName) {
    this.serviceName = serviceName;
  }

  public String getServiceName() {
    return serviceName;
  }

  public static Optional<JobCodeType> fromServiceName(String name) {
    return Arrays.stream(values())
        .filter(type -> type.serviceName.equalsIgnoreCase(name))
        .findFirst();
  }
}
