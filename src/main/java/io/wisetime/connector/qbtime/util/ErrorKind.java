/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.util;

/**
 * Failure categories reported to tool callers. The code is the value of the {@code code} field of a tool error.
 */
public enum ErrorKind {

  UNPARSEABLE_DATE("unparseable_date"),
  AMBIGUOUS_DATE("ambiguous_date"),
  MISSING_REQUIRED_FILTER("missing_required_filter"),
  VALIDATION_ERROR("validation_error"),
  AUTH_ERROR("auth_error"),
  RATE_LIMIT_EXCEEDED("rate_limit_exceeded"),
  SERVER_ERROR("server_error"),
  CANCELLED("cancelled");

  private final String code;

  ErrorKind(String code) {
    this.code = code;
  }

  public String getCode() {
    return code;
  }

  /**
   * Whether a request failing with this kind may succeed when sent again after a delay.
   */
  public boolean isRetryable() {
    return this == RATE_LIMIT_EXCEEDED || this == SERVER_ERROR;
  }
}
