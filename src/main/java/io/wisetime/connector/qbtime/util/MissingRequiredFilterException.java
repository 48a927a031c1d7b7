/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.util;

/**
 * Thrown before any request is sent when an endpoint needs at least one filter of a set and none was given.
 */
public class MissingRequiredFilterException extends ConnectorException {

  public MissingRequiredFilterException(String message) {
    super(ErrorKind.MISSING_REQUIRED_FILTER, message);
  }

  public MissingRequiredFilterException(String message, Throwable cause) {
    super(ErrorKind.MISSING_REQUIRED_FILTER, message, cause);
  }
}
