/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.util;

/**
 * Thrown when a date expression is recognized but cannot be resolved without more context, e.g. a fiscal calendar.
 */
public class AmbiguousDateException extends ConnectorException {

  public AmbiguousDateException(String message) {
    super(ErrorKind.AMBIGUOUS_DATE, message);
  }

  public AmbiguousDateException(String message, Throwable cause) {
    super(ErrorKind.AMBIGUOUS_DATE, message, cause);
  }
}
