/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.util;

/**
 * Thrown when a date expression matches no known rule and is not a supported date literal.
 */
public class UnparseableDateException extends ConnectorException {

  public UnparseableDateException(String message) {
    super(ErrorKind.UNPARSEABLE_DATE, message);
  }

  public UnparseableDateException(String message, Throwable cause) {
    super(ErrorKind.UNPARSEABLE_DATE, message, cause);
  }
}
