/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.util;

/**
 * Malformed parameters, or a request rejected by QuickBooks Time with a client error.
 */
public class ValidationException extends ConnectorException {

  public ValidationException(String message) {
    super(ErrorKind.VALIDATION_ERROR, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(ErrorKind.VALIDATION_ERROR, message, cause);
  }
}
