/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.util;

/**
 * A workflow was cancelled or timed out while waiting. Partial results are discarded.
 */
public class CancelledException extends ConnectorException {

  public CancelledException(String message) {
    super(ErrorKind.CANCELLED, message);
  }

  public CancelledException(String message, Throwable cause) {
    super(ErrorKind.CANCELLED, message, cause);
  }
}
