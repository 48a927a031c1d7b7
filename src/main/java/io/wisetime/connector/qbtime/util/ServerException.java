/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.util;

/**
 * QuickBooks Time failed with a 5xx status or could not be reached.
 */
public class ServerException extends ConnectorException {

  public ServerException(String message) {
    super(ErrorKind.SERVER_ERROR, message);
  }

  public ServerException(String message, Throwable cause) {
    super(ErrorKind.SERVER_ERROR, message, cause);
  }
}
