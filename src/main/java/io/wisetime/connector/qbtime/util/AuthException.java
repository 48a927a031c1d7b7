/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.util;

/**
 * QuickBooks Time rejected the access token (401) or the token lacks permission (403). Never retried.
 */
public class AuthException extends ConnectorException {

  public AuthException(String message) {
    super(ErrorKind.AUTH_ERROR, message);
  }

  public AuthException(String message, Throwable cause) {
    super(ErrorKind.AUTH_ERROR, message, cause);
  }
}
