/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.util;

/**
 * QuickBooks Time kept answering 429 until the retry budget was used up.
 */
public class RateLimitExceededException extends ConnectorException {

  public RateLimitExceededException(String message) {
    super(ErrorKind.RATE_LIMIT_EXCEEDED, message);
  }

  public RateLimitExceededException(String message, Throwable cause) {
    super(ErrorKind.RATE_LIMIT_EXCEEDED, message, cause);
  }
}
