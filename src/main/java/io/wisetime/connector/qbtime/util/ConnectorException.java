/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.util;

/**
 * General error designed to contain connector's specific meaningful message which can be shown to a user.
 *
 * <p>The {@link ErrorKind} identifies the failure category independently of the message, so callers can branch on
 * the kind and display the message as is.
 *
 * @author pascal
 */
public class ConnectorException extends RuntimeException {

  private final ErrorKind kind;

  public ConnectorException(String message) {
    this(ErrorKind.SERVER_ERROR, message);
  }

  public ConnectorException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public ConnectorException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind getKind() {
    return kind;
  }
}
