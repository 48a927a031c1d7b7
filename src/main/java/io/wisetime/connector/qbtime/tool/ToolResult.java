/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.tool;

import com.google.gson.JsonElement;
import io.wisetime.connector.qbtime.util.ErrorKind;
import lombok.Value;

/**
 * Outcome of a tool call: either a JSON result or an error with a stable code and a message for the user.
 */
@Value
public class ToolResult {

  JsonElement result;
  Error error;

  public static ToolResult success(Object result) {
    return new ToolResult(ResultJson.gson().toJsonTree(result), null);
  }

  public static ToolResult failure(ErrorKind kind, String message) {
    return new ToolResult(null, new Error(kind.getCode(), message));
  }

  public boolean isSuccess() {
    return error == null;
  }

  public String toJson() {
    return ResultJson.toPrettyJson(this);
  }

  @Value
  public static class Error {
    String code;
    String message;
  }
}
