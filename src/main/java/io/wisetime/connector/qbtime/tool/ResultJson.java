/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.tool;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;
import io.wisetime.connector.qbtime.date.DateRange;
import java.time.LocalDate;
import java.time.OffsetDateTime;

/**
 * JSON rendering of tool results: snake_case names, ISO dates, unknown values left out.
 */
public final class ResultJson {

  private static final Gson GSON = new GsonBuilder()
      .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
      .registerTypeAdapter(LocalDate.class,
          (JsonSerializer<LocalDate>) (date, type, context) -> new JsonPrimitive(date.toString()))
      .registerTypeAdapter(OffsetDateTime.class,
          (JsonSerializer<OffsetDateTime>) (time, type, context) -> new JsonPrimitive(time.toString()))
      .registerTypeAdapter(DateRange.class, (JsonSerializer<DateRange>) (range, type, context) -> {
        final JsonObject json = new JsonObject();
        json.addProperty("start_date", range.getStart());
        json.addProperty("end_date", range.getEnd());
        return json;
      })
      .disableHtmlEscaping()
      .create();

  private static final Gson PRETTY = GSON.newBuilder().setPrettyPrinting().create();

  private ResultJson() {
  }

  public static Gson gson() {
    return GSON;
  }

  public static String toPrettyJson(Object value) {
    return PRETTY.toJson(value);
  }
}
