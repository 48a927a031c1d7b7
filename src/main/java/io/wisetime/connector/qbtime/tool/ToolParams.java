/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.tool;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import io.wisetime.connector.qbtime.util.ValidationException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import org.apache.commons.lang3.StringUtils;

/**
 * Validated access to the parameters of a tool call. Every failed check is a {@link ValidationException} naming
 * the parameter.
 */
public class ToolParams {

  static final int MAX_LIMIT = 200;

  private static final Set<String> ACTIVE_VALUES = ImmutableSet.of("yes", "no", "both");
  private static final Set<String> JOBCODE_TYPES =
      ImmutableSet.of("regular", "pto", "paid_break", "unpaid_break", "all");

  private final JsonObject json;

  private ToolParams(JsonObject json) {
    this.json = json;
  }

  public static ToolParams empty() {
    return new ToolParams(new JsonObject());
  }

  public static ToolParams of(JsonObject json) {
    return new ToolParams(json == null ? new JsonObject() : json);
  }

  public static ToolParams of(Map<String, ?> values) {
    return new ToolParams(new Gson().toJsonTree(values).getAsJsonObject());
  }

  /**
   * @throws ValidationException if {@code text} is not a JSON object
   */
  public static ToolParams parse(String text) {
    if (StringUtils.isBlank(text)) {
      return empty();
    }
    try {
      final JsonElement parsed = JsonParser.parseString(text);
      if (!parsed.isJsonObject()) {
        throw new ValidationException("Tool parameters must be a JSON object.");
      }
      return new ToolParams(parsed.getAsJsonObject());
    } catch (JsonParseException e) {
      throw new ValidationException("Tool parameters are not valid JSON: " + e.getMessage(), e);
    }
  }

  public boolean has(String name) {
    return getString(name).isPresent() || (json.has(name) && json.get(name).isJsonArray());
  }

  public Optional<String> getString(String name) {
    final JsonElement value = json.get(name);
    if (value == null || value.isJsonNull()) {
      return Optional.empty();
    }
    if (!value.isJsonPrimitive()) {
      throw new ValidationException(name + " must be a single value");
    }
    return Optional.ofNullable(StringUtils.trimToNull(value.getAsString()));
  }

  public String requireString(String name) {
    return getString(name).orElseThrow(() -> new ValidationException(name + " is required"));
  }

  public Optional<Integer> getInt(String name) {
    return getString(name).map(value -> {
      try {
        return Integer.parseInt(value);
      } catch (NumberFormatException e) {
        throw new ValidationException(name + " must be a whole number", e);
      }
    });
  }

  public Optional<Long> getLong(String name) {
    return getString(name).map(value -> {
      try {
        return Long.parseLong(value);
      } catch (NumberFormatException e) {
        throw new ValidationException(name + " must be a whole number", e);
      }
    });
  }

  /**
   * A positive amount, e.g. an hourly rate.
   */
  public Optional<BigDecimal> getAmount(String name) {
    return getString(name).map(value -> {
      final BigDecimal amount;
      try {
        amount = new BigDecimal(value);
      } catch (NumberFormatException e) {
        throw new ValidationException(name + " must be a number", e);
      }
      if (amount.signum() <= 0) {
        throw new ValidationException(name + " must be greater than zero");
      }
      return amount;
    });
  }

  public boolean getBoolean(String name, boolean defaultValue) {
    return getString(name)
        .map(value -> {
          switch (value.toLowerCase(Locale.ROOT)) {
            case "true":
            case "yes":
              return true;
            case "false":
            case "no":
              return false;
            default:
              throw new ValidationException(name + " must be true or false");
          }
        })
        .orElse(defaultValue);
  }

  /**
   * Ids given as a JSON array or as a comma separated list.
   */
  public List<Long> getIds(String name) {
    final JsonElement value = json.get(name);
    if (value == null || value.isJsonNull()) {
      return ImmutableList.of();
    }
    final ImmutableList.Builder<String> raw = ImmutableList.builder();
    if (value.isJsonArray()) {
      final JsonArray array = value.getAsJsonArray();
      array.forEach(item -> raw.add(item.isJsonPrimitive() ? item.getAsString() : item.toString()));
    } else if (value.isJsonPrimitive()) {
      raw.addAll(Splitter.on(',').trimResults().omitEmptyStrings().split(value.getAsString()));
    } else {
      throw new ValidationException(name + " must be a list of ids");
    }
    return raw.build().stream()
        .map(id -> {
          try {
            final long parsed = Long.parseLong(id.trim());
            if (parsed <= 0) {
              throw new ValidationException(name + " must only contain positive ids, got " + id);
            }
            return parsed;
          } catch (NumberFormatException e) {
            throw new ValidationException(name + " must only contain numeric ids, got " + id, e);
          }
        })
        .collect(ImmutableList.toImmutableList());
  }

  public Optional<String> getActive() {
    return getChoice("active", ACTIVE_VALUES);
  }

  /**
   * @param toServiceTerm applied before validation, so that "vacation" is accepted for "pto"
   */
  public Optional<String> getJobCodeType(UnaryOperator<String> toServiceTerm) {
    return getJobCodeType("type", toServiceTerm);
  }

  public Optional<String> getJobCodeType(String name, UnaryOperator<String> toServiceTerm) {
    final Optional<String> value = getString(name).map(toServiceTerm).map(type -> type.toLowerCase(Locale.ROOT));
    if (value.isPresent() && !JOBCODE_TYPES.contains(value.get())) {
      throw new ValidationException(String.format("%s must be one of %s", name, String.join(", ", JOBCODE_TYPES)));
    }
    return value;
  }

  /**
   * Values given as a JSON array or as a comma separated list, lower cased.
   */
  public List<String> getNames(String name) {
    final JsonElement value = json.get(name);
    if (value == null || value.isJsonNull()) {
      return ImmutableList.of();
    }
    final ImmutableList.Builder<String> names = ImmutableList.builder();
    if (value.isJsonArray()) {
      for (JsonElement item : value.getAsJsonArray()) {
        if (!item.isJsonPrimitive()) {
          throw new ValidationException(name + " must be a list of names");
        }
        names.add(item.getAsString());
      }
    } else if (value.isJsonPrimitive()) {
      names.addAll(Splitter.on(',').split(value.getAsString()));
    } else {
      throw new ValidationException(name + " must be a list of names");
    }
    return names.build().stream()
        .map(String::trim)
        .filter(item -> !item.isEmpty())
        .map(item -> item.toLowerCase(Locale.ROOT))
        .collect(ImmutableList.toImmutableList());
  }

  /**
   * An ISO-8601 timestamp with offset. A plain date is taken as midnight UTC.
   */
  public Optional<String> getTimestamp(String name) {
    return getString(name).map(value -> {
      final String timestamp = value.length() == 10 ? value + "T00:00:00Z" : value;
      try {
        if (value.length() == 10) {
          LocalDate.parse(value);
        }
        OffsetDateTime.parse(timestamp);
      } catch (DateTimeParseException e) {
        throw new ValidationException(name + " must be an ISO-8601 timestamp such as 2024-12-31T00:00:00Z", e);
      }
      return timestamp;
    });
  }

  public int getPage() {
    final int page = getInt("page").orElse(1);
    if (page < 1) {
      throw new ValidationException("page must be 1 or greater");
    }
    return page;
  }

  public Optional<Integer> getLimit() {
    final Optional<Integer> limit = getInt("limit");
    if (limit.isPresent() && (limit.get() < 1 || limit.get() > MAX_LIMIT)) {
      throw new ValidationException("limit must be between 1 and " + MAX_LIMIT);
    }
    return limit;
  }

  /**
   * Values keyed by id, given as a JSON object whose members are a single value or an array of values, e.g.
   * {@code {"1964": ["Yes"]}}.
   */
  public Map<String, List<String>> getValueLists(String name) {
    final JsonElement value = json.get(name);
    if (value == null || value.isJsonNull()) {
      return ImmutableMap.of();
    }
    if (!value.isJsonObject()) {
      throw new ValidationException(name + " must be an object of values by id");
    }
    final ImmutableMap.Builder<String, List<String>> lists = ImmutableMap.builder();
    for (Map.Entry<String, JsonElement> member : value.getAsJsonObject().entrySet()) {
      final JsonArray items = new JsonArray();
      if (member.getValue().isJsonArray()) {
        items.addAll(member.getValue().getAsJsonArray());
      } else {
        items.add(member.getValue());
      }
      final ImmutableList.Builder<String> values = ImmutableList.builder();
      for (JsonElement item : items) {
        if (!item.isJsonPrimitive()) {
          throw new ValidationException(name + " values must be text or lists of text");
        }
        values.add(item.getAsString());
      }
      lists.put(member.getKey(), values.build());
    }
    return lists.build();
  }

  Optional<String> getChoice(String name, Set<String> allowed) {
    final Optional<String> value = getString(name).map(choice -> choice.toLowerCase(Locale.ROOT));
    if (value.isPresent() && !allowed.contains(value.get())) {
      throw new ValidationException(String.format("%s must be one of %s", name, String.join(", ", allowed)));
    }
    return value;
  }

  @Override
  public String toString() {
    return json.toString();
  }
}
