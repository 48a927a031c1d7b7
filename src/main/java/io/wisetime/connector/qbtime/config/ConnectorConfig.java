/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.config;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.commons.lang3.BooleanUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connector configuration. Values are resolved from explicit overrides first, then system properties, then
 * environment variables. Blank values are treated as absent.
 */
public final class ConnectorConfig {

  private static final Logger log = LoggerFactory.getLogger(ConnectorConfig.class);

  private static final Map<String, String> OVERRIDES = new ConcurrentHashMap<>();

  private ConnectorConfig() {
  }

  public static Optional<String> getString(ConfigKey key) {
    final String name = key.getConfigKey();
    String value = OVERRIDES.get(name);
    if (value == null) {
      value = System.getProperty(name);
    }
    if (value == null) {
      value = System.getenv(name);
    }
    return Optional.ofNullable(StringUtils.trimToNull(value));
  }

  public static Optional<Integer> getInt(ConfigKey key) {
    return getString(key).map(value -> {
      try {
        return Integer.parseInt(value);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(key.getConfigKey() + " must be a number, got: " + value, e);
      }
    });
  }

  public static Optional<Long> getLong(ConfigKey key) {
    return getString(key).map(value -> {
      try {
        return Long.parseLong(value);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(key.getConfigKey() + " must be a number, got: " + value, e);
      }
    });
  }

  public static Optional<Boolean> getBoolean(ConfigKey key) {
    return getString(key).map(BooleanUtils::toBoolean);
  }

  public static void setProperty(ConfigKey key, String value) {
    log.debug("Overriding config {}", key.getConfigKey());
    OVERRIDES.put(key.getConfigKey(), value);
  }

  public static void clearProperty(ConfigKey key) {
    OVERRIDES.remove(key.getConfigKey());
  }

  /**
   * Drops all overrides set through {@link #setProperty(ConfigKey, String)}.
   */
  public static void rebuild() {
    OVERRIDES.clear();
  }
}
