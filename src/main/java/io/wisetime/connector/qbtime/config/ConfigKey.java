/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.config;

/**
 * A named configuration value, looked up by {@link ConnectorConfig}.
 */
public interface ConfigKey {

  String getConfigKey();
}
