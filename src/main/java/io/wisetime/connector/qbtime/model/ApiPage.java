/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.model;

import com.google.gson.JsonObject;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

/**
 * One page of a QuickBooks Time list endpoint, with records in the order the service returned them.
 */
@Getter
@Setter
@Accessors(chain = true)
public class ApiPage<T> {

  private List<T> records;

  private boolean more;

  private JsonObject supplementalData;
}
