/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.tool;

import java.util.List;
import lombok.Value;

/**
 * Records returned by a list tool. {@code page} and {@code more} are only set when a single page was requested.
 */
@Value
public class RecordList<T> {

  List<T> records;
  int count;
  Integer page;
  Boolean more;

  static <T> RecordList<T> all(List<T> records) {
    return new RecordList<>(records, records.size(), null, null);
  }

  static <T> RecordList<T> page(List<T> records, int page, boolean more) {
    return new RecordList<>(records, records.size(), page, more);
  }
}
