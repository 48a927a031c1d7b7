/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.report;

import com.google.common.collect.ImmutableSortedMap;
import java.util.Optional;
import lombok.Value;

/**
 * Totals per dimension key, plus their sum.
 */
@Value
public class AggregateTotals {

  Dimension dimension;
  ImmutableSortedMap<Long, Totals> byKey;
  Totals totals;

  public Optional<Totals> get(long key) {
    return Optional.ofNullable(byKey.get(key));
  }

  public boolean isEmpty() {
    return byKey.isEmpty();
  }
}
