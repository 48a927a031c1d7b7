/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.workflow;

import com.google.gson.annotations.SerializedName;

public enum WorkflowState {

  @SerializedName("resolving")
  RESOLVING,
  @SerializedName("fetching")
  FETCHING,
  @SerializedName("aggregating")
  AGGREGATING,
  @SerializedName("assembling")
  ASSEMBLING,
  @SerializedName("done")
  DONE,
  @SerializedName("partially_failed")
  PARTIALLY_FAILED
}
