/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.model;

import com.google.gson.annotations.SerializedName;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

@Getter
@Setter
@Accessors(chain = true)
public class Group {

  @SerializedName("id")
  private long id;

  @SerializedName("name")
  private String name;

  @SerializedName("active")
  private boolean active;

  @SerializedName("manager_ids")
  private List<Long> managerIds;
}
