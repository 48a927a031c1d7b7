/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.model;

import com.google.gson.annotations.SerializedName;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

/**
 * A custom tracking field. Its id is the key of the field's value in {@link TimeEntry#getCustomFields()}.
 */
@Getter
@Setter
@Accessors(chain = true)
public class CustomField {

  @SerializedName("id")
  private long id;

  @SerializedName("name")
  private String name;

  @SerializedName("short_code")
  private String shortCode;

  @SerializedName("active")
  private boolean active;

  @SerializedName("required")
  private boolean required;

  @SerializedName("applies_to")
  private String appliesTo;

  @SerializedName("type")
  private String type;

  @SerializedName("last_modified")
  private String lastModified;
}
