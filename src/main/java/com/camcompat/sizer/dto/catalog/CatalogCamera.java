package com.camcompat.sizer.dto.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CatalogCamera {

  @JsonProperty("model_name")
  String modelName;

  @JsonProperty("manufacturer")
  String manufacturer;

  @JsonProperty("minimum_firmware_version")
  String minimumFirmwareVersion;

  @JsonProperty("notes")
  String notes;

  @JsonProperty("megapixels")
  double megapixels;

  /** Gateway channels consumed by one stream of this camera; always at least 1. */
  @JsonProperty("channel_cost")
  int channelCost;

  public boolean hasModelName(String name) {
    return name != null && modelName.equalsIgnoreCase(name.trim());
  }
}
