package com.camcompat.sizer.dto.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;

/**
 * A gateway model. The channel range is the usable capacity: {@code highChannels} is the ceiling
 * used to decide coverage, {@code lowChannels} the conservative figure used for spare capacity.
 */
@Value
@Builder
public class GatewayUnit {

  @JsonProperty("name")
  String name;

  @JsonProperty("storage_tb")
  double storageTb;

  @JsonProperty("low_channels")
  int lowChannels;

  @JsonProperty("high_channels")
  int highChannels;
}
