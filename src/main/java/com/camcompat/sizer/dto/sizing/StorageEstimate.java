package com.camcompat.sizer.dto.sizing;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class StorageEstimate {

  @JsonProperty("tier")
  ResolutionTier tier;

  @JsonProperty("channels")
  long channels;

  @JsonProperty("retention_days")
  int retentionDays;

  @JsonProperty("band_days")
  int bandDays;

  @JsonProperty("gb_per_channel_day")
  double coefficient;

  @JsonProperty("gigabytes")
  double gigabytes;

  @JsonProperty("terabytes")
  public double getTerabytes() {
    return gigabytes / 1000.0;
  }
}
