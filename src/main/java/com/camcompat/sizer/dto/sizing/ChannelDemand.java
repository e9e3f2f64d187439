package com.camcompat.sizer.dto.sizing;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Value;

@Value
public class ChannelDemand {

  private static final ChannelDemand NONE = new ChannelDemand(0, 0);

  @JsonProperty("low_tier_channels")
  long lowTierChannels;

  @JsonProperty("high_tier_channels")
  long highTierChannels;

  public static ChannelDemand none() {
    return NONE;
  }

  public long forTier(ResolutionTier tier) {
    return tier == ResolutionTier.LOW ? lowTierChannels : highTierChannels;
  }

  public ChannelDemand add(ResolutionTier tier, long channels) {
    return tier == ResolutionTier.LOW
        ? new ChannelDemand(Math.addExact(lowTierChannels, channels), highTierChannels)
        : new ChannelDemand(lowTierChannels, Math.addExact(highTierChannels, channels));
  }

  public ChannelDemand plus(ChannelDemand other) {
    return new ChannelDemand(
        Math.addExact(lowTierChannels, other.lowTierChannels),
        Math.addExact(highTierChannels, other.highTierChannels));
  }

  @JsonIgnore
  public long getTotalChannels() {
    return Math.addExact(lowTierChannels, highTierChannels);
  }
}
