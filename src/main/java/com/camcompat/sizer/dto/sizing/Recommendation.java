package com.camcompat.sizer.dto.sizing;

import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Gateway units chosen for one resolution tier.
 *
 * <p>{@code ceilingCapacity} is what the selection had to cover; {@code excessChannels} is the
 * worst-case spare capacity, computed from the units' low channel bounds. The latter may be
 * negative even though the ceiling covers the demand and is reported as is.
 */
@Value
@Builder
public class Recommendation {

  @JsonProperty("tier")
  ResolutionTier tier;

  @JsonProperty("required_channels")
  long requiredChannels;

  @Singular
  @JsonProperty("allocations")
  List<UnitAllocation> allocations;

  @JsonProperty("ceiling_capacity")
  long ceilingCapacity;

  @JsonProperty("excess_channels")
  long excessChannels;

  @JsonProperty("storage_tb")
  double storageTb;

  public static Recommendation empty(ResolutionTier tier) {
    return Recommendation.builder()
        .tier(tier)
        .requiredChannels(0)
        .allocations(Collections.emptyList())
        .ceilingCapacity(0)
        .excessChannels(0)
        .storageTb(0)
        .build();
  }

  @JsonProperty("unit_count")
  public long getUnitCount() {
    return allocations.stream().mapToLong(UnitAllocation::getCount).sum();
  }

  @JsonIgnore
  public boolean isEmpty() {
    return allocations.isEmpty();
  }
}
