package com.camcompat.sizer.dto.matching;

import java.util.Comparator;

import com.camcompat.sizer.dto.catalog.CatalogCamera;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MatchResult {

  public static final Comparator<MatchResult> BY_TIER = Comparator.comparing(MatchResult::getTier);

  @JsonProperty("raw_value")
  String rawValue;

  @JsonProperty("tier")
  MatchTier tier;

  @JsonIgnore CatalogCamera matchedCamera;

  @JsonProperty("count")
  long count;

  @Builder(toBuilder = true)
  public MatchResult(String rawValue, MatchTier tier, CatalogCamera matchedCamera, long count) {
    if (tier == null) {
      throw new IllegalArgumentException("Match tier must not be null");
    }
    if (tier == MatchTier.UNSUPPORTED && matchedCamera != null) {
      throw new IllegalArgumentException("An unsupported match cannot reference a catalog camera");
    }
    if (tier != MatchTier.UNSUPPORTED && matchedCamera == null) {
      throw new IllegalArgumentException("A " + tier.getLabel() + " match needs a catalog camera");
    }
    this.rawValue = rawValue;
    this.tier = tier;
    this.matchedCamera = matchedCamera;
    this.count = count;
  }

  public static MatchResult unsupported(String rawValue, long count) {
    return new MatchResult(rawValue, MatchTier.UNSUPPORTED, null, count);
  }

  public MatchResult withCount(long newCount) {
    return toBuilder().count(newCount).build();
  }

  @JsonProperty("matched_model")
  public String getMatchedModel() {
    return matchedCamera != null ? matchedCamera.getModelName() : null;
  }

  @JsonIgnore
  public boolean isMatched() {
    return matchedCamera != null;
  }
}
