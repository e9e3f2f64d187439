package com.camcompat.sizer.dto.sizing;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ResolutionTier {
  LOW("low"),
  HIGH("high");

  private final String label;

  ResolutionTier(String label) {
    this.label = label;
  }

  @JsonValue
  public String getLabel() {
    return label;
  }

  /** Cameras at or below the threshold are low tier; anything above is high tier. */
  public static ResolutionTier forMegapixels(double megapixels, double thresholdMp) {
    return megapixels <= thresholdMp ? LOW : HIGH;
  }
}
