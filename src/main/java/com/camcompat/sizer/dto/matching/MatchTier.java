package com.camcompat.sizer.dto.matching;

import com.fasterxml.jackson.annotation.JsonValue;

/** Match confidence, declared from most to least confident; ordinal order is sort order. */
public enum MatchTier {
  EXACT("exact"),
  IDENTIFIED("identified"),
  POTENTIAL("potential"),
  UNSUPPORTED("unsupported");

  private final String label;

  MatchTier(String label) {
    this.label = label;
  }

  @JsonValue
  public String getLabel() {
    return label;
  }

  public boolean isSupported() {
    return this != UNSUPPORTED;
  }
}
