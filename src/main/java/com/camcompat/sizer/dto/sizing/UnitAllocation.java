package com.camcompat.sizer.dto.sizing;

import com.camcompat.sizer.dto.catalog.GatewayUnit;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Value;

@Value
public class UnitAllocation {

  @JsonProperty("unit")
  GatewayUnit unit;

  @JsonProperty("count")
  long count;
}
