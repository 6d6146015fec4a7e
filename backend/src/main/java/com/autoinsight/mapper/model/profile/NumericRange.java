package com.autoinsight.mapper.model.profile;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Value;

@Value
public class NumericRange {

  @JsonProperty("min")
  double min;

  @JsonProperty("max")
  double max;

  @JsonProperty("mean")
  double mean;

  public boolean within(double lower, double upper) {
    return lower <= min && max <= upper;
  }
}
