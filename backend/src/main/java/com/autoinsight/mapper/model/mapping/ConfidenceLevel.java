package com.autoinsight.mapper.model.mapping;

import com.fasterxml.jackson.annotation.JsonValue;

/** UI bucket for a 0-100 confidence score. */
public enum ConfidenceLevel {
  HIGH("high"),
  MEDIUM("medium"),
  LOW("low");

  static final double HIGH_THRESHOLD = 80;
  static final double MEDIUM_THRESHOLD = 65;

  private final String value;

  ConfidenceLevel(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  public static ConfidenceLevel of(double confidence) {
    if (confidence >= HIGH_THRESHOLD) {
      return HIGH;
    }
    if (confidence >= MEDIUM_THRESHOLD) {
      return MEDIUM;
    }
    return LOW;
  }
}
