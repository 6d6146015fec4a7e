package com.autoinsight.mapper.model.mapping;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MappingMethod {
  /** Column-name similarity only; no data is read. */
  NAME_ONLY("name_only"),
  /** Weighted blend of name similarity and data-profile type scores. */
  HYBRID("hybrid");

  private final String value;

  MappingMethod(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /**
   * @throws IllegalArgumentException for anything but {@code hybrid} or {@code name_only}
   */
  @JsonCreator
  public static MappingMethod fromValue(String value) {
    String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    for (MappingMethod method : values()) {
      if (method.value.equals(normalized)) {
        return method;
      }
    }
    throw new IllegalArgumentException(
        "Unknown mapping mode: '" + value + "'. Expected 'hybrid' or 'name_only'");
  }
}
