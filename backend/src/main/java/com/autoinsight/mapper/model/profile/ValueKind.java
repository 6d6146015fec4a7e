package com.autoinsight.mapper.model.profile;

import com.fasterxml.jackson.annotation.JsonValue;

/** Raw stored kind of the non-missing cells of a column. */
public enum ValueKind {
  NUMERIC("numeric"),
  TEXT("text"),
  MIXED("mixed"),
  EMPTY("empty");

  private final String value;

  ValueKind(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
