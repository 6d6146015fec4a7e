package com.autoinsight.mapper.model.scoring;

import java.util.Arrays;
import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Coarse semantic category inferred from a column's values. */
public enum TypeTag {
  ID("id"),
  DATE("date"),
  NUMERIC("numeric"),
  RATING("rating"),
  TEXT("text");

  private final String value;

  TypeTag(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  @JsonCreator
  public static TypeTag fromValue(String value) {
    if (value != null) {
      String normalized = value.trim().toLowerCase(Locale.ROOT);
      for (TypeTag tag : values()) {
        if (tag.value.equals(normalized)) {
          return tag;
        }
      }
    }
    throw new IllegalArgumentException(
        "Unknown semantic type '"
            + value
            + "'. Expected one of "
            + Arrays.toString(Arrays.stream(values()).map(TypeTag::getValue).toArray()));
  }
}
