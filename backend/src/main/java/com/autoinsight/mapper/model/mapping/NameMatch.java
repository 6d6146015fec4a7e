package com.autoinsight.mapper.model.mapping;

import lombok.Value;

/** Best catalog field for a column name, or no field with score 0. */
@Value
public class NameMatch {

  private static final NameMatch NONE = new NameMatch(null, 0);

  String standardField;
  int score;

  public static NameMatch none() {
    return NONE;
  }

  public boolean isMatched() {
    return standardField != null;
  }
}
