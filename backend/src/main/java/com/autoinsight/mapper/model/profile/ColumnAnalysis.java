package com.autoinsight.mapper.model.profile;

import com.autoinsight.mapper.model.scoring.TypeScores;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Value;

/** Profile and type scores computed for one column during a mapping run. */
@Value
@Schema(description = "Profile and per-type scores of one column")
public class ColumnAnalysis {

  @JsonProperty("profile")
  ColumnProfile profile;

  @JsonProperty("type_scores")
  TypeScores typeScores;
}
