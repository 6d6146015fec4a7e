package com.autoinsight.mapper.model.mapping;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/** One user column that cleared the confidence threshold for a standard field. */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "User column considered for a standard field")
public class MappingCandidate {

  @JsonProperty("user_column")
  String userColumn;

  @Schema(description = "Combined confidence, rounded to one decimal", example = "92.0")
  @JsonProperty("score")
  double score;

  @JsonProperty("name_score")
  int nameScore;

  @Schema(description = "Type score of the column; absent for name-only mappings")
  @JsonProperty("data_score")
  Integer dataScore;

  @Schema(description = "Standard field that claimed this column instead, if any")
  @With
  @JsonProperty("assigned_to")
  String assignedTo;
}
