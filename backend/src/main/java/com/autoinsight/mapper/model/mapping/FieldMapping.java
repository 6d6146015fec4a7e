package com.autoinsight.mapper.model.mapping;

import java.util.List;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** The user column selected for one standard field, with the candidates it beat. */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Resolved mapping for one standard field")
public class FieldMapping {

  @JsonProperty("standard_field")
  String standardField;

  @JsonProperty("user_column")
  String userColumn;

  @Schema(description = "Combined confidence 0-100", example = "92.0")
  @JsonProperty("confidence")
  double confidence;

  @JsonProperty("name_score")
  int nameScore;

  @JsonProperty("data_score")
  Integer dataScore;

  @JsonProperty("method")
  MappingMethod method;

  @Schema(description = "Other candidates scoring at most the selected one, best first")
  @Singular
  @JsonProperty("alternatives")
  List<MappingCandidate> alternatives;

  @Schema(
      description =
          "Higher scoring candidates whose column was claimed by a stronger assignment to another"
              + " field")
  @Singular
  @JsonProperty("preempted")
  List<MappingCandidate> preemptions;

  @Schema(description = "Bucket of the unrounded confidence")
  @JsonProperty("confidence_level")
  ConfidenceLevel confidenceLevel;

  public ConfidenceLevel getConfidenceLevel() {
    return confidenceLevel != null ? confidenceLevel : ConfidenceLevel.of(confidence);
  }

  @JsonIgnore
  public List<String> getAlternativeColumns() {
    return alternatives.stream().map(MappingCandidate::getUserColumn).collect(Collectors.toList());
  }
}
