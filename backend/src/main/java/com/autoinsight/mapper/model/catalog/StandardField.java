package com.autoinsight.mapper.model.catalog;

import java.util.List;

import com.autoinsight.mapper.model.scoring.TypeTag;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** A semantic column role of a catalog together with the names it is known by. */
@Value
@Builder
@Schema(description = "Standard field of a schema catalog")
public class StandardField {

  @Schema(description = "Standard field name", example = "customerid")
  @JsonProperty("name")
  String name;

  @Schema(description = "Accepted spellings, compared case and punctuation insensitively")
  @Singular
  @JsonProperty("aliases")
  List<String> aliases;

  @Schema(description = "Type tag whose data score backs this field", example = "id")
  @JsonProperty("semantic_type")
  TypeTag semanticType;

  @JsonProperty("required")
  boolean required;
}
