package com.autoinsight.mapper.dto.mapping;

import java.util.List;

import com.autoinsight.mapper.model.catalog.StandardField;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogDescription {

  @JsonProperty("domain")
  private String domain;

  @JsonProperty("built_in")
  private boolean builtIn;

  @JsonProperty("fields")
  private List<StandardField> fields;

  @JsonProperty("required_fields")
  private List<String> requiredFields;
}
