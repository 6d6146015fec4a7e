package com.autoinsight.mapper.dto.mapping;

import java.util.List;
import java.util.Map;

import com.autoinsight.mapper.model.mapping.ColumnMapping;
import com.autoinsight.mapper.model.mapping.ValidationResult;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Table renamed to standard field names, together with the mapping that produced it. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApplyMappingResponse {

  @JsonProperty("domain")
  private String domain;

  @JsonProperty("mapping")
  private ColumnMapping mapping;

  @JsonProperty("validation")
  private ValidationResult validation;

  @JsonProperty("columns")
  private List<String> columns;

  @JsonProperty("row_count")
  private int rowCount;

  @JsonProperty("data")
  private List<Map<String, Object>> data;
}
