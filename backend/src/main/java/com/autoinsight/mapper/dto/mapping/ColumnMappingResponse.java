package com.autoinsight.mapper.dto.mapping;

import java.util.Map;

import com.autoinsight.mapper.model.mapping.ColumnMapping;
import com.autoinsight.mapper.model.mapping.ValidationResult;
import com.autoinsight.mapper.model.profile.ColumnAnalysis;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ColumnMappingResponse {

  @JsonProperty("table_name")
  private String tableName;

  @JsonProperty("domain")
  private String domain;

  @JsonProperty("mapping")
  private ColumnMapping mapping;

  @JsonProperty("validation")
  private ValidationResult validation;

  @JsonProperty("summary")
  private String summary;

  @JsonProperty("profiles")
  private Map<String, ColumnAnalysis> profiles;

  @JsonProperty("processing_metadata")
  private ProcessingMetadata processingMetadata;

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class ProcessingMetadata {

    @JsonProperty("column_count")
    private int columnCount;

    @JsonProperty("row_count")
    private int rowCount;

    @JsonProperty("name_weight")
    private Double nameWeight;

    @JsonProperty("data_weight")
    private Double dataWeight;

    @JsonProperty("processing_time_ms")
    private long processingTimeMs;
  }
}
