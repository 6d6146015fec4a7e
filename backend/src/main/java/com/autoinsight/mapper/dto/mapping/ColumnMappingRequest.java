package com.autoinsight.mapper.dto.mapping;

import java.util.List;
import java.util.Map;

import com.autoinsight.mapper.model.table.DataTable;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Table to map onto a schema catalog")
public class ColumnMappingRequest {

  @JsonProperty("table_name")
  private String tableName;

  @NotNull
  @NotEmpty
  @JsonProperty("columns")
  private List<String> columns;

  @Schema(description = "Row objects keyed by column name; may be empty for name_only mode")
  @JsonProperty("data")
  private List<Map<String, Object>> data;

  @Schema(description = "hybrid (default) or name_only", example = "hybrid")
  @JsonProperty("mode")
  private String mode;

  @DecimalMin("0.0")
  @JsonProperty("name_weight")
  private Double nameWeight;

  @DecimalMin("0.0")
  @JsonProperty("data_weight")
  private Double dataWeight;

  @Schema(description = "Include per-column profiles and type scores in the response")
  @JsonProperty("include_profiles")
  private Boolean includeProfiles;

  public DataTable toDataTable() {
    return DataTable.fromRows(columns, data != null ? data : List.of());
  }
}
