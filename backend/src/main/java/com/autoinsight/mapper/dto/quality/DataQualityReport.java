package com.autoinsight.mapper.dto.quality;

import java.util.List;

import com.autoinsight.mapper.model.profile.ValueKind;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Completeness and duplication overview of a table")
public class DataQualityReport {

  @JsonProperty("total_rows")
  private int totalRows;

  @JsonProperty("total_columns")
  private int totalColumns;

  @JsonProperty("missing_cells")
  private long missingCells;

  @Schema(description = "Missing cells as a percentage of all cells", example = "2.5")
  @JsonProperty("missing_percentage")
  private double missingPercentage;

  @JsonProperty("duplicate_rows")
  private int duplicateRows;

  @JsonProperty("columns")
  private List<ColumnQuality> columns;

  @JsonProperty("date_columns")
  private List<String> dateColumns;

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class ColumnQuality {

    @JsonProperty("column_name")
    private String columnName;

    @JsonProperty("dtype")
    private ValueKind dtype;

    @JsonProperty("missing_count")
    private int missingCount;

    @JsonProperty("missing_percentage")
    private double missingPercentage;

    @JsonProperty("unique_count")
    private int uniqueCount;

    @JsonProperty("unique_percentage")
    private double uniquePercentage;
  }
}
