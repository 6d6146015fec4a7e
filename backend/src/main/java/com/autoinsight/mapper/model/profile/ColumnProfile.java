package com.autoinsight.mapper.model.profile;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

/**
 * Statistical and type profile of a single column. Derived data only: building one never touches
 * the table it was computed from, and no profile depends on another column.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Statistical and type profile of one column")
public class ColumnProfile {

  @JsonProperty("column_name")
  String columnName;

  @JsonProperty("row_count")
  int rowCount;

  @JsonProperty("dtype")
  ValueKind valueKind;

  @JsonProperty("missing_count")
  int missingCount;

  @JsonProperty("distinct_count")
  int distinctCount;

  @Schema(description = "Distinct non-missing values divided by row count", example = "0.95")
  @JsonProperty("unique_ratio")
  double uniqueRatio;

  @JsonProperty("missing_ratio")
  double missingRatio;

  @Schema(description = "At least 70% of the sampled values parse as calendar dates")
  @JsonProperty("is_date")
  boolean dateLike;

  @JsonProperty("is_numeric")
  boolean numeric;

  @Schema(description = "Unique ratio reaches the identifier threshold (0.9)")
  @JsonProperty("is_id")
  boolean idLike;

  @Schema(description = "Min, max and mean of the values; present only for numeric columns")
  @JsonProperty("numeric_range")
  NumericRange numericRange;

  @Schema(description = "Mean string length of the date-detection sample (non-numeric only)")
  @JsonProperty("avg_text_length")
  Double avgTextLength;

  /** Profile of a column with no usable values; every flag false, every optional absent. */
  public static ColumnProfile empty(String columnName, int rowCount) {
    return ColumnProfile.builder()
        .columnName(columnName)
        .rowCount(rowCount)
        .valueKind(ValueKind.EMPTY)
        .missingCount(rowCount)
        .missingRatio(rowCount > 0 ? 1.0 : 0.0)
        .build();
  }
}
