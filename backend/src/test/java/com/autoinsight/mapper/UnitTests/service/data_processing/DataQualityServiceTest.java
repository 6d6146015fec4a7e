package com.autoinsight.mapper.service.data_processing;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.autoinsight.mapper.dto.quality.DataQualityReport;
import com.autoinsight.mapper.fixtures.MappingFixtures;
import com.autoinsight.mapper.model.profile.ValueKind;
import com.autoinsight.mapper.model.table.DataTable;

@DisplayName("DataQualityService Tests")
class DataQualityServiceTest {

  private DataQualityService dataQualityService;

  @BeforeEach
  void setUp() {
    dataQualityService = new DataQualityService(MappingFixtures.columnProfiler());
  }

  @Test
  @DisplayName("Should count missing cells, duplicates and date columns")
  void shouldReportQuality() {
    Map<String, List<Object>> columns = new LinkedHashMap<>();
    columns.put("order_date", List.of("2023-01-01", "2023-01-02", "2023-01-01", "2023-01-03"));
    columns.put("qty", Arrays.asList(1, 2, 1, null));
    DataTable table = DataTable.fromColumns(columns);

    DataQualityReport report = dataQualityService.report(table);

    assertThat(report.getTotalRows()).isEqualTo(4);
    assertThat(report.getTotalColumns()).isEqualTo(2);
    assertThat(report.getMissingCells()).isEqualTo(1);
    assertThat(report.getMissingPercentage()).isEqualTo(12.5);
    assertThat(report.getDuplicateRows()).isEqualTo(1);
    assertThat(report.getDateColumns()).containsExactly("order_date");

    DataQualityReport.ColumnQuality qty = report.getColumns().get(1);
    assertThat(qty.getColumnName()).isEqualTo("qty");
    assertThat(qty.getDtype()).isEqualTo(ValueKind.NUMERIC);
    assertThat(qty.getMissingPercentage()).isEqualTo(25.0);
    assertThat(qty.getUniqueCount()).isEqualTo(2);
    assertThat(qty.getUniquePercentage()).isEqualTo(50.0);
  }

  @Test
  @DisplayName("Should treat numerically equal rows as duplicates")
  void shouldCompareNumbersByValue() {
    Map<String, List<Object>> columns = new LinkedHashMap<>();
    columns.put("a", List.of(1, 1.0, 2));
    DataTable table = DataTable.fromColumns(columns);

    assertThat(dataQualityService.countDuplicateRows(table)).isEqualTo(1);
  }

  @Test
  @DisplayName("Should report zero percentages for an empty table")
  void shouldHandleEmptyTable() {
    Map<String, List<Object>> columns = new LinkedHashMap<>();
    columns.put("a", List.of());

    DataQualityReport report = dataQualityService.report(DataTable.fromColumns(columns));

    assertThat(report.getTotalRows()).isZero();
    assertThat(report.getMissingPercentage()).isZero();
    assertThat(report.getColumns().get(0).getMissingPercentage()).isZero();
  }
}
