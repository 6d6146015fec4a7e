package com.autoinsight.mapper.service.data_processing;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.autoinsight.mapper.dto.quality.DataQualityReport;
import com.autoinsight.mapper.model.profile.ColumnProfile;
import com.autoinsight.mapper.model.table.DataTable;
import com.autoinsight.mapper.service.profiling.ColumnProfilerService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Summarises completeness, duplication and detected date columns of a table. */
@Slf4j
@Service
@RequiredArgsConstructor
public class DataQualityService {

  private final ColumnProfilerService columnProfiler;

  public DataQualityReport report(DataTable table) {
    int rows = table.getRowCount();
    long missingCells = 0;
    List<DataQualityReport.ColumnQuality> columns = new ArrayList<>();
    List<String> dateColumns = new ArrayList<>();

    for (String column : table.getColumnNames()) {
      ColumnProfile profile = columnProfiler.profile(table, column);
      missingCells += profile.getMissingCount();
      if (profile.isDateLike()) {
        dateColumns.add(column);
      }
      columns.add(
          DataQualityReport.ColumnQuality.builder()
              .columnName(column)
              .dtype(profile.getValueKind())
              .missingCount(profile.getMissingCount())
              .missingPercentage(percentage(profile.getMissingCount(), rows))
              .uniqueCount(profile.getDistinctCount())
              .uniquePercentage(percentage(profile.getDistinctCount(), rows))
              .build());
    }

    long totalCells = (long) rows * table.getColumnCount();
    DataQualityReport report =
        DataQualityReport.builder()
            .totalRows(rows)
            .totalColumns(table.getColumnCount())
            .missingCells(missingCells)
            .missingPercentage(percentage(missingCells, totalCells))
            .duplicateRows(countDuplicateRows(table))
            .columns(columns)
            .dateColumns(dateColumns)
            .build();
    log.debug(
        "Quality report: {} rows, {} missing cells, {} duplicate rows",
        rows,
        missingCells,
        report.getDuplicateRows());
    return report;
  }

  /** Rows identical to an earlier row. Numbers compare by value, so 1 and 1.0 are equal. */
  int countDuplicateRows(DataTable table) {
    Set<List<Object>> seen = new HashSet<>();
    int duplicates = 0;
    for (int i = 0; i < table.getRowCount(); i++) {
      List<Object> key = new ArrayList<>();
      for (Object value : table.getRow(i)) {
        key.add(value instanceof Number ? (Object) ((Number) value).doubleValue() : value);
      }
      if (!seen.add(key)) {
        duplicates++;
      }
    }
    return duplicates;
  }

  private static double percentage(long part, long whole) {
    if (whole == 0) {
      return 0.0;
    }
    return Math.round(part * 10000.0 / whole) / 100.0;
  }
}
