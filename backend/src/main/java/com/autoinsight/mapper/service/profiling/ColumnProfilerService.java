package com.autoinsight.mapper.service.profiling;

import java.util.ArrayList;
import java.util.DoubleSummaryStatistics;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import org.springframework.stereotype.Service;

import com.autoinsight.mapper.model.profile.ColumnProfile;
import com.autoinsight.mapper.model.profile.NumericRange;
import com.autoinsight.mapper.model.profile.ValueKind;
import com.autoinsight.mapper.model.table.DataTable;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds a {@link ColumnProfile} from the raw values of one column.
 *
 * <p>Unique and missing ratios are exact over the whole column because they gate identifier
 * detection. Date detection, by contrast, only inspects the first {@value #DATE_SAMPLE_SIZE}
 * non-missing values: parsing every cell of a wide upload is too slow, and a short prefix is
 * enough to tell a date column from free text. A column whose first values are dates but whose
 * tail is not will still be reported as a date.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ColumnProfilerService {

  public static final int DATE_SAMPLE_SIZE = 10;
  public static final double DATE_PARSE_RATIO_THRESHOLD = 0.7;
  public static final double ID_UNIQUE_RATIO_THRESHOLD = 0.9;

  private static final Pattern DECIMAL =
      Pattern.compile("[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?");

  private final DateDetector dateDetector;

  public ColumnProfile profile(DataTable table, String columnName) {
    return profile(columnName, table.getColumn(columnName));
  }

  public ColumnProfile profile(String columnName, List<?> values) {
    int rowCount = values.size();
    List<Object> present = new ArrayList<>(rowCount);
    for (Object value : values) {
      if (!isMissing(value)) {
        present.add(value);
      }
    }

    if (present.isEmpty()) {
      log.debug("Column '{}' has no non-missing values", columnName);
      return ColumnProfile.empty(columnName, rowCount);
    }

    Set<Object> distinct = new HashSet<>();
    for (Object value : present) {
      distinct.add(distinctKey(value));
    }

    double uniqueRatio = (double) distinct.size() / rowCount;
    int missingCount = rowCount - present.size();

    ColumnProfile.ColumnProfileBuilder builder =
        ColumnProfile.builder()
            .columnName(columnName)
            .rowCount(rowCount)
            .valueKind(valueKind(present))
            .missingCount(missingCount)
            .distinctCount(distinct.size())
            .uniqueRatio(uniqueRatio)
            .missingRatio((double) missingCount / rowCount)
            .idLike(uniqueRatio >= ID_UNIQUE_RATIO_THRESHOLD);

    NumericRange range = numericRange(present);
    if (range != null) {
      return builder.numeric(true).numericRange(range).build();
    }

    List<String> sample = new ArrayList<>(DATE_SAMPLE_SIZE);
    for (Object value : present.subList(0, Math.min(DATE_SAMPLE_SIZE, present.size()))) {
      sample.add(String.valueOf(value));
    }

    int dateHits = dateDetector.countDates(sample);
    boolean dateLike = (double) dateHits / sample.size() >= DATE_PARSE_RATIO_THRESHOLD;
    if (dateLike) {
      log.debug(
          "Column '{}' detected as date ({}/{} sampled values parsed)",
          columnName,
          dateHits,
          sample.size());
    }

    long totalLength = 0;
    for (String value : sample) {
      totalLength += value.codePointCount(0, value.length());
    }

    return builder
        .dateLike(dateLike)
        .avgTextLength((double) totalLength / sample.size())
        .build();
  }

  static boolean isMissing(Object value) {
    if (value == null) {
      return true;
    }
    if (value instanceof String) {
      return ((String) value).isBlank();
    }
    if (value instanceof Double) {
      return ((Double) value).isNaN();
    }
    if (value instanceof Float) {
      return ((Float) value).isNaN();
    }
    return false;
  }

  /** Finite numeric reading of a cell, or {@code null} when the cell is not a number. */
  static Double toNumber(Object value) {
    if (value instanceof Number) {
      double number = ((Number) value).doubleValue();
      return Double.isFinite(number) ? number : null;
    }
    if (value instanceof String) {
      String text = ((String) value).trim();
      if (DECIMAL.matcher(text).matches()) {
        double number = Double.parseDouble(text);
        return Double.isFinite(number) ? number : null;
      }
    }
    return null;
  }

  private NumericRange numericRange(List<Object> present) {
    DoubleSummaryStatistics stats = new DoubleSummaryStatistics();
    for (Object value : present) {
      Double number = toNumber(value);
      if (number == null) {
        return null;
      }
      stats.accept(number);
    }
    return new NumericRange(stats.getMin(), stats.getMax(), stats.getAverage());
  }

  private Object distinctKey(Object value) {
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    return value;
  }

  private ValueKind valueKind(List<Object> present) {
    boolean allNumbers = true;
    boolean allStrings = true;
    for (Object value : present) {
      allNumbers &= value instanceof Number;
      allStrings &= value instanceof String;
    }
    if (allNumbers) {
      return ValueKind.NUMERIC;
    }
    return allStrings ? ValueKind.TEXT : ValueKind.MIXED;
  }
}
