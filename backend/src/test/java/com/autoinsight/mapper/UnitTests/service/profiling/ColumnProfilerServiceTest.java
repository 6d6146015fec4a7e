package com.autoinsight.mapper.service.profiling;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.autoinsight.mapper.config.MappingProperties;
import com.autoinsight.mapper.model.profile.ColumnProfile;
import com.autoinsight.mapper.model.profile.ValueKind;
import com.autoinsight.mapper.model.table.DataTable;

@DisplayName("ColumnProfilerService Tests")
class ColumnProfilerServiceTest {

  private ColumnProfilerService profiler;

  @BeforeEach
  void setUp() {
    profiler = new ColumnProfilerService(new FtaDateDetector(new MappingProperties()));
  }

  @Nested
  @DisplayName("Numeric columns")
  class NumericColumns {

    @Test
    @DisplayName("Should profile integer columns with range and uniqueness")
    void shouldProfileIntegers() {
      ColumnProfile profile = profiler.profile("qty", List.of(6, 6, 8, 3, 2));

      assertThat(profile.isNumeric()).isTrue();
      assertThat(profile.isDateLike()).isFalse();
      assertThat(profile.getValueKind()).isEqualTo(ValueKind.NUMERIC);
      assertThat(profile.getDistinctCount()).isEqualTo(4);
      assertThat(profile.getUniqueRatio()).isEqualTo(0.8);
      assertThat(profile.getNumericRange().getMin()).isEqualTo(2.0);
      assertThat(profile.getNumericRange().getMax()).isEqualTo(8.0);
      assertThat(profile.getNumericRange().getMean()).isCloseTo(5.0, within(1e-9));
      assertThat(profile.getAvgTextLength()).isNull();
    }

    @Test
    @DisplayName("Should treat numeric strings as numbers")
    void shouldParseNumericStrings() {
      ColumnProfile profile = profiler.profile("price", List.of("2.55", " 3.39", "-1e2", ".5"));

      assertThat(profile.isNumeric()).isTrue();
      assertThat(profile.getValueKind()).isEqualTo(ValueKind.TEXT);
      assertThat(profile.getNumericRange().getMin()).isEqualTo(-100.0);
    }

    @Test
    @DisplayName("Should compare numbers by value when counting distinct values")
    void shouldCountNumericDuplicatesByValue() {
      ColumnProfile profile = profiler.profile("n", List.of(1, 1.0, 1L, 2));

      assertThat(profile.getDistinctCount()).isEqualTo(2);
      assertThat(profile.getValueKind()).isEqualTo(ValueKind.NUMERIC);
    }

    @Test
    @DisplayName("Should flag unique numeric columns as identifiers")
    void shouldFlagIds() {
      List<Object> ids = new ArrayList<>();
      for (int i = 0; i < 10; i++) {
        ids.add(1000 + i);
      }

      assertThat(profiler.profile("id", ids).isIdLike()).isTrue();
    }
  }

  @Nested
  @DisplayName("Text and date columns")
  class TextColumns {

    @Test
    @DisplayName("Should detect ISO dates")
    void shouldDetectDates() {
      List<Object> dates = new ArrayList<>();
      for (int day = 1; day <= 10; day++) {
        dates.add(String.format("2023-01-%02d", day));
      }

      ColumnProfile profile = profiler.profile("order_date", dates);

      assertThat(profile.isDateLike()).isTrue();
      assertThat(profile.isNumeric()).isFalse();
      assertThat(profile.isIdLike()).isTrue();
      assertThat(profile.getAvgTextLength()).isEqualTo(10.0);
    }

    @Test
    @DisplayName("Should not flag free text as dates")
    void shouldNotFlagTextAsDate() {
      ColumnProfile profile =
          profiler.profile(
              "comment", List.of("great product", "would buy again", "arrived broken"));

      assertThat(profile.isDateLike()).isFalse();
      assertThat(profile.isNumeric()).isFalse();
      assertThat(profile.getAvgTextLength()).isCloseTo(14.0, within(1e-9));
    }

    @Test
    @DisplayName("Should only sample the leading values for date detection")
    void shouldSampleLeadingValues() {
      List<Object> values = new ArrayList<>();
      for (int day = 1; day <= 10; day++) {
        values.add(String.format("2023-01-%02d", day));
      }
      for (int i = 0; i < 20; i++) {
        values.add("not a date " + i);
      }

      assertThat(profiler.profile("mixed", values).isDateLike()).isTrue();
    }

    @Test
    @DisplayName("Should measure text length in code points")
    void shouldMeasureKoreanText() {
      ColumnProfile profile = profiler.profile("리뷰", List.of("좋아요", "별로예요"));

      assertThat(profile.getAvgTextLength()).isEqualTo(3.5);
    }

    @Test
    @DisplayName("Should mark mixed kinds as mixed but not numeric")
    void shouldReportMixedValues() {
      ColumnProfile profile = profiler.profile("misc", List.of(1, "two", 3.0));

      assertThat(profile.getValueKind()).isEqualTo(ValueKind.MIXED);
      assertThat(profile.isNumeric()).isFalse();
    }
  }

  @Nested
  @DisplayName("Degenerate columns")
  class DegenerateColumns {

    @Test
    @DisplayName("Should return an empty profile for an empty column")
    void shouldHandleEmptyColumn() {
      ColumnProfile profile = profiler.profile("empty", List.of());

      assertThat(profile.getRowCount()).isZero();
      assertThat(profile.getUniqueRatio()).isZero();
      assertThat(profile.getMissingRatio()).isZero();
      assertThat(profile.getValueKind()).isEqualTo(ValueKind.EMPTY);
    }

    @Test
    @DisplayName("Should treat null, blank and NaN cells as missing")
    void shouldHandleAllMissing() {
      ColumnProfile profile = profiler.profile("blank", Arrays.asList(null, "", "  ", Double.NaN));

      assertThat(profile.getMissingCount()).isEqualTo(4);
      assertThat(profile.getMissingRatio()).isEqualTo(1.0);
      assertThat(profile.isNumeric()).isFalse();
      assertThat(profile.isDateLike()).isFalse();
      assertThat(profile.isIdLike()).isFalse();
      assertThat(profile.getNumericRange()).isNull();
      assertThat(profile.getAvgTextLength()).isNull();
    }

    @Test
    @DisplayName("Should count ratios over the full column including missing cells")
    void shouldUseRowCountAsDenominator() {
      ColumnProfile profile = profiler.profile("sparse", Arrays.asList(1, 2, null, null));

      assertThat(profile.getUniqueRatio()).isEqualTo(0.5);
      assertThat(profile.getMissingRatio()).isEqualTo(0.5);
      assertThat(profile.isNumeric()).isTrue();
    }

    @Test
    @DisplayName("Should handle a single value")
    void shouldHandleSingleValue() {
      ColumnProfile profile = profiler.profile("one", List.of("x"));

      assertThat(profile.getUniqueRatio()).isEqualTo(1.0);
      assertThat(profile.isIdLike()).isTrue();
    }
  }

  @Test
  @DisplayName("Should profile a column of a table without modifying it")
  void shouldProfileTableColumn() {
    Map<String, List<Object>> columns = new LinkedHashMap<>();
    columns.put("qty", List.of(1, 2, 3));
    DataTable table = DataTable.fromColumns(columns);

    ColumnProfile profile = profiler.profile(table, "qty");

    assertThat(profile.getColumnName()).isEqualTo("qty");
    assertThat(table.getColumn("qty")).containsExactly(1, 2, 3);
  }
}
