package com.autoinsight.mapper.service.profiling;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.autoinsight.mapper.config.MappingProperties;

@DisplayName("FtaDateDetector Tests")
class FtaDateDetectorTest {

  private FtaDateDetector detector;

  @BeforeEach
  void setUp() {
    detector = new FtaDateDetector(new MappingProperties());
  }

  @Test
  @DisplayName("Should count ISO dates and date-times")
  void shouldCountIsoDates() {
    List<String> sample = List.of("2023-01-15", "2010-12-01 08:26:00", "hello world");

    assertThat(detector.countDates(sample)).isEqualTo(2);
  }

  @Test
  @DisplayName("Should ignore null and blank values")
  void shouldSkipMissingValues() {
    assertThat(detector.countDates(Arrays.asList(null, " ", "2023-01-15"))).isEqualTo(1);
  }

  @Test
  @DisplayName("Should accept locale tags written with underscores")
  void shouldAcceptUnderscoreLocale() {
    MappingProperties properties = new MappingProperties();
    properties.setLocale("ko_KR");

    assertThat(new FtaDateDetector(properties).countDates(List.of("2023-01-15"))).isEqualTo(1);
  }
}
