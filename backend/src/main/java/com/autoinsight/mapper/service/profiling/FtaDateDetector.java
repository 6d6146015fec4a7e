package com.autoinsight.mapper.service.profiling;

import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Component;

import com.autoinsight.mapper.config.MappingProperties;
import com.cobber.fta.dates.DateTimeParser;
import com.cobber.fta.dates.DateTimeParser.DateResolutionMode;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Date detection backed by FTA's format inference: a value counts as a date when FTA can derive a
 * date or date-time format string for it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FtaDateDetector implements DateDetector {

  private final MappingProperties properties;

  @Override
  public int countDates(List<String> sample) {
    // DateTimeParser keeps per-instance state, so each sample gets its own parser
    DateTimeParser parser =
        new DateTimeParser()
            .withDateResolutionMode(DateResolutionMode.Auto)
            .withLocale(resolveLocale());

    int hits = 0;
    for (String value : sample) {
      if (value == null || value.isBlank()) {
        continue;
      }
      try {
        if (parser.determineFormatString(value.trim()) != null) {
          hits++;
        }
      } catch (RuntimeException e) {
        log.debug("Date format detection failed for '{}': {}", value, e.getMessage());
      }
    }
    return hits;
  }

  private Locale resolveLocale() {
    String tag = properties.getLocale() != null ? properties.getLocale() : "en-US";
    return Locale.forLanguageTag(tag.replace('_', '-'));
  }
}
