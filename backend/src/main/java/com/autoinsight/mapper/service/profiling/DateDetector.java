package com.autoinsight.mapper.service.profiling;

import java.util.List;

/** Decides which raw cell values look like calendar dates. */
public interface DateDetector {

  /**
   * Counts the values of {@code sample} that parse as a date. Values that cannot be examined count
   * as non-dates; implementations must not throw for odd input.
   */
  int countDates(List<String> sample);
}
