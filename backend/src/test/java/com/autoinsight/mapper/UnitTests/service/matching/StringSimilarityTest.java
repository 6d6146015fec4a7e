package com.autoinsight.mapper.service.matching;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("StringSimilarity Tests")
class StringSimilarityTest {

  @Test
  @DisplayName("Should lower-case and strip separators")
  void shouldNormalize() {
    assertThat(StringSimilarity.normalize("Customer_ID")).isEqualTo("customerid");
    assertThat(StringSimilarity.normalize(" Unit-Price ")).isEqualTo("unitprice");
    assertThat(StringSimilarity.normalize("고객 ID")).isEqualTo("고객id");
    assertThat(StringSimilarity.normalize(null)).isEmpty();
  }

  @Test
  @DisplayName("Should score identical strings 100 and disjoint strings 0")
  void shouldScoreExtremes() {
    assertThat(StringSimilarity.ratio("quantity", "quantity")).isEqualTo(100);
    assertThat(StringSimilarity.ratio("abc", "xyz")).isZero();
    assertThat(StringSimilarity.ratio("", "")).isEqualTo(100);
    assertThat(StringSimilarity.ratio("abc", "")).isZero();
  }

  @Test
  @DisplayName("Should score partial overlap by common subsequence")
  void shouldScorePartialOverlap() {
    // "star" is a subsequence of "stars": 2 * 4 / 9
    assertThat(StringSimilarity.ratio("stars", "star")).isEqualTo(89);
    assertThat(StringSimilarity.longestCommonSubsequence("unitprice", "quantity")).isEqualTo(4);
  }

  @Test
  @DisplayName("Should be symmetric")
  void shouldBeSymmetric() {
    assertThat(StringSimilarity.ratio("invoicedate", "orderdate"))
        .isEqualTo(StringSimilarity.ratio("orderdate", "invoicedate"));
  }
}
