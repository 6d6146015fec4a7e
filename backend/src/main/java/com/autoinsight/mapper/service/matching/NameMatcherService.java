package com.autoinsight.mapper.service.matching;

import org.springframework.stereotype.Service;

import com.autoinsight.mapper.model.catalog.SchemaCatalog;
import com.autoinsight.mapper.model.catalog.StandardField;
import com.autoinsight.mapper.model.mapping.NameMatch;

import lombok.extern.slf4j.Slf4j;

/** Matches user column names against catalog aliases. Looks at names only, never at data. */
@Slf4j
@Service
public class NameMatcherService {

  public static final int MIN_MATCH_SCORE = 50;

  /** Similarity of two raw names after normalisation, 0-100. */
  public int similarity(String a, String b) {
    return StringSimilarity.ratio(StringSimilarity.normalize(a), StringSimilarity.normalize(b));
  }

  /** Best alias score of {@code field} for {@code columnName}. */
  public int fieldScore(String columnName, StandardField field) {
    String normalized = StringSimilarity.normalize(columnName);
    int best = 0;
    for (String alias : field.getAliases()) {
      int score = StringSimilarity.ratio(normalized, StringSimilarity.normalize(alias));
      if (score > best) {
        best = score;
        if (best == 100) {
          break;
        }
      }
    }
    return best;
  }

  /**
   * Best field of {@code catalog} for {@code columnName}. Ties keep the field declared first.
   * Scores under {@value #MIN_MATCH_SCORE} report no match.
   */
  public NameMatch bestMatch(String columnName, SchemaCatalog catalog) {
    StandardField bestField = null;
    int bestScore = 0;
    for (StandardField field : catalog.getFields()) {
      int score = fieldScore(columnName, field);
      if (score > bestScore) {
        bestField = field;
        bestScore = score;
      }
    }

    if (bestField == null || bestScore < MIN_MATCH_SCORE) {
      log.debug("No field of '{}' matches column '{}'", catalog.getName(), columnName);
      return NameMatch.none();
    }
    return new NameMatch(bestField.getName(), bestScore);
  }
}
