package com.autoinsight.mapper.service.scoring;

import org.springframework.stereotype.Service;

import com.autoinsight.mapper.model.profile.ColumnProfile;
import com.autoinsight.mapper.model.profile.NumericRange;
import com.autoinsight.mapper.model.scoring.TypeScores;
import com.autoinsight.mapper.model.scoring.TypeTag;

/**
 * Turns a column profile into per-type confidences. The rules form a fixed table: a date column
 * never scores as numeric or text, and a numeric column never scores as text.
 */
@Service
public class TypeScorerService {

  static final double RATING_MIN = 0;
  static final double RATING_MAX = 10;

  static final int LONG_TEXT_LENGTH = 50;
  static final int MEDIUM_TEXT_LENGTH = 20;

  public TypeScores score(ColumnProfile profile) {
    if (profile.isDateLike()) {
      return TypeScores.builder()
          .score(TypeTag.DATE, 90)
          .score(TypeTag.ID, profile.isIdLike() ? 30 : 0)
          .build();
    }

    if (profile.isNumeric()) {
      NumericRange range = profile.getNumericRange();
      boolean ratingRange = range != null && range.within(RATING_MIN, RATING_MAX);
      return TypeScores.builder()
          .score(TypeTag.NUMERIC, 80)
          .score(TypeTag.RATING, ratingRange ? 70 : 0)
          .score(TypeTag.ID, profile.isIdLike() ? 80 : (int) (profile.getUniqueRatio() * 50))
          .build();
    }

    return TypeScores.builder()
        .score(TypeTag.ID, profile.isIdLike() ? 70 : (int) (profile.getUniqueRatio() * 30))
        .score(TypeTag.TEXT, textScore(profile.getAvgTextLength()))
        .build();
  }

  private int textScore(Double avgTextLength) {
    if (avgTextLength == null) {
      return 0;
    }
    if (avgTextLength >= LONG_TEXT_LENGTH) {
      return 80;
    }
    return avgTextLength >= MEDIUM_TEXT_LENGTH ? 60 : 30;
  }
}
