package com.autoinsight.mapper.model.scoring;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Confidence per {@link TypeTag} on a 0-100 scale for one column. Tags never set read as zero.
 */
public final class TypeScores {

  private static final TypeScores EMPTY = new TypeScores(new EnumMap<>(TypeTag.class));

  private final Map<TypeTag, Integer> scores;

  private TypeScores(EnumMap<TypeTag, Integer> scores) {
    for (TypeTag tag : TypeTag.values()) {
      scores.putIfAbsent(tag, 0);
    }
    this.scores = Collections.unmodifiableMap(scores);
  }

  public static TypeScores empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  public int get(TypeTag tag) {
    return scores.get(tag);
  }

  /** Highest scoring tag; ties go to the tag declared first. */
  public TypeTag best() {
    TypeTag best = TypeTag.ID;
    for (TypeTag tag : TypeTag.values()) {
      if (scores.get(tag) > scores.get(best)) {
        best = tag;
      }
    }
    return best;
  }

  @JsonValue
  public Map<String, Integer> asMap() {
    Map<String, Integer> view = new LinkedHashMap<>();
    scores.forEach((tag, score) -> view.put(tag.getValue(), score));
    return view;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof TypeScores)) {
      return false;
    }
    return scores.equals(((TypeScores) other).scores);
  }

  @Override
  public int hashCode() {
    return scores.hashCode();
  }

  @Override
  public String toString() {
    return "TypeScores" + asMap();
  }

  public static final class Builder {
    private final EnumMap<TypeTag, Integer> scores = new EnumMap<>(TypeTag.class);

    private Builder() {}

    public Builder score(TypeTag tag, int score) {
      if (score < 0 || score > 100) {
        throw new IllegalArgumentException("Score out of range 0-100: " + score);
      }
      scores.put(tag, score);
      return this;
    }

    public TypeScores build() {
      return new TypeScores(new EnumMap<>(scores));
    }
  }
}
