package com.autoinsight.mapper.model.mapping;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Value;

/** Outcome of checking a mapping against its catalog's required fields. */
@Value
@Schema(description = "Required-field validation of a mapping")
public class ValidationResult {

  private static final ValidationResult OK = new ValidationResult(true, List.of(), List.of());

  @JsonProperty("is_valid")
  boolean valid;

  @JsonProperty("messages")
  List<String> messages;

  @JsonProperty("missing_fields")
  List<String> missingFields;

  public static ValidationResult ok() {
    return OK;
  }

  public static ValidationResult missing(List<String> missingFields, List<String> messages) {
    return new ValidationResult(false, List.copyOf(messages), List.copyOf(missingFields));
  }
}
