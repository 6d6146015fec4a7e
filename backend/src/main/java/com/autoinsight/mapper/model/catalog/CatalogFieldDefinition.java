package com.autoinsight.mapper.model.catalog;

import java.util.ArrayList;
import java.util.List;

import com.autoinsight.mapper.model.scoring.TypeTag;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;
import lombok.NoArgsConstructor;

/** One field entry of the catalog JSON, keyed by field name in the enclosing object. */
@Data
@NoArgsConstructor
public class CatalogFieldDefinition {

  @JsonProperty("aliases")
  private List<String> aliases = new ArrayList<>();

  @JsonProperty("semantic_type")
  private TypeTag semanticType;

  @JsonProperty("required")
  private boolean required;

  public StandardField toStandardField(String name) {
    if (semanticType == null) {
      throw new IllegalArgumentException("Field '" + name + "' has no semantic_type");
    }
    return StandardField.builder()
        .name(name)
        .aliases(aliases != null ? aliases : List.of())
        .semanticType(semanticType)
        .required(required)
        .build();
  }
}
