package com.autoinsight.mapper.model.mapping;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Final mapping from standard field name to the selected user column. Entries follow catalog
 * field order and no user column appears twice.
 */
@Getter
@ToString
@EqualsAndHashCode
@Schema(description = "Final mapping of standard fields to user columns")
public final class ColumnMapping {

  @JsonProperty("domain")
  private final String domain;

  @JsonProperty("method")
  private final MappingMethod method;

  @JsonProperty("fields")
  private final Map<String, FieldMapping> fields;

  @Schema(description = "Fields whose every candidate column was claimed by another field")
  @JsonProperty("unresolved")
  private final Map<String, List<MappingCandidate>> unresolved;

  public ColumnMapping(
      String domain,
      MappingMethod method,
      Map<String, FieldMapping> fields,
      Map<String, List<MappingCandidate>> unresolved) {
    Map<String, String> seen = new LinkedHashMap<>();
    for (FieldMapping mapping : fields.values()) {
      String previous = seen.put(mapping.getUserColumn(), mapping.getStandardField());
      if (previous != null) {
        throw new IllegalArgumentException(
            String.format(
                "Column '%s' assigned to both '%s' and '%s'",
                mapping.getUserColumn(), previous, mapping.getStandardField()));
      }
    }
    this.domain = domain;
    this.method = method;
    this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    this.unresolved = Collections.unmodifiableMap(new LinkedHashMap<>(unresolved));
  }

  public Optional<FieldMapping> get(String standardField) {
    return Optional.ofNullable(fields.get(standardField));
  }

  public boolean contains(String standardField) {
    return fields.containsKey(standardField);
  }

  public int size() {
    return fields.size();
  }

  @JsonIgnore
  public boolean isEmpty() {
    return fields.isEmpty();
  }

  /** User column to standard field, in catalog field order. */
  @JsonIgnore
  public Map<String, String> getColumnRenames() {
    Map<String, String> renames = new LinkedHashMap<>();
    fields.values().forEach(m -> renames.put(m.getUserColumn(), m.getStandardField()));
    return renames;
  }
}
