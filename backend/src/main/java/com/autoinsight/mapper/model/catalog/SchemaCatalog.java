package com.autoinsight.mapper.model.catalog;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable table of standard fields for one analysis domain. Field order is significant: it is
 * the tie-break order during conflict resolution and the column order of mapped tables.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class SchemaCatalog {

  @JsonProperty("name")
  private final String name;

  @JsonProperty("fields")
  private final List<StandardField> fields;

  @JsonIgnore @ToString.Exclude
  private final transient Map<String, StandardField> fieldsByName;

  public SchemaCatalog(String name, List<StandardField> fields) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Catalog name must not be blank");
    }
    if (fields == null || fields.isEmpty()) {
      throw new IllegalArgumentException("Catalog '" + name + "' defines no fields");
    }
    Map<String, StandardField> byName = new LinkedHashMap<>();
    for (StandardField field : fields) {
      if (field.getAliases().isEmpty()) {
        throw new IllegalArgumentException(
            "Field '" + field.getName() + "' of catalog '" + name + "' has no aliases");
      }
      if (byName.put(field.getName(), field) != null) {
        throw new IllegalArgumentException(
            "Catalog '" + name + "' defines field '" + field.getName() + "' twice");
      }
    }
    this.name = name;
    this.fields = List.copyOf(fields);
    this.fieldsByName = byName;
  }

  public Optional<StandardField> findField(String fieldName) {
    return Optional.ofNullable(fieldsByName.get(fieldName));
  }

  public int indexOf(String fieldName) {
    for (int i = 0; i < fields.size(); i++) {
      if (fields.get(i).getName().equals(fieldName)) {
        return i;
      }
    }
    return -1;
  }

  @JsonIgnore
  public List<StandardField> getRequiredFields() {
    return fields.stream().filter(StandardField::isRequired).collect(Collectors.toList());
  }
}
