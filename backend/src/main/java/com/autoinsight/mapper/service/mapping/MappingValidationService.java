package com.autoinsight.mapper.service.mapping;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Service;

import com.autoinsight.mapper.model.catalog.SchemaCatalog;
import com.autoinsight.mapper.model.catalog.StandardField;
import com.autoinsight.mapper.model.mapping.ColumnMapping;
import com.autoinsight.mapper.model.mapping.FieldMapping;
import com.autoinsight.mapper.model.mapping.ValidationResult;

import lombok.extern.slf4j.Slf4j;

/** Checks mappings against their catalog and renders them for people. Never throws for data. */
@Slf4j
@Service
public class MappingValidationService {

  public ValidationResult validate(ColumnMapping mapping, SchemaCatalog catalog) {
    List<String> missing = missingRequiredFields(mapping, catalog);
    if (missing.isEmpty()) {
      return ValidationResult.ok();
    }

    List<String> messages = new ArrayList<>(missing.size());
    for (String field : missing) {
      messages.add("Required field '" + field + "' is not mapped to any column");
    }
    log.info("Mapping for '{}' is missing required fields {}", catalog.getName(), missing);
    return ValidationResult.missing(missing, messages);
  }

  /** Required fields of {@code catalog} that {@code mapping} does not cover, in catalog order. */
  public List<String> missingRequiredFields(ColumnMapping mapping, SchemaCatalog catalog) {
    List<String> missing = new ArrayList<>();
    for (StandardField field : catalog.getRequiredFields()) {
      if (!mapping.contains(field.getName())) {
        missing.add(field.getName());
      }
    }
    return missing;
  }

  /** Multi-line text listing each mapped field with its column and confidence. */
  public String summarize(ColumnMapping mapping, SchemaCatalog catalog) {
    StringBuilder summary = new StringBuilder();
    summary.append("Domain: ").append(catalog.getName()).append('\n');
    summary
        .append("Mapped ")
        .append(mapping.size())
        .append('/')
        .append(catalog.getFields().size())
        .append(" fields (")
        .append(mapping.getMethod().getValue())
        .append(")\n");

    for (FieldMapping field : mapping.getFields().values()) {
      summary.append(
          String.format(
              Locale.ROOT,
              "  %s <- %s (%.1f%%, %s)\n",
              field.getStandardField(),
              field.getUserColumn(),
              field.getConfidence(),
              field.getConfidenceLevel().getValue()));
    }

    List<String> missing = missingRequiredFields(mapping, catalog);
    if (!missing.isEmpty()) {
      summary.append("Warning: required fields not mapped: ").append(String.join(", ", missing));
      summary.append('\n');
    }
    return summary.toString();
  }
}
