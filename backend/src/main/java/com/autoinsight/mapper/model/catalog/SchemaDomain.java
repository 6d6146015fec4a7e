package com.autoinsight.mapper.model.catalog;

import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Built-in analysis domains. Each names a catalog that ships in the catalog resource; further
 * domains can be loaded from configuration and are looked up by name only.
 */
public enum SchemaDomain {
  /** Transactions feeding RFM segmentation. */
  ECOMMERCE("ecommerce"),
  /** Customer reviews feeding sentiment analysis. */
  REVIEW("review"),
  /** Sales records feeding trend analysis. */
  SALES("sales");

  private final String catalogName;

  SchemaDomain(String catalogName) {
    this.catalogName = catalogName;
  }

  @JsonValue
  public String getCatalogName() {
    return catalogName;
  }

  /** Domain names are matched ignoring case and surrounding whitespace. */
  public static String normalizeName(String name) {
    return name == null ? null : name.trim().toLowerCase(Locale.ROOT);
  }

  public static Optional<SchemaDomain> fromCatalogName(String name) {
    if (name == null) {
      return Optional.empty();
    }
    String normalized = normalizeName(name);
    for (SchemaDomain domain : values()) {
      if (domain.catalogName.equals(normalized)) {
        return Optional.of(domain);
      }
    }
    return Optional.empty();
  }
}
