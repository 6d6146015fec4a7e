package com.autoinsight.mapper.service.catalog;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.autoinsight.mapper.config.MappingProperties;
import com.autoinsight.mapper.exception.UnknownSchemaDomainException;
import com.autoinsight.mapper.model.catalog.CatalogFieldDefinition;
import com.autoinsight.mapper.model.catalog.SchemaCatalog;
import com.autoinsight.mapper.model.catalog.SchemaDomain;
import com.autoinsight.mapper.model.catalog.StandardField;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads the schema catalogs once at startup and serves them by domain name. The built-in catalogs
 * come from a classpath resource; an optional additional JSON file may contribute new domains but
 * may not redefine built-in ones. Catalogs are immutable, so the registry is safe to share.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SchemaCatalogRegistry {

  private static final TypeReference<Map<String, LinkedHashMap<String, CatalogFieldDefinition>>>
      CATALOG_FILE_TYPE =
          new TypeReference<Map<String, LinkedHashMap<String, CatalogFieldDefinition>>>() {};

  private final ObjectMapper objectMapper;
  private final MappingProperties properties;

  private volatile Map<String, SchemaCatalog> catalogs = Map.of();

  @PostConstruct
  public void init() {
    Map<String, SchemaCatalog> loaded = new LinkedHashMap<>();
    String resource = properties.getCatalog().getResource();

    try (InputStream is = SchemaCatalogRegistry.class.getResourceAsStream(resource)) {
      if (is == null) {
        throw new IllegalStateException("Catalog resource not found: " + resource);
      }
      loaded.putAll(parse(objectMapper.readValue(is, CATALOG_FILE_TYPE)));
    } catch (IOException e) {
      log.error("Failed to load schema catalogs from {}", resource, e);
      throw new IllegalStateException("Failed to initialize schema catalog registry", e);
    }

    for (SchemaDomain domain : SchemaDomain.values()) {
      if (!loaded.containsKey(domain.getCatalogName())) {
        throw new IllegalStateException(
            "Catalog resource " + resource + " lacks built-in domain " + domain.getCatalogName());
      }
    }

    String additional = properties.getCatalog().getAdditionalFile();
    if (additional != null && !additional.isBlank()) {
      loadAdditional(Paths.get(additional), loaded);
    }

    catalogs = Collections.unmodifiableMap(loaded);
    log.info("Loaded {} schema catalogs: {}", catalogs.size(), catalogs.keySet());
  }

  private void loadAdditional(Path file, Map<String, SchemaCatalog> loaded) {
    if (!Files.isRegularFile(file)) {
      log.warn("Additional catalog file {} does not exist, skipping", file);
      return;
    }
    Map<String, SchemaCatalog> extra;
    try (InputStream is = Files.newInputStream(file)) {
      extra = parse(objectMapper.readValue(is, CATALOG_FILE_TYPE));
    } catch (IOException e) {
      log.error("Failed to read additional catalogs from {}", file, e);
      throw new IllegalStateException("Failed to read additional catalogs from " + file, e);
    }
    for (Map.Entry<String, SchemaCatalog> entry : extra.entrySet()) {
      if (loaded.containsKey(entry.getKey())) {
        throw new IllegalStateException(
            "Additional catalog file " + file + " redefines domain '" + entry.getKey() + "'");
      }
      loaded.put(entry.getKey(), entry.getValue());
    }
    log.info("Loaded {} additional catalogs from {}", extra.size(), file);
  }

  private Map<String, SchemaCatalog> parse(
      Map<String, LinkedHashMap<String, CatalogFieldDefinition>> raw) {
    Map<String, SchemaCatalog> parsed = new LinkedHashMap<>();
    raw.forEach(
        (name, definitions) -> {
          String domain = SchemaDomain.normalizeName(name);
          List<StandardField> fields = new ArrayList<>();
          definitions.forEach((field, definition) -> fields.add(definition.toStandardField(field)));
          if (parsed.put(domain, new SchemaCatalog(domain, fields)) != null) {
            throw new IllegalStateException("Catalog domain '" + domain + "' is defined twice");
          }
        });
    return parsed;
  }

  /**
   * Catalog registered under {@code domain}.
   *
   * @throws UnknownSchemaDomainException if no catalog has that name
   */
  public SchemaCatalog getCatalog(String domain) {
    SchemaCatalog catalog =
        domain != null ? catalogs.get(SchemaDomain.normalizeName(domain)) : null;
    if (catalog == null) {
      throw new UnknownSchemaDomainException(domain, catalogs.keySet());
    }
    return catalog;
  }

  public SchemaCatalog getCatalog(SchemaDomain domain) {
    return getCatalog(domain.getCatalogName());
  }

  public List<String> getAvailableDomains() {
    return List.copyOf(catalogs.keySet());
  }

  public List<SchemaCatalog> getCatalogs() {
    return List.copyOf(catalogs.values());
  }
}
