package com.autoinsight.mapper.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "mapping")
public class MappingProperties {

  private double nameWeight = 0.6;
  private double dataWeight = 0.4;

  /** Column count above which hybrid mapping logs a slow-profiling warning. */
  private int maxColumns = 200;

  /** Locale used to resolve ambiguous day/month ordering during date detection. */
  private String locale = "en-US";

  private Catalog catalog = new Catalog();

  @Data
  public static class Catalog {
    private String resource = "/catalogs/schema-catalogs.json";
    private String additionalFile;
  }
}
