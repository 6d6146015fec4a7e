package com.autoinsight.mapper.service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.autoinsight.mapper.config.MappingProperties;
import com.autoinsight.mapper.dto.mapping.ApplyMappingResponse;
import com.autoinsight.mapper.dto.mapping.CatalogDescription;
import com.autoinsight.mapper.dto.mapping.ColumnMappingRequest;
import com.autoinsight.mapper.dto.mapping.ColumnMappingResponse;
import com.autoinsight.mapper.model.catalog.SchemaCatalog;
import com.autoinsight.mapper.model.catalog.SchemaDomain;
import com.autoinsight.mapper.model.catalog.StandardField;
import com.autoinsight.mapper.model.mapping.ColumnMapping;
import com.autoinsight.mapper.model.mapping.MappingMethod;
import com.autoinsight.mapper.model.profile.ColumnAnalysis;
import com.autoinsight.mapper.model.table.DataTable;
import com.autoinsight.mapper.service.catalog.SchemaCatalogRegistry;
import com.autoinsight.mapper.service.data_processing.CsvParsingService;
import com.autoinsight.mapper.service.mapping.HybridColumnMapperService;
import com.autoinsight.mapper.service.mapping.MappingValidationService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for the web layer: resolves the catalog, runs the requested mapping mode and
 * assembles the response.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ColumnMappingService {

  private final SchemaCatalogRegistry catalogRegistry;
  private final HybridColumnMapperService columnMapper;
  private final MappingValidationService validationService;
  private final CsvParsingService csvParsingService;
  private final MappingProperties properties;

  @Value("${app.defaults.max-rows:100000}")
  private Integer maxUploadRows;

  public List<CatalogDescription> listCatalogs() {
    List<CatalogDescription> descriptions = new ArrayList<>();
    for (SchemaCatalog catalog : catalogRegistry.getCatalogs()) {
      descriptions.add(
          CatalogDescription.builder()
              .domain(catalog.getName())
              .builtIn(SchemaDomain.fromCatalogName(catalog.getName()).isPresent())
              .fields(catalog.getFields())
              .requiredFields(
                  catalog.getRequiredFields().stream()
                      .map(StandardField::getName)
                      .collect(Collectors.toList()))
              .build());
    }
    return descriptions;
  }

  public ColumnMappingResponse mapTable(String domain, ColumnMappingRequest request) {
    return mapTable(
        domain,
        request.getTableName(),
        request.toDataTable(),
        request.getMode(),
        request.getNameWeight(),
        request.getDataWeight(),
        Boolean.TRUE.equals(request.getIncludeProfiles()));
  }

  public ColumnMappingResponse mapCsv(
      String domain, byte[] csvData, String fileName, String mode, Boolean includeProfiles)
      throws IOException {
    // fail on the domain before spending time on the file
    catalogRegistry.getCatalog(domain);
    DataTable table = csvParsingService.parse(csvData, maxUploadRows);
    return mapTable(
        domain,
        tableName(fileName),
        table,
        mode,
        null,
        null,
        Boolean.TRUE.equals(includeProfiles));
  }

  public ColumnMappingResponse mapTable(
      String domain,
      String tableName,
      DataTable table,
      String mode,
      Double nameWeight,
      Double dataWeight,
      boolean includeProfiles) {
    long start = System.currentTimeMillis();
    SchemaCatalog catalog = catalogRegistry.getCatalog(domain);
    MappingMethod method = mode == null ? MappingMethod.HYBRID : MappingMethod.fromValue(mode);

    double effectiveNameWeight = nameWeight != null ? nameWeight : properties.getNameWeight();
    double effectiveDataWeight = dataWeight != null ? dataWeight : properties.getDataWeight();

    Map<String, ColumnAnalysis> profiles = null;
    ColumnMapping mapping;
    if (method == MappingMethod.NAME_ONLY) {
      mapping = columnMapper.mapColumnsByName(table, catalog);
      if (includeProfiles) {
        profiles = columnMapper.analyzeColumns(table);
      }
    } else if (includeProfiles) {
      profiles = columnMapper.analyzeColumns(table);
      mapping =
          columnMapper.mapColumns(
              table, catalog, profiles, effectiveNameWeight, effectiveDataWeight);
    } else {
      mapping = columnMapper.mapColumns(table, catalog, effectiveNameWeight, effectiveDataWeight);
    }

    ColumnMappingResponse response =
        ColumnMappingResponse.builder()
            .tableName(tableName)
            .domain(catalog.getName())
            .mapping(mapping)
            .validation(validationService.validate(mapping, catalog))
            .summary(validationService.summarize(mapping, catalog))
            .profiles(profiles)
            .processingMetadata(
                ColumnMappingResponse.ProcessingMetadata.builder()
                    .columnCount(table.getColumnCount())
                    .rowCount(table.getRowCount())
                    .nameWeight(method == MappingMethod.HYBRID ? effectiveNameWeight : null)
                    .dataWeight(method == MappingMethod.HYBRID ? effectiveDataWeight : null)
                    .processingTimeMs(System.currentTimeMillis() - start)
                    .build())
            .build();

    log.info(
        "Mapped table '{}' to '{}' ({}): {} fields, valid={}",
        tableName,
        catalog.getName(),
        method.getValue(),
        mapping.size(),
        response.getValidation().isValid());
    return response;
  }

  public ApplyMappingResponse applyMapping(String domain, ColumnMappingRequest request) {
    DataTable table = request.toDataTable();
    ColumnMappingResponse mapped =
        mapTable(
            domain,
            request.getTableName(),
            table,
            request.getMode(),
            request.getNameWeight(),
            request.getDataWeight(),
            Boolean.TRUE.equals(request.getIncludeProfiles()));
    DataTable mappedTable = columnMapper.applyMapping(table, mapped.getMapping());
    return ApplyMappingResponse.builder()
        .domain(mapped.getDomain())
        .mapping(mapped.getMapping())
        .validation(mapped.getValidation())
        .columns(mappedTable.getColumnNames())
        .rowCount(mappedTable.getRowCount())
        .data(mappedTable.toRows())
        .build();
  }

  private String tableName(String fileName) {
    if (fileName == null || fileName.isEmpty()) {
      return "unnamed_table";
    }
    int lastDotIndex = fileName.lastIndexOf('.');
    return lastDotIndex > 0 ? fileName.substring(0, lastDotIndex) : fileName;
  }
}
