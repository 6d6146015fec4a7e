package com.autoinsight.mapper.controller;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.autoinsight.mapper.dto.mapping.ApplyMappingResponse;
import com.autoinsight.mapper.dto.mapping.CatalogDescription;
import com.autoinsight.mapper.dto.mapping.ColumnMappingRequest;
import com.autoinsight.mapper.dto.mapping.ColumnMappingResponse;
import com.autoinsight.mapper.service.ColumnMappingService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Column Mapping", description = "Map user columns onto standard schema fields")
public class ColumnMappingController {

  private final ColumnMappingService columnMappingService;

  @Value("${app.upload.max-file-size:20971520}")
  private long maxFileSize;

  @Value("${app.upload.allowed-extensions:csv}")
  private Set<String> allowedExtensions;

  @GetMapping(value = "/mapping/catalogs", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "List schema catalogs",
      description = "Returns every registered domain with its standard fields and aliases")
  @ApiResponses(value = {@ApiResponse(responseCode = "200", description = "Catalog list")})
  public ResponseEntity<List<CatalogDescription>> listCatalogs() {
    return ResponseEntity.ok(columnMappingService.listCatalogs());
  }

  @PostMapping(
      value = "/mapping/{domain}",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Map table columns",
      description =
          "Infers which columns hold each standard field of the domain, using column names and,"
              + " in hybrid mode, the data itself")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Mapping computed",
            content = @Content(schema = @Schema(implementation = ColumnMappingResponse.class))),
        @ApiResponse(
            responseCode = "400",
            description = "Unknown domain, invalid weights or malformed table",
            content = @Content)
      })
  public ResponseEntity<ColumnMappingResponse> mapColumns(
      @Parameter(description = "Schema domain", example = "ecommerce") @PathVariable String domain,
      @Valid @RequestBody ColumnMappingRequest request) {
    log.info(
        "Received mapping request for domain '{}': {} columns, {} rows",
        domain,
        request.getColumns().size(),
        request.getData() != null ? request.getData().size() : 0);
    return ResponseEntity.ok(columnMappingService.mapTable(domain, request));
  }

  @PostMapping(
      value = "/mapping/{domain}/upload",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Map an uploaded CSV", description = "Parses the CSV and maps its columns")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Mapping computed",
            content = @Content(schema = @Schema(implementation = ColumnMappingResponse.class))),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid file or unknown domain",
            content = @Content)
      })
  public ResponseEntity<ColumnMappingResponse> mapUploadedFile(
      @PathVariable String domain,
      @Parameter(description = "CSV file", required = true) @RequestParam("file")
          MultipartFile file,
      @Parameter(description = "hybrid or name_only")
          @RequestParam(value = "mode", required = false)
          String mode,
      @RequestParam(value = "include_profiles", required = false) Boolean includeProfiles)
      throws IOException {
    validateFile(file);
    log.info("Received CSV upload '{}' for domain '{}'", file.getOriginalFilename(), domain);
    return ResponseEntity.ok(
        columnMappingService.mapCsv(
            domain, file.getBytes(), file.getOriginalFilename(), mode, includeProfiles));
  }

  @PostMapping(
      value = "/mapping/{domain}/apply",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Map and rename a table",
      description =
          "Maps the table, then returns only the mapped columns renamed to standard field names")
  public ResponseEntity<ApplyMappingResponse> applyMapping(
      @PathVariable String domain, @Valid @RequestBody ColumnMappingRequest request) {
    return ResponseEntity.ok(columnMappingService.applyMapping(domain, request));
  }

  @GetMapping("/health")
  @Operation(summary = "Health check", description = "Check if the mapping service is up")
  @ApiResponses(value = {@ApiResponse(responseCode = "200", description = "Service is healthy")})
  public ResponseEntity<Map<String, Object>> health() {
    return ResponseEntity.ok(Map.of("status", "UP", "timestamp", System.currentTimeMillis()));
  }

  private void validateFile(MultipartFile file) {
    if (file == null || file.isEmpty()) {
      throw new IllegalArgumentException("File is empty");
    }

    if (file.getSize() > maxFileSize) {
      throw new IllegalArgumentException(
          "File size exceeds maximum allowed size of " + maxFileSize + " bytes");
    }

    String fileName = file.getOriginalFilename();
    if (fileName == null || fileName.isEmpty()) {
      throw new IllegalArgumentException("File name is empty");
    }

    String extension = extractFileExtension(fileName);
    if (!allowedExtensions.contains(extension.toLowerCase(Locale.ROOT))) {
      throw new IllegalArgumentException(
          "File type not supported. Allowed types: " + allowedExtensions);
    }
  }

  private String extractFileExtension(String fileName) {
    int lastDotIndex = fileName.lastIndexOf('.');
    return (lastDotIndex == -1 || lastDotIndex == fileName.length() - 1)
        ? ""
        : fileName.substring(lastDotIndex + 1);
  }
}
