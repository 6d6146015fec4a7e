package com.autoinsight.mapper.controller;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.autoinsight.mapper.dto.quality.DataQualityReport;
import com.autoinsight.mapper.dto.table.TableDataRequest;
import com.autoinsight.mapper.service.data_processing.DataQualityService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/data")
@RequiredArgsConstructor
@Tag(name = "Data Quality", description = "Completeness and duplication checks")
public class DataQualityController {

  private final DataQualityService dataQualityService;

  @PostMapping(
      value = "/quality",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Data quality report",
      description = "Counts missing cells and duplicate rows and lists detected date columns")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Report computed",
            content = @Content(schema = @Schema(implementation = DataQualityReport.class))),
        @ApiResponse(responseCode = "400", description = "Malformed table", content = @Content)
      })
  public ResponseEntity<DataQualityReport> report(@Valid @RequestBody TableDataRequest request) {
    return ResponseEntity.ok(dataQualityService.report(request.toDataTable()));
  }
}
